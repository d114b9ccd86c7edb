package org.replikativ.persistent_weighted_tree;

import java.util.*;

@SuppressWarnings("rawtypes")
public class JavaIter implements Iterator {
  Seq _seq;

  public JavaIter(Seq seq) {
    _seq = seq;
  }

  public boolean hasNext() {
    return _seq != null;
  }

  public Object next() {
    if (_seq == null) throw new NoSuchElementException();
    Object res = _seq.first();
    _seq = _seq.next();
    return res;
  }
}
