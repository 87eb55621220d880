package com.cliffc.realc.util;

import java.util.BitSet;

// Visit set, keyed by a dense index.
public class VBitSet extends BitSet {
  // Cannot override 'set' to return a value... :-P
  public boolean tset(int idx) { boolean b = get(idx); set(idx); return b; }
  public boolean test(int idx) { return get(idx); }
}
