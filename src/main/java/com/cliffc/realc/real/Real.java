package com.cliffc.realc.real;

import com.cliffc.realc.util.SB;

// A scalar real-valued expression.  Trees are immutable and may share
// subtrees; two occurrences are the same subexpression iff they are the same
// object, so no Real overrides equals or hashCode.
public abstract class Real {

  // Default toString
  @Override public final String toString() { return str(new SB()).toString(); }

  // Everybody has to have a pretty print
  abstract public SB str(SB sb);
}
