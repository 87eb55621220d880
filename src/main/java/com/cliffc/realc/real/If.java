package com.cliffc.realc.real;

import com.cliffc.realc.util.SB;

import java.util.Objects;

// Conditional: whenNonZero if test is not zero, else whenZero.
public class If extends NonConstant {
  public final Real _test, _whenNonZero, _whenZero;
  public If( Real test, Real whenNonZero, Real whenZero ) {
    _test        = Objects.requireNonNull(test);
    _whenNonZero = Objects.requireNonNull(whenNonZero);
    _whenZero    = Objects.requireNonNull(whenZero);
  }
  @Override public SB str(SB sb) {
    _test.str(sb.p('(')).p(" ? ");
    _whenNonZero.str(sb).p(" : ");
    return _whenZero.str(sb).p(')');
  }
}
