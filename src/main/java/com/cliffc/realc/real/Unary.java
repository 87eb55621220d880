package com.cliffc.realc.real;

import com.cliffc.realc.util.SB;

import java.util.Objects;

public class Unary extends NonConstant {
  public final Real _x;
  public final UnaryOp _op;
  public Unary( Real x, UnaryOp op ) { _x = Objects.requireNonNull(x); _op = Objects.requireNonNull(op); }
  @Override public SB str(SB sb) { return _x.str(sb.p(_op._name).p('(')).p(')'); }
}
