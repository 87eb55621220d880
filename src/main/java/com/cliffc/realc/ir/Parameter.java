package com.cliffc.realc.ir;

import com.cliffc.realc.real.Variable;
import com.cliffc.realc.util.SB;

import java.util.function.Function;

public final class Parameter extends Ref {
  public final Variable _x;
  public Parameter( Variable x ) { _x = x; }
  @Override public SB str( SB sb, Function<Sym,String> names ) { return sb.p(_x._name); }
  // Same input slot, by identity
  @Override public boolean equals( Object o ) { return o instanceof Parameter p && p._x==_x; }
  @Override public int hashCode() { return System.identityHashCode(_x); }
}
