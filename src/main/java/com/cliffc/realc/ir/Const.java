package com.cliffc.realc.ir;

import com.cliffc.realc.util.SB;

import java.util.function.Function;

public final class Const extends Ref {
  public final double _con;
  public Const( double con ) { _con = con; }
  @Override public SB str( SB sb, Function<Sym,String> names ) { return sb.p(_con); }
  // Bitwise, so 0.0 and -0.0 stay apart and NaN matches itself
  @Override public boolean equals( Object o ) {
    return o instanceof Const c && Double.doubleToLongBits(c._con)==Double.doubleToLongBits(_con);
  }
  @Override public int hashCode() { return Double.hashCode(_con); }
}
