package com.cliffc.realc.real;

import com.cliffc.realc.util.SB;

public class Constant extends Real {
  public final double _con;
  public Constant( double con ) { _con = con; }
  @Override public SB str(SB sb) { return sb.p(_con); }
}
