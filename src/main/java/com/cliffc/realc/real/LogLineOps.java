package com.cliffc.realc.real;

import java.util.Map;

public abstract class LogLineOps {

  // Pull a power k out of prod(x^a), returning prod(x^(a/k)).  Same choice of
  // k as for a Line with no intercept, and the same fallback to k==1.
  public static Factored factor( LogLine line ) {
    double k = LineOps.scale(line._ax,0.0);
    Map<NonConstant,Double> ax = k==1.0 ? null : LineOps.divide(line._ax,k);
    return ax==null
      ? new Factored(line._ax,1.0,1.0)
      : new Factored(ax,1.0,k);
  }
}
