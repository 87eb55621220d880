package com.cliffc.realc.real;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

public abstract class LineOps {

  // Pull a scale k out of ax+b, returning (a/k)x + b/k.  The scale is picked
  // so that as many normalized coefficients as possible are exactly 1.0,
  // which the lowering turns into bare terms.
  // Falls back to k==1 when dividing by k would overflow, or underflow into
  // the subnormals, for any coefficient or the intercept.
  public static Factored factor( Line line ) {
    double k = scale(line._ax,line._b);
    if( k==1.0 ) return new Factored(line._ax,line._b,1.0);
    Map<NonConstant,Double> ax = divide(line._ax,k);
    double b = line._b/k;
    return ax==null || !exact(line._b,b)
      ? new Factored(line._ax,line._b,1.0)
      : new Factored(ax,b,k);
  }

  // The most common coefficient magnitude, ties to the earliest in map order.
  // Negative when strictly more coefficients are negative than positive; a
  // non-zero intercept votes too.
  static double scale( Map<NonConstant,Double> ax, double b ) {
    if( ax.isEmpty() ) return 1.0;
    HashMap<Double,Integer> cnts = new HashMap<>();
    int pos=0, neg=0;
    for( double a : ax.values() ) {
      cnts.merge(Math.abs(a),1,Integer::sum);
      if( a > 0 ) pos++; else neg++;
    }
    if( b > 0 ) pos++;
    if( b < 0 ) neg++;
    double best=0;
    int bestcnt=0;
    for( double a : ax.values() ) {
      int cnt = cnts.get(Math.abs(a));
      if( cnt > bestcnt ) { best=Math.abs(a); bestcnt=cnt; }
    }
    return neg > pos ? -best : best;
  }

  // Divide every coefficient by k, or null if any quotient loses the value
  static Map<NonConstant,Double> divide( Map<NonConstant,Double> ax, double k ) {
    LinkedHashMap<NonConstant,Double> res = new LinkedHashMap<>();
    for( Map.Entry<NonConstant,Double> e : ax.entrySet() ) {
      double a = e.getValue()/k;
      if( !exact(e.getValue(),a) ) return null;
      res.put(e.getKey(),a);
    }
    return Collections.unmodifiableMap(res);
  }

  // Quotient q of a nonzero x is finite and normal; zero stays zero
  static boolean exact( double x, double q ) {
    return x==0.0 ? q==0.0 : Double.isFinite(q) && Math.abs(q) >= Double.MIN_NORMAL;
  }
}
