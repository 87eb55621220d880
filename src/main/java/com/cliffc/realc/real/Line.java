package com.cliffc.realc.real;

import com.cliffc.realc.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// Affine combination: sum(a*x) + b.  Coefficient order is insertion order,
// which fixes the order terms are lowered in.
public class Line extends NonConstant {
  public final Map<NonConstant,Double> _ax;
  public final double _b;
  public Line( @NotNull Map<NonConstant,Double> ax, double b ) {
    _ax = coefficients(ax);
    if( !Double.isFinite(b) ) throw new IllegalArgumentException("Line intercept must be finite, found "+b);
    _b = b;
  }

  @Override public SB str(SB sb) {
    sb.p('(');
    for( Map.Entry<NonConstant,Double> e : _ax.entrySet() )
      e.getKey().str(sb.p(e.getValue()).p('*')).p(" + ");
    return sb.p(_b).p(')');
  }

  // Copy and check a coefficient map.  Zero weights are terms the upstream
  // simplifier should have dropped.
  static Map<NonConstant,Double> coefficients( Map<NonConstant,Double> ax ) {
    LinkedHashMap<NonConstant,Double> copy = new LinkedHashMap<>();
    for( Map.Entry<NonConstant,Double> e : ax.entrySet() ) {
      NonConstant x = e.getKey();
      Double a = e.getValue();
      if( x==null || a==null ) throw new IllegalArgumentException("null term or coefficient");
      if( a==0.0 || !Double.isFinite(a) )
        throw new IllegalArgumentException("Bad coefficient "+a+" for term "+x);
      copy.put(x,a);
    }
    return Collections.unmodifiableMap(copy);
  }
}
