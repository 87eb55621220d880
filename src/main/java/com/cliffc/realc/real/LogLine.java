package com.cliffc.realc.real;

import com.cliffc.realc.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

// Log-affine combination: sum(a*log(x)), i.e. the product of powers prod(x^a).
public class LogLine extends NonConstant {
  public final Map<NonConstant,Double> _ax;
  public LogLine( @NotNull Map<NonConstant,Double> ax ) { _ax = Line.coefficients(ax); }

  @Override public SB str(SB sb) {
    sb.p('(');
    for( Map.Entry<NonConstant,Double> e : _ax.entrySet() )
      e.getKey().str(sb).p('^').p(e.getValue()).p(" * ");
    return sb.p("1.0)");
  }
}
