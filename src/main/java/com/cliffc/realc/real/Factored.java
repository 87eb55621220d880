package com.cliffc.realc.real;

import java.util.Map;

// A normalized combination plus the scale factored out of it:
// k * (sum(a*x) + b) for a Line, or (prod(x^a))^k for a LogLine (b is 1.0).
public final class Factored {
  public final Map<NonConstant,Double> _ax;
  public final double _b;
  public final double _k;
  Factored( Map<NonConstant,Double> ax, double b, double k ) { _ax=ax; _b=b; _k=k; }
}
