package com.cliffc.realc.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( double s ) {
    if( Double.isNaN(s) )
      _sb.append("NaN");
    else if( Double.isInfinite(s) ) {
      _sb.append(s > 0 ? "Infinity" : "-Infinity");
    } else _sb.append(s);
    return this;
  }
  public SB p( char   s ) { _sb.append(s); return this; }
  // Not spelled "p" on purpose: too easy to accidentally say "p(1.0)" and
  // suddenly call the autoboxed version.
  public SB pobj( Object s ) { _sb.append(s.toString()); return this; }
  public SB s() { _sb.append(' '); return this; }

  public SB nl( ) { return p('\n'); }

  @Override public String toString() { return _sb.toString(); }
}
