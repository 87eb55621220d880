package com.cliffc.realc.ir;

import com.cliffc.realc.util.SB;

import java.util.function.Function;

// Operands are stored test, whenZero, whenNonZero; the hash-consing key uses
// the same order.
public final class IfIR extends IR {
  public final Ref _test, _whenZero, _whenNonZero;
  public IfIR( Ref test, Ref whenZero, Ref whenNonZero ) { _test=test; _whenZero=whenZero; _whenNonZero=whenNonZero; }
  @Override public Ref[] args() { return new Ref[]{_test,_whenZero,_whenNonZero}; }
  @Override public SB str( SB sb, Function<Sym,String> names ) {
    _test       .str(sb,names).p(" ? ");
    _whenNonZero.str(sb,names).p(" : ");
    return _whenZero.str(sb,names);
  }
}
