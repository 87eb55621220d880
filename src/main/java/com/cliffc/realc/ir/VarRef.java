package com.cliffc.realc.ir;

import com.cliffc.realc.util.SB;

import java.util.function.Function;

// Read of a defined symbol.  Made only by Sym, one per symbol, so the
// default identity equals is value equality.
public final class VarRef extends Ref {
  public final Sym _sym;
  VarRef( Sym sym ) { _sym = sym; }
  @Override public SB str( SB sb, Function<Sym,String> names ) { return sb.p(names.apply(_sym)); }
}
