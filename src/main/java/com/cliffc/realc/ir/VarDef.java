package com.cliffc.realc.ir;

import com.cliffc.realc.util.SB;

import java.util.function.Function;

// Introduces one new named value.  _idx is its position in the translator's
// definition log, i.e. allocation order.
public final class VarDef extends IR {
  public final Sym _sym;
  public final IR _rhs;
  public final int _idx;
  VarDef( Sym sym, IR rhs, int idx ) {
    assert !(rhs instanceof Ref) && !(rhs instanceof VarDef) : "definition body must be an operation: "+rhs;
    _sym=sym; _rhs=rhs; _idx=idx;
  }
  @Override public Ref[] args() { return _rhs.args(); }
  @Override public SB str( SB sb, Function<Sym,String> names ) {
    return _rhs.str(sb.p(names.apply(_sym)).p(" = "),names);
  }
}
