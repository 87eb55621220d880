package com.cliffc.realc.ir;

import com.cliffc.realc.real.UnaryOp;
import com.cliffc.realc.util.SB;

import java.util.function.Function;

public final class UnaryIR extends IR {
  public final Ref _x;
  public final UnaryOp _op;
  public UnaryIR( Ref x, UnaryOp op ) { _x=x; _op=op; }
  @Override public Ref[] args() { return new Ref[]{_x}; }
  @Override public SB str( SB sb, Function<Sym,String> names ) {
    return _x.str(sb.p(_op._name).p('('),names).p(')');
  }
}
