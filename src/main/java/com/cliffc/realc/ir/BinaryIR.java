package com.cliffc.realc.ir;

import com.cliffc.realc.real.BinaryOp;
import com.cliffc.realc.util.SB;

import java.util.function.Function;

public final class BinaryIR extends IR {
  public final Ref _left, _right;
  public final BinaryOp _op;
  public BinaryIR( Ref left, Ref right, BinaryOp op ) { _left=left; _right=right; _op=op; }
  @Override public Ref[] args() { return new Ref[]{_left,_right}; }
  @Override public SB str( SB sb, Function<Sym,String> names ) {
    _left.str(sb,names).s().p(_op._sym).s();
    return _right.str(sb,names);
  }
}
