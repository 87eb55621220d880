package com.cliffc.realc.ir;

import com.cliffc.realc.real.BinaryOp;

// The algebra a combination is lowered in.  Written for a Line this is
// ordinary + - * over 0.0.  A LogLine reuses the same lowering where "+" is
// multiply, "-" is divide, scaling is exponentiation and the identity is
// 1.0.  (Pedantically the product side is a rig, not a ring: nothing gets
// divided by zero that was not already divided by zero.)
public final class Ring {
  public final BinaryOp _combine;   // Sum of two terms
  public final BinaryOp _inverse;   // Difference of two terms
  public final BinaryOp _scale;     // Term times a constant weight
  public final double _identity;    // Empty combination

  private Ring( BinaryOp combine, BinaryOp inverse, BinaryOp scale, double identity ) {
    _combine=combine; _inverse=inverse; _scale=scale; _identity=identity;
  }

  public static final Ring SUM     = new Ring(BinaryOp.ADD,BinaryOp.SUB,BinaryOp.MUL,0.0);
  public static final Ring PRODUCT = new Ring(BinaryOp.MUL,BinaryOp.DIV,BinaryOp.POW,1.0);

  @Override public String toString() { return this==SUM ? "sum" : "product"; }
}
