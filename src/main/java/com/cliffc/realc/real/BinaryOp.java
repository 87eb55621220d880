package com.cliffc.realc.real;

// Binary operators produced by the lowering.  Commutative operators let the
// hash-consing tables fold "x op y" and "y op x" into one definition.
public enum BinaryOp {
  ADD("+",true ),
  SUB("-",false),
  MUL("*",true ),
  DIV("/",false),
  POW("^",false);

  public final String _sym;     // Infix spelling, for printing
  private final boolean _commutative;
  BinaryOp( String sym, boolean commutative ) { _sym = sym; _commutative = commutative; }
  public boolean isCommutative() { return _commutative; }
}
