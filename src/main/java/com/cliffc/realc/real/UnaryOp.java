package com.cliffc.realc.real;

public enum UnaryOp {
  EXP("exp"),
  LOG("log"),
  ABS("abs");

  public final String _name;
  UnaryOp( String name ) { _name = name; }
}
