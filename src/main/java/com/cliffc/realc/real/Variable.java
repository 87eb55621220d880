package com.cliffc.realc.real;

import com.cliffc.realc.util.SB;

import java.util.Objects;

// An input slot.  The name is for printing only; two Variables with the same
// name are still different inputs.
public class Variable extends NonConstant {
  public final String _name;
  public Variable( String name ) { _name = Objects.requireNonNull(name); }
  @Override public SB str(SB sb) { return sb.p(_name); }
}
