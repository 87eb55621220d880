package com.cliffc.realc.ir;

import com.cliffc.realc.util.SB;

import java.util.function.Function;

// Lowered values.  References (Parameter, Const, VarRef) are flat handles;
// everything else is the body of a VarDef and reads only References.
public abstract class IR {
  static final Ref[] NO_ARGS = new Ref[0];

  // Operands read by this value; References read nothing.
  public Ref[] args() { return NO_ARGS; }

  // Print, naming symbols with 'names'
  abstract public SB str( SB sb, Function<Sym,String> names );

  @Override public final String toString() { return str(new SB(),Sym::toString).toString(); }
}
