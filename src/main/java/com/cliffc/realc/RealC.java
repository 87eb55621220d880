package com.cliffc.realc;

/** Lowering of symbolic Real expressions into a hash-consed IR.
 */

public abstract class RealC {
  // Thrown when the IR is not the shape the lowering expects; these are bugs
  // in the compiler (or a malformed collaborator), never user errors.
  public static RuntimeException invariant( String msg ) { return new IllegalStateException(msg); }

  // Global debug printing.  When set, the translator reports every new
  // definition and every cache hit on stderr.
  public static boolean DEBUG = false;

  // Debug printers
  public static <T> T p(T x, String s) {
    if( !DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
