package com.cliffc.realc.ir;

import java.util.concurrent.atomic.AtomicInteger;

// A named computed value.  Ids come from one process-wide counter, so
// symbols from independent compilations never collide even when they run
// concurrently.  Each Sym carries its one and only VarRef.
public final class Sym implements Comparable<Sym> {
  private static final AtomicInteger CNT = new AtomicInteger();

  public final int _id;
  public final VarRef _ref;
  private Sym( int id ) { _id = id; _ref = new VarRef(this); }

  public static Sym fresh() { return new Sym(CNT.getAndIncrement()); }

  @Override public int compareTo( Sym sym ) { return Integer.compare(_id,sym._id); }
  @Override public String toString() { return "$"+_id; }
}
