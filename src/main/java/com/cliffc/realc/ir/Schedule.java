package com.cliffc.realc.ir;

import com.cliffc.realc.RealC;
import com.cliffc.realc.util.Ary;
import com.cliffc.realc.util.VBitSet;

import java.util.HashMap;

// Emission order for a set of outputs: every definition reachable from an
// output, each after the definitions it reads.
public abstract class Schedule {

  // 'log' is a translator's definition log.  Allocation order is already
  // topological, so the schedule is the log filtered down to what the
  // outputs reach.  Reachability uses a worklist, not recursion.
  public static VarDef[] of( Ref[] outputs, VarDef[] log ) {
    HashMap<Sym,VarDef> bysym = new HashMap<>();
    for( VarDef def : log ) bysym.put(def._sym,def);

    VBitSet live = new VBitSet();
    Ary<VarDef> work = new Ary<>(VarDef.class);
    for( Ref out : outputs ) mark(out,bysym,live,work);
    while( !work.isEmpty() )
      for( Ref arg : work.pop().args() )
        mark(arg,bysym,live,work);

    Ary<VarDef> sched = new Ary<>(VarDef.class);
    for( VarDef def : log )
      if( live.test(def._idx) )
        sched.push(def);
    return sched.asAry();
  }

  private static void mark( Ref ref, HashMap<Sym,VarDef> bysym, VBitSet live, Ary<VarDef> work ) {
    if( !(ref instanceof VarRef vr) ) return;
    VarDef def = bysym.get(vr._sym);
    if( def==null ) throw RealC.invariant("No definition for "+vr._sym+"; symbol from another translator?");
    if( !live.tset(def._idx) ) work.push(def);
  }
}
