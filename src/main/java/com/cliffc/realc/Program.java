package com.cliffc.realc;

import com.cliffc.realc.ir.*;

import java.util.Arrays;
import java.util.HashMap;

// The result of a compilation: output references plus the definitions they
// need, in an order where each definition follows the ones it reads.
public class Program {
  final Ref[] _outputs;
  final VarDef[] _defs;         // Emission order
  final int _allocated;         // Definitions made by the translator, reachable or not
  final int _hits, _misses;     // Hash-consing statistics
  private final HashMap<Sym,VarDef> _bysym = new HashMap<>();
  private final HashMap<Sym,Integer> _uses = new HashMap<>();

  Program( Ref[] outputs, Translator tr ) {
    _outputs = outputs;
    _defs = Schedule.of(outputs,tr.defs());
    _allocated = tr.nDefs();
    _hits = tr.hits();
    _misses = tr.misses();
    for( VarDef def : _defs ) {
      _bysym.put(def._sym,def);
      for( Ref arg : def.args() ) use(arg);
    }
    for( Ref out : _outputs ) use(out);
  }
  private void use( Ref ref ) {
    if( ref instanceof VarRef vr ) _uses.merge(vr._sym,1,Integer::sum);
  }

  public Ref[] outputs() { return Arrays.copyOf(_outputs,_outputs.length); }
  // The single output of a one-output compilation
  public Ref output() {
    if( _outputs.length!=1 ) throw RealC.invariant("Program has "+_outputs.length+" outputs, not 1");
    return _outputs[0];
  }
  public VarDef[] defs() { return Arrays.copyOf(_defs,_defs.length); }
  public int nDefs() { return _defs.length; }
  public VarDef def( Sym sym ) { return _bysym.get(sym); }

  // Count of operand slots and outputs reading 'sym'.  A value read once can
  // be left on a stack by the code generator; others want a local.
  public int refCount( Sym sym ) {
    Integer cnt = _uses.get(sym);
    return cnt==null ? 0 : cnt;
  }

  public int allocated() { return _allocated; }
  public int hits() { return _hits; }
  public int misses() { return _misses; }

  @Override public String toString() { return IRPrinter.prettyPrint(_defs,_outputs); }
}
