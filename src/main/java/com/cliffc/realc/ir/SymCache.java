package com.cliffc.realc.ir;

import com.cliffc.realc.RealC;
import com.cliffc.realc.util.Ary;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

// Hash-consing (the flyweight pattern): never generate code to compute the
// same quantity twice.  The cache is keyed by one or more operands plus some
// operation K that combines them.  Operands are keyed in their lightweight Ref
// form, never as VarDefs: this avoids deep equality/hashing of a def, and
// lets a def and its ref memoize equally well.
class SymCache<K> {
  private final String _name;               // For debug printing
  private final Ary<VarDef> _log;           // Translator's definitions, in allocation order
  private final HashMap<Key,Sym> _cache = new HashMap<>();
  int _hits, _misses;

  SymCache( String name, Ary<VarDef> log ) { _name=name; _log=log; }

  // Probe each candidate key in order and return a VarRef to the first hit.
  // On a miss, allocate a Sym, define it as 'ir' applied to the first key's
  // canonical operands, and insert only the first key.  'ir' is not
  // called on a hit.
  IR memoize( List<IR[]> irKeys, K op, Function<Ref[],IR> ir ) {
    Key[] keys = new Key[irKeys.size()];
    for( int i=0; i<keys.length; i++ )
      keys[i] = new Key(refs(irKeys.get(i)),op);
    for( Key key : keys ) {
      Sym sym = _cache.get(key);
      if( sym != null ) {
        _hits++;
        return RealC.DEBUG ? RealC.p(sym._ref,_name+" hit "+sym) : sym._ref;
      }
    }
    _misses++;
    Sym sym = Sym.fresh();
    VarDef def = new VarDef(sym,ir.apply(keys[0]._refs),_log.len());
    _log.push(def);
    // Only once defined; a throwing builder leaves no entry behind
    _cache.put(keys[0],sym);
    return RealC.DEBUG ? RealC.p(def,_name+" "+def) : def;
  }

  int size() { return _cache.size(); }

  private static Ref[] refs( IR[] irs ) {
    Ref[] refs = new Ref[irs.length];
    for( int i=0; i<irs.length; i++ )
      refs[i] = Translator.ref(irs[i]);
    return refs;
  }

  // Operands plus operation
  private static final class Key {
    final Ref[] _refs;
    final Object _op;
    final int _hash;
    Key( Ref[] refs, Object op ) {
      _refs=refs; _op=op;
      _hash = Objects.hashCode(op)*31 + Arrays.hashCode(refs);
    }
    @Override public int hashCode() { return _hash; }
    @Override public boolean equals( Object o ) {
      if( this==o ) return true;
      return o instanceof Key key && _hash==key._hash &&
        Objects.equals(_op,key._op) && Arrays.equals(_refs,key._refs);
    }
  }
}
