package com.cliffc.realc;

import com.cliffc.realc.ir.*;
import com.cliffc.realc.real.*;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

// Reference interpreter for tests: evaluates a Real directly, or runs a
// compiled Program.  Both must agree up to rounding.
public class Eval {
  final IdentityHashMap<Variable,Double> _env = new IdentityHashMap<>();

  public Eval bind( Variable v, double d ) { _env.put(v,d); return this; }

  public double real( Real r ) {
    if( r instanceof Variable v ) return _env.get(v);
    if( r instanceof Constant c ) return c._con;
    if( r instanceof Unary u ) return unary(u._op,real(u._x));
    if( r instanceof If i ) return real(i._test) != 0 ? real(i._whenNonZero) : real(i._whenZero);
    if( r instanceof Line l ) {
      double sum = l._b;
      for( Map.Entry<NonConstant,Double> e : l._ax.entrySet() )
        sum += e.getValue()*real(e.getKey());
      return sum;
    }
    if( r instanceof LogLine l ) {
      double prod = 1.0;
      for( Map.Entry<NonConstant,Double> e : l._ax.entrySet() )
        prod *= Math.pow(real(e.getKey()),e.getValue());
      return prod;
    }
    throw new IllegalArgumentException(r.toString());
  }

  public double[] program( Program prog ) {
    HashMap<Sym,Double> vals = new HashMap<>();
    for( VarDef def : prog.defs() )
      vals.put(def._sym,body(def._rhs,vals));
    Ref[] outs = prog.outputs();
    double[] res = new double[outs.length];
    for( int i=0; i<outs.length; i++ )
      res[i] = ref(outs[i],vals);
    return res;
  }

  private double body( IR ir, HashMap<Sym,Double> vals ) {
    if( ir instanceof UnaryIR u ) return unary(u._op,ref(u._x,vals));
    if( ir instanceof IfIR i ) return ref(i._test,vals) != 0 ? ref(i._whenNonZero,vals) : ref(i._whenZero,vals);
    BinaryIR b = (BinaryIR)ir;
    double l = ref(b._left,vals), r = ref(b._right,vals);
    return switch( b._op ) {
    case ADD -> l+r;
    case SUB -> l-r;
    case MUL -> l*r;
    case DIV -> l/r;
    case POW -> Math.pow(l,r);
    };
  }

  private double ref( Ref ref, HashMap<Sym,Double> vals ) {
    if( ref instanceof Parameter p ) return _env.get(p._x);
    if( ref instanceof Const c ) return c._con;
    Double d = vals.get(((VarRef)ref)._sym);
    if( d==null ) throw new IllegalStateException("used before defined: "+ref);
    return d;
  }

  private static double unary( UnaryOp op, double d ) {
    return switch( op ) {
    case EXP -> Math.exp(d);
    case LOG -> Math.log(d);
    case ABS -> Math.abs(d);
    };
  }
}
