package com.cliffc.realc.ir;

import com.cliffc.realc.RealC;
import com.cliffc.realc.real.*;
import com.cliffc.realc.util.Ary;

import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

// Lowers Real trees into hash-consed IR.  One Translator per compilation:
// its tables and definition log are never shared.  Several roots may be
// lowered by the same Translator, and then share definitions.
public class Translator {
  // Every VarDef made, in allocation order.  Operands are always allocated
  // before their users, so this is also a valid emission order.
  private final Ary<VarDef> _defs = new Ary<>(VarDef.class);

  private final SymCache<BinaryOp> _binary = new SymCache<>("binary",_defs);
  private final SymCache<UnaryOp>  _unary  = new SymCache<>("unary" ,_defs);
  private final SymCache<Void>     _ifs    = new SymCache<>("if"    ,_defs);

  // Subtrees already lowered, by identity
  private final IdentityHashMap<Real,Ref> _memo = new IdentityHashMap<>();

  // Lower a Real to a Ref.  Lowering the same Real object again returns the
  // same Ref and allocates nothing.
  public Ref toIR( Real r ) {
    if( r instanceof Constant c ) return new Const(c._con);
    Ref ref = _memo.get(r);
    if( ref != null ) return ref;
    descend(r);
    return _memo.get(r);
  }

  // Lower all of r's unlowered descendants, then r, in post-order from an
  // explicit stack.  Deep Unary and If chains then never deepen the Java
  // stack: by the time a node is lowered its children hit the memo.
  private void descend( Real root ) {
    Set<Real> expanded = Collections.newSetFromMap(new IdentityHashMap<>());
    Ary<Real> stk = new Ary<>(Real.class);
    Ary<Real> kids = new Ary<>(Real.class);
    stk.push(root);
    while( !stk.isEmpty() ) {
      Real r = stk.last();
      if( expanded.add(r) ) {
        kids.clear();
        kids(r,kids);
        // Reverse push, so the first child is lowered first
        for( int i=kids.len()-1; i>=0; i-- ) {
          Real kid = kids.at(i);
          if( !(kid instanceof Constant) && !_memo.containsKey(kid) && !expanded.contains(kid) )
            stk.push(kid);
        }
      } else {
        stk.pop();
        if( !_memo.containsKey(r) )
          _memo.put(r,ref(lower(r)));
      }
    }
  }

  // Children lowered ahead of their parent.  A LogLine that is a term of a
  // Line may be lowered in the product ring with the Line's weight folded in
  // (see combineTerms), so only its own terms are lowered ahead.
  private static void kids( Real r, Ary<Real> kids ) {
    if( r instanceof Unary u ) kids.push(u._x);
    else if( r instanceof If i ) kids.push(i._test).push(i._whenNonZero).push(i._whenZero);
    else if( r instanceof LogLine l ) for( NonConstant x : l._ax.keySet() ) kids.push(x);
    else if( r instanceof Line l ) {
      for( NonConstant x : l._ax.keySet() )
        if( x instanceof LogLine ll ) for( NonConstant y : ll._ax.keySet() ) kids.push(y);
        else kids.push(x);
    }
  }

  // One lowering step; children are normally already in the memo.
  private IR lower( Real r ) {
    if( r instanceof Variable v ) return new Parameter(v);
    if( r instanceof Unary u ) return unaryIR(toIR(u._x),u._op);
    if( r instanceof If i ) return ifIR(toIR(i._whenNonZero),toIR(i._whenZero),toIR(i._test));
    if( r instanceof Line l ) return lineIR(l);
    if( r instanceof LogLine l ) return logLineIR(l);
    throw RealC.invariant("Unexpected Real "+r.getClass().getSimpleName()+": "+r);
  }

  IR unaryIR( IR x, UnaryOp op ) {
    return _unary.memoize(List.<IR[]>of(new IR[]{x}),op,refs -> new UnaryIR(refs[0],op));
  }

  // Commutative operators also probe the swapped operands, so x+y and y+x
  // share one definition.  Only the forward order is ever inserted.
  IR binaryIR( IR left, IR right, BinaryOp op ) {
    IR[] key = {left,right};
    List<IR[]> keys = op.isCommutative()
      ? List.of(key,new IR[]{right,left})
      : List.<IR[]>of(key);
    return _binary.memoize(keys,op,refs -> new BinaryIR(refs[0],refs[1],op));
  }

  IR ifIR( IR whenNonZero, IR whenZero, IR test ) {
    return _ifs.memoize(List.<IR[]>of(new IR[]{test,whenZero,whenNonZero}),
                        null,
                        refs -> new IfIR(refs[0],refs[1],refs[2]));
  }

  private IR lineIR( Line line ) {
    Factored f = LineOps.factor(line);
    return factoredLine(f._ax,f._b,f._k,Ring.SUM);
  }

  private IR logLineIR( LogLine line ) {
    Factored f = LogLineOps.factor(line);
    return factoredLine(f._ax,1.0,f._k,Ring.PRODUCT);
  }

  /**
   * Lowers k * (ax + b) for a Line, and (prod x^a * b)^k for a LogLine.  Read
   * it as the Line case; the LogLine case runs the same code in the product
   * ring where + is *, * is ^ and the identity is 1.0.
   * <p>
   * The summation is split into positively and negatively weighted terms.
   * The positive terms sum to x, the magnitudes of the negative terms sum to
   * y, and the result is x-y.  Each partial sum is a balanced binary tree,
   * which keeps the depth of the lowered expression logarithmic.
   * <p>
   * Most terms are a*x.  a==1 is just x; a==2 becomes x+x.  The whole result
   * is finally scaled by k, with shortcuts for 1, -1 and 2.
   */
  IR factoredLine( Map<? extends Real,Double> ax, double b, double k, Ring ring ) {
    Ary<Term> pos = new Ary<>(Term.class);
    Ary<Term> neg = new Ary<>(Term.class);
    if( b != ring._identity )
      pos.push(new Term(new Constant(b),1.0));
    for( Map.Entry<? extends Real,Double> e : ax.entrySet() ) {
      double a = e.getValue();
      if( a > 0.0 ) pos.push(new Term(e.getKey(), a));
      if( a < 0.0 ) neg.push(new Term(e.getKey(),-a));
    }

    IR ir;
    double sign;
    if( pos.isEmpty() && neg.isEmpty() ) { ir = new Const(ring._identity); sign = 1.0; }
    else if( pos.isEmpty() ) { ir = combineTerms(neg,ring); sign = -1.0; }
    else if( neg.isEmpty() ) { ir = combineTerms(pos,ring); sign =  1.0; }
    else {
      IR psum = combineTerms(pos,ring);
      IR nsum = combineTerms(neg,ring);
      ir = binaryIR(psum,nsum,ring._inverse);
      sign = 1.0;
    }

    double eff = k*sign;
    if( eff ==  1.0 ) return ir;
    if( eff == -1.0 ) return binaryIR(new Const(ring._identity),ir,ring._inverse);
    if( eff ==  2.0 ) return binaryIR(ir,ir,ring._combine);
    return binaryIR(ir,new Const(eff),ring._scale);
  }

  private IR combineTerms( Ary<Term> terms, Ring ring ) {
    Ary<IR> irs = new Ary<>(IR.class);
    for( Term t : terms )
      irs.push(term(t._x,t._a,ring));
    return combineTree(irs,ring);
  }

  // One weighted term.
  private IR term( Real x, double a, Ring ring ) {
    if( a == 1.0 ) return toIR(x);
    if( a == 2.0 ) return binaryIR(toIR(x),toIR(x),ring._combine);
    // a * prod(y^c) lowers as the product of the constant a with each y^c,
    // rather than lowering the product and multiplying it afterwards.
    if( ring == Ring.SUM && x instanceof LogLine l )
      return factoredLine(l._ax,a,1.0,Ring.PRODUCT);
    return binaryIR(toIR(x),new Const(a),ring._scale);
  }

  // Pairwise combine adjacent terms, halving the list each round.
  private IR combineTree( Ary<IR> irs, Ring ring ) {
    while( irs.len() > 1 ) {
      Ary<IR> half = new Ary<>(IR.class);
      for( int i=0; i<irs.len(); i+=2 )
        half.push(i+1 < irs.len() ? binaryIR(irs.at(i),irs.at(i+1),ring._combine) : irs.at(i));
      irs = half;
    }
    return irs.at(0);
  }

  // Canonical lightweight form: refs pass through, a def becomes a ref to
  // its own symbol.  Anything else means the lowering is broken.
  public static Ref ref( IR ir ) {
    if( ir instanceof Ref r ) return r;
    if( ir instanceof VarDef def ) return def._sym._ref;
    throw RealC.invariant("Should only see refs and vardefs, found "+
                          (ir==null ? "null" : ir.getClass().getSimpleName()+" "+ir));
  }

  // Definitions made so far, in allocation order.
  public VarDef[] defs() { return Arrays.copyOf(_defs._es,_defs._len); }
  public int nDefs() { return _defs.len(); }
  public int hits() { return _binary._hits + _unary._hits + _ifs._hits; }
  public int misses() { return _binary._misses + _unary._misses + _ifs._misses; }

  private static final class Term {
    final Real _x;
    final double _a;
    Term( Real x, double a ) { _x=x; _a=a; }
  }
}
