package com.cliffc.realc;

import com.cliffc.realc.ir.*;
import com.cliffc.realc.real.*;
import org.junit.Test;

import static com.cliffc.realc.Reals.*;
import static org.junit.Assert.*;

public class TestCompiler {
  private final Variable a = var("a"), b = var("b"), x = var("x"), y = var("y");

  @Test public void testExample() {
    Program prog = Compiler.compile(line(5, a,1, b,-1));
    assertEquals("t0 = 5.0 + a\nt1 = t0 - b\nreturn t1\n",prog.toString());
    assertEquals(2,prog.nDefs());
    assertEquals(2,prog.allocated());
    assertEquals(0,prog.hits());
    assertEquals(2,prog.misses());
  }

  @Test public void testLeafProgram() {
    Program prog = Compiler.compile(line(0, x,1));
    assertEquals("return x\n",prog.toString());
    assertEquals(0,prog.nDefs());
    assertEquals(new Parameter(x),prog.output());
    assertEquals("return 3.0\n",Compiler.compile(new Constant(3)).toString());
  }

  @Test public void testNegatedLine() {
    assertEquals("t0 = -5.0 + x\nt1 = t0 + y\nt2 = 0.0 - t1\nreturn t2\n",
                 Compiler.compile(line(5, x,-1, y,-1)).toString());
  }

  // Outputs lowered together share their common parts
  @Test public void testSharedOutputs() {
    Line s = line(0, x,1, y,1);
    Program prog = Compiler.compile(s,exp(s),line(0, y,1, x,1));
    assertEquals("t0 = x + y\nt1 = exp(t0)\nreturn t0\nreturn t1\nreturn t0\n",prog.toString());
    Ref[] outs = prog.outputs();
    assertSame(outs[0],outs[2]);
    Sym t0 = ((VarRef)outs[0])._sym;
    assertEquals(3,prog.refCount(t0)); // Two outputs and the exp
    assertEquals(1,prog.hits());
  }

  @Test public void testRefCount() {
    Program prog = Compiler.compile(logLine(x,2, y,2));
    assertEquals("t0 = x * y\nt1 = t0 * t0\nreturn t1\n",prog.toString());
    VarDef[] defs = prog.defs();
    assertEquals(2,prog.refCount(defs[0]._sym));
    assertEquals(1,prog.refCount(defs[1]._sym));
    assertSame(defs[1],prog.def(defs[1]._sym));
    assertNull(prog.def(Sym.fresh()));
    assertEquals(0,prog.refCount(Sym.fresh()));
  }

  @Test public void testOutputNeedsOneOutput() {
    Program prog = Compiler.compile(x,y);
    IllegalStateException e = assertThrows(IllegalStateException.class, prog::output);
    assertTrue(e.getMessage(),e.getMessage().contains("2 outputs"));
  }

  // Extreme weights keep their value instead of being factored out
  @Test public void testExtremeWeights() {
    Line tiny = line(1.0, x,1e-320);
    Program prog = Compiler.compile(tiny);
    assertEquals("t0 = x * "+1e-320+"\nt1 = 1.0 + t0\nreturn t1\n",prog.toString());
    Eval e = new Eval().bind(x,2.0).bind(y,3.0);
    assertEquals(1.0,e.program(prog)[0],0);

    Line huge = line(1e-300, x,1e300, y,1e300);
    double[] res = e.program(Compiler.compile(huge));
    assertClose(e.real(huge),res[0]);
    assertClose(5e300,res[0]);
  }

  @Test public void testBadOutputs() {
    assertThrows(IllegalArgumentException.class, () -> Compiler.compile());
    assertThrows(NullPointerException.class, () -> Compiler.compile(x,null));
  }

  // Lowering does not change the value, up to rounding
  @Test public void testSameValue() {
    Variable z = var("z");
    LogLine ll = logLine(x,1, y,-1);
    Real inner = line(1.5, x,2, y,-3, ll,3, exp(z),0.5);
    Real out = iff(z, logLine(inner,2, exp(y),1, x,0.5), line(-2, log(x),-2, abs(inner),-2));
    Program prog = Compiler.compile(out,inner,ll);
    double[][] envs = {{1.5,2.0,0.0},{0.25,3.0,1.0},{4.0,0.5,-2.0},{2.0,2.0,0.5}};
    for( double[] env : envs ) {
      Eval e = new Eval().bind(x,env[0]).bind(y,env[1]).bind(z,env[2]);
      double[] res = e.program(prog);
      assertClose(e.real(out),res[0]);
      assertClose(e.real(inner),res[1]);
      assertClose(e.real(ll),res[2]);
    }
  }

  private static void assertClose( double expected, double actual ) {
    assertEquals(expected,actual,1e-9*Math.max(1.0,Math.abs(expected)));
  }
}
