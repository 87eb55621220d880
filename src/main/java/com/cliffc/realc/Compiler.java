package com.cliffc.realc;

import com.cliffc.realc.ir.Ref;
import com.cliffc.realc.ir.Translator;
import com.cliffc.realc.real.Real;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

// Compile a set of Real outputs into one Program.
public abstract class Compiler {

  // Outputs are lowered in order by one fresh Translator, so they share any
  // common subcomputation.  Nothing is kept between calls.
  public static @NotNull Program compile( @NotNull Real... outputs ) {
    if( outputs.length==0 ) throw new IllegalArgumentException("nothing to compile");
    Translator tr = new Translator();
    Ref[] refs = new Ref[outputs.length];
    for( int i=0; i<outputs.length; i++ )
      refs[i] = tr.toIR(Objects.requireNonNull(outputs[i],"null output"));
    Program prog = new Program(refs,tr);
    return RealC.DEBUG ? RealC.p(prog,"compiled "+prog.nDefs()+" defs, "+prog.hits()+" cache hits") : prog;
  }
}
