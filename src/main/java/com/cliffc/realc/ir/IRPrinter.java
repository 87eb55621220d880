package com.cliffc.realc.ir;

import com.cliffc.realc.util.SB;

import java.util.HashMap;

// Bulk pretty-printer.  One definition per line in emission order, then the
// outputs.  Symbols are renamed t0, t1, ... in emission order so the text
// does not depend on the global symbol counter.
public abstract class IRPrinter {

  public static String prettyPrint( VarDef[] defs, Ref[] outputs ) {
    return _pp(defs,outputs,new SB()).toString();
  }

  static SB _pp( VarDef[] defs, Ref[] outputs, SB sb ) {
    HashMap<Sym,String> names = new HashMap<>();
    for( VarDef def : defs )
      names.put(def._sym,"t"+names.size());
    for( VarDef def : defs )
      def.str(sb,sym -> name(names,sym)).nl();
    for( Ref out : outputs )
      out.str(sb.p("return "),sym -> name(names,sym)).nl();
    return sb;
  }

  // Symbols outside the printed set keep their global name
  private static String name( HashMap<Sym,String> names, Sym sym ) {
    String s = names.get(sym);
    return s==null ? sym.toString() : s;
  }
}
