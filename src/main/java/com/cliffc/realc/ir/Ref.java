package com.cliffc.realc.ir;

// A lightweight, O(1)-comparable handle: a Parameter, a Const or a VarRef.
// Hash-consing keys are built only from these.
public abstract class Ref extends IR {
}
