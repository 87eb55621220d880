package com.cliffc.realc.real;

// Every Real except a Constant.  Only these may appear as terms of a Line or
// LogLine; constants are folded into the intercept or the scale instead.
public abstract class NonConstant extends Real {
}
