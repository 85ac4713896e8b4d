package com.cliffc.sea.node;

import com.cliffc.sea.ErrMsg;
import com.cliffc.sea.Symbol;

// Merge values at a control-flow join.  Value i arrives along predecessor
// Region i.
public class PhiNode extends Node {
  public PhiNode( UIDs ids, Symbol sym, Region[] ctrls, Node... vals ) {
    super(ids,ctrls,null,vals);
    if( ctrls.length != vals.length )
      throw ErrMsg.invariant("Phi has "+vals.length+" values for "+ctrls.length+" regions").fatal();
    sym(sym);
  }
  @Override public String label() { return "Phi"; }
  @Override public boolean isPhi() { return true; }
}
