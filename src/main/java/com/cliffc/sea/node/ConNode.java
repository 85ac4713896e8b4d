package com.cliffc.sea.node;

import com.cliffc.sea.ErrMsg;
import com.cliffc.sea.type.Type;

// Constant value nodes; no computation needed.  Made for literals and for
// folded operators, and never has inputs.
public class ConNode extends Node {
  public ConNode( UIDs ids, Region ctrl, Type con ) {
    super(ids,new Region[]{ctrl},con);
    if( con == null ) throw ErrMsg.invariant("Constant node without a constant").fatal();
  }
  @Override public String label() { return "Con"; }
}
