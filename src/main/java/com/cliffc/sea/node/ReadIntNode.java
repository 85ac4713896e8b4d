package com.cliffc.sea.node;

// External integer input.  Never constant, so never folds.
public class ReadIntNode extends Node {
  public ReadIntNode( UIDs ids, Region ctrl ) { super(ids,new Region[]{ctrl},null); }
  @Override public String label() { return "ReadInt"; }
}
