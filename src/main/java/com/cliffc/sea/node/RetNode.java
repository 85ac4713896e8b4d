package com.cliffc.sea.node;

// Function exit.  The optional input is the returned value; the Region is
// where the return was parsed.  All returns of a parse feed the End Region.
public class RetNode extends Node {
  public RetNode( UIDs ids, Region ctrl, Node val ) {
    super(ids,new Region[]{ctrl},null, val==null ? new Node[0] : new Node[]{val});
  }
  @Override public String label() { return "Return"; }
  // Returned value, or null for a bare "return;"
  public Node val() { return len()==0 ? null : in(0); }
}
