package com.cliffc.sea.node;

/** Source of unique dense ids for Nodes and Regions.  One per parse, so
 *  parses are independent and repeatable; ids start at 1 and strictly
 *  increase in creation order. */
public final class UIDs {
  private int _nid=1;           // Do not hand out UID 0
  private int _rid=1;
  int node  () { return _nid++; }
  int region() { return _rid++; }
  // Count of Nodes and Regions handed out so far
  public int nodes  () { return _nid-1; }
  public int regions() { return _rid-1; }
}
