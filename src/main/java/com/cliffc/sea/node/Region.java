package com.cliffc.sea.node;

import com.cliffc.sea.ErrMsg;
import com.cliffc.sea.util.SB;

/** A control-flow block; a basic block by another name.
 *
 *  Predecessors are fixed at construction.  The outgoing edges, successor
 *  Regions and output Nodes, are each set exactly once, usually by somebody
 *  other than the creator and only after both arms of an if are parsed.
 *  Reads before the set observe null.  A second set is a graph-building bug
 *  and fails fast.
 *
 *  A Region with no predecessors is the Start region.
 */
public class Region {
  public final int _uid;
  public final String _label;   // Debug label, e.g. "Start", "true"; may be null
  private final Region[] _ins;  // Predecessors
  private Region[] _outs;       // Successors; null until set
  private Node[] _nodes;        // Output nodes; null until set

  public Region( UIDs ids, String label, Region... ins ) {
    _uid = ids.region();
    _label = label;
    _ins = ins;
  }

  public int len() { return _ins.length; }
  public Region in( int i ) { return _ins[i]; }
  public boolean isStart() { return _ins.length==0; }

  // Successors; null if not yet set
  public Region[] outs() { return _outs; }
  // Output nodes; null if not yet set
  public Node[] nodes() { return _nodes; }
  public boolean isFinal() { return _outs!=null && _nodes!=null; }

  public Region set_outs( Region... outs ) {
    if( _outs != null ) throw ErrMsg.invariant("Region "+_uid+" successors already set").fatal();
    _outs = outs;
    return this;
  }
  public Region set_nodes( Node... nodes ) {
    if( _nodes != null ) throw ErrMsg.invariant("Region "+_uid+" output nodes already set").fatal();
    _nodes = nodes;
    return this;
  }

  // Fall through to a single successor, producing no values
  public Region jump( Region target ) {
    return set_nodes().set_outs(target);
  }

  @Override public String toString() { return NodePrinter.printLine(this,new SB()).toString(); }
}
