package com.cliffc.sea.node;

import com.cliffc.sea.Symbol;
import com.cliffc.sea.type.Type;
import com.cliffc.sea.util.SB;

// Sea-of-Nodes.  A value-producing operation; its inputs are other Nodes.
// Structure is fixed at construction.  The only later change allowed is
// attaching a debug Symbol, once.
public abstract class Node {

  // --------------------------------------------------------------------------
  // Unique dense node-numbering, from the per-parse UIDs
  public final int _uid;

  // Defs.  Fixed length, ordered, no nulls.
  private final Node[] _defs;

  // Control.  For Phis, one Region per def: the predecessor path the value
  // arrives on.  Otherwise just the Region active when the Node was made,
  // kept for debugging.
  private final Region[] _ctrls;

  // Known result at parse time, or null
  final Type _con;

  // Debug-only name of the variable this value was assigned to
  private Symbol _sym;

  Node( UIDs ids, Region[] ctrls, Type con, Node... defs ) {
    _uid = ids.node();
    _ctrls = ctrls;
    _defs = defs;
    _con = con;
  }

  // String label, unique per node class.  E.g. "Add" or "Phi"
  public abstract String label();

  public int len() { return _defs.length; }
  public Node in( int i ) { return _defs[i]; }
  public int nCtrls() { return _ctrls.length; }
  public Region ctrl( int i ) { return _ctrls[i]; }

  public Type con() { return _con; }
  public boolean is_con() { return _con != null; }

  public Symbol sym() { return _sym; }
  // Attach a debug name; the first name given sticks.
  public Node sym( Symbol sym ) {
    if( _sym==null ) _sym = sym;
    return this;
  }

  // Phis pair each def with a Region; everybody else just has defs
  public boolean isPhi() { return false; }

  // Debugger printing: one line, same as the graph dump
  @Override public final String toString() { return NodePrinter.printLine(this,new SB()).toString(); }
}
