package com.cliffc.sea;

import com.cliffc.sea.node.NodePrinter;
import com.cliffc.sea.node.Region;
import com.cliffc.sea.node.UIDs;

// Result of one parse: either a graph from Start to End, or the error which
// stopped the parse.
public class Graph {
  public final Region _start;   // Null on error
  public final Region _end;     // Null on error
  public final UIDs _ids;       // Ids handed out, even on error
  public final ErrMsg _err;     // Null on success
  Graph( Region start, Region end, UIDs ids, ErrMsg err ) {
    _start = start; _end = end; _ids = ids; _err = err;
  }
  public boolean ok() { return _err==null; }

  // Dump of everything reachable from End, or the error message
  @Override public String toString() { return ok() ? NodePrinter.prettyPrint(_end) : _err.toString(); }
}
