package com.cliffc.sea.type;

import com.cliffc.sea.util.SB;

/** Compile-time constant values.  A Node with a non-null Type has a result
 *  known at parse time; a Node without one is computed at run time.  Only
 *  two flavors exist: integers and booleans.
 */
public abstract class Type {
  // Human-readable constant, e.g. "13" or "true"
  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }
}
