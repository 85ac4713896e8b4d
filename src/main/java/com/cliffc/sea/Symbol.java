package com.cliffc.sea;

// A declared variable.  Identity, not name, is what matters: two scopes can
// each define an "x" and get two distinct Symbols.  Never mutated.
public final class Symbol {
  public final String _name;    // As spelled at the declaration
  Symbol( String name ) { _name = name; }
  @Override public String toString() { return _name; }
}
