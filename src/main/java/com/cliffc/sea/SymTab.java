package com.cliffc.sea;

import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Locale;

/** One lexical scope: a case-insensitive name to Symbol map, plus a link to
 *  the enclosing scope.  The parent link forms the scope chain; a scope does
 *  not own its parent.  Scopes are only ever mutated by {@link #define}.
 */
public class SymTab {
  public final SymTab _par;     // Enclosing scope, or null at the root
  private final HashMap<String,Symbol> _syms = new HashMap<>();

  public SymTab( SymTab par ) { _par = par; }

  private static String key( String name ) { return name.toLowerCase(Locale.ROOT); }

  /** Define a new symbol in this exact scope.  Shadowing an outer scope's
   *  name is allowed.
   *  @param bad location to blame on error, or null
   *  @throws FatalErr DuplicateSymbol if the name is already in this scope */
  public @NotNull Symbol define( String name, Parse bad ) {
    String k = key(name);
    if( _syms.containsKey(k) ) throw ErrMsg.duplicate(bad,name).fatal();
    Symbol sym = new Symbol(name);
    _syms.put(k,sym);
    return sym;
  }

  // Lookup in this scope only, or null
  public Symbol get( String name ) { return _syms.get(key(name)); }

  /** Resolve a name, innermost scope first.
   *  @throws FatalErr UnknownSymbol if not found anywhere on the chain */
  public @NotNull Symbol resolve( String name, Parse bad ) {
    for( SymTab s = this; s!=null; s = s._par ) {
      Symbol sym = s.get(name);
      if( sym != null ) return sym;
    }
    throw ErrMsg.unknown(bad,name).fatal();
  }

  // Number of scopes on the chain, including this one
  public int depth() {
    int d=0;
    for( SymTab s = this; s!=null; s = s._par ) d++;
    return d;
  }
}
