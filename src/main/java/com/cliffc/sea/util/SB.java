package com.cliffc.sea.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the graph printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  public SB p( boolean s) { _sb.append(s); return this; }
  public SB s() { _sb.append(' '); return this; }
  // Pad with blanks out to column 'col'; always at least one blank
  public SB pad( int col ) {
    do _sb.append(' '); while( _sb.length() - lineStart() < col );
    return this;
  }
  private int lineStart() { return _sb.lastIndexOf("\n")+1; }
  public SB nl( ) { return p('\n'); }

  @Override public String toString() { return _sb.toString(); }
}
