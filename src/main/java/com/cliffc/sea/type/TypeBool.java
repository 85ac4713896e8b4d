package com.cliffc.sea.type;

import com.cliffc.sea.util.SB;

// Result of a folded comparison.  Exactly two instances.
public final class TypeBool extends Type {
  public final boolean _con;
  private TypeBool( boolean con ) { _con = con; }
  public static final TypeBool TRUE  = new TypeBool(true );
  public static final TypeBool FALSE = new TypeBool(false);
  public static TypeBool con( boolean b ) { return b ? TRUE : FALSE; }

  @Override public SB str( SB sb ) { return sb.p(_con); }
}
