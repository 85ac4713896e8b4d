package com.cliffc.sea.type;

import com.cliffc.sea.util.SB;

// A 32-bit integer constant.  Arithmetic wraps like native int math.
public final class TypeInt extends Type {
  public final int _con;
  private TypeInt( int con ) { _con = con; }

  // Small constants are shared
  private static final TypeInt[] SMALL = new TypeInt[256];
  static { for( int i=0; i<SMALL.length; i++ ) SMALL[i] = new TypeInt(i-128); }
  public static TypeInt con( int con ) {
    return -128 <= con && con < 128 ? SMALL[con+128] : new TypeInt(con);
  }

  @Override public SB str( SB sb ) { return sb.p(_con); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof TypeInt t2 && _con==t2._con;
  }
  @Override public int hashCode() { return _con; }
}
