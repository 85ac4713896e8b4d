package com.cliffc.sea;

import com.cliffc.sea.node.Region;

// Parse a whole program into a Graph.  The one place a FatalErr is caught;
// whether to print it and exit is the caller's business.
public abstract class Exec {
  public static Graph go( String src, String str ) { return go(src,str,SEA.DO_FOLD); }

  public static Graph go( String src, String str, boolean fold ) {
    Parse P = new Parse(src,str,fold);
    try {
      Region end = P.prog();
      return new Graph(P.start(),end,P.ids(),null);
    } catch( FatalErr fe ) {
      SEA.p(null,"parse of "+src+" failed: "+fe._err._lvl);
      return new Graph(null,null,P.ids(),fe._err);
    }
  }
}
