package com.cliffc.sea.node;

import com.cliffc.sea.util.Ary;
import com.cliffc.sea.util.SB;

import java.util.BitSet;

// Graph traversal and pretty-printing.
public abstract class NodePrinter {

  // Print the graph reachable from 'root', one line per Region or Node,
  // inputs before uses.
  public static String prettyPrint( Region root ) {
    Ary<Object> order = new Ary<>(Object.class);
    _walk(root,new BitSet(),new BitSet(),order);
    SB sb = new SB();
    for( Object x : order ) {
      if( x instanceof Region r ) printLine(r,sb);
      else printLine((Node)x,sb);
      sb.nl();
    }
    return sb.toString();
  }

  /** Depth-first walk from 'root'.  Predecessor Regions come before the
   *  Region, then the Region's output Nodes.  A Node's inputs come before the
   *  Node; a Phi's Regions come before their paired values.  Each entity is
   *  visited once, however many merge points share it.
   *  @param rs Regions, appended in visit order
   *  @param ns Nodes, appended in visit order */
  public static void walk( Region root, Ary<Region> rs, Ary<Node> ns ) {
    Ary<Object> order = new Ary<>(Object.class);
    _walk(root,new BitSet(),new BitSet(),order);
    for( Object x : order ) {
      if( x instanceof Region r ) rs.add(r);
      else ns.add((Node)x);
    }
  }

  // Visited sets are per entity kind, since Node and Region ids overlap
  private static void _walk( Region r, BitSet rvisit, BitSet nvisit, Ary<Object> order ) {
    if( tset(rvisit,r._uid) ) return;
    for( int i=0; i<r.len(); i++ )
      _walk(r.in(i),rvisit,nvisit,order);
    order.add(r);
    Node[] nodes = r.nodes();
    if( nodes != null )
      for( Node n : nodes )
        _walk(n,rvisit,nvisit,order);
  }

  private static void _walk( Node n, BitSet rvisit, BitSet nvisit, Ary<Object> order ) {
    if( tset(nvisit,n._uid) ) return;
    for( int i=0; i<n.len(); i++ ) {
      if( n.isPhi() ) _walk(n.ctrl(i),rvisit,nvisit,order);
      _walk(n.in(i),rvisit,nvisit,order);
    }
    order.add(n);
  }

  // Test-and-set
  private static boolean tset( BitSet bs, int idx ) { boolean b = bs.get(idx); bs.set(idx); return b; }

  // Print a region on 1 line, as:
  // rID  Region(label)        <- rPRED rPRED => nOUT nOUT
  static SB printLine( Region r, SB sb ) {
    sb.p('r').p(r._uid).pad(5).p("Region");
    if( r._label != null ) sb.p('(').p(r._label).p(')');
    if( r.len() > 0 ) {
      sb.pad(26).p("<-");
      for( int i=0; i<r.len(); i++ ) sb.s().p('r').p(r.in(i)._uid);
    }
    Node[] nodes = r.nodes();
    if( nodes != null && nodes.length > 0 ) {
      sb.p(" =>");
      for( Node n : nodes ) sb.s().p('n').p(n._uid);
    }
    return sb;
  }

  // Print a node on 1 line, as:
  // nID  LABEL CON   SYM      <- nDEF nDEF
  // nID  Phi         SYM      <- rCTRL:nDEF rCTRL:nDEF
  static SB printLine( Node n, SB sb ) {
    sb.p('n').p(n._uid).pad(5).p(n.label());
    if( n.is_con() ) n.con().str(sb.s());
    if( n.sym() != null ) sb.pad(18).p(n.sym()._name);
    if( n.len() > 0 ) {
      sb.pad(26).p("<-");
      for( int i=0; i<n.len(); i++ ) {
        sb.s();
        if( n.isPhi() ) sb.p('r').p(n.ctrl(i)._uid).p(':');
        sb.p('n').p(n.in(i)._uid);
      }
    }
    return sb;
  }
}
