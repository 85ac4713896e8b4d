package com.cliffc.sea.node;

import com.cliffc.sea.ErrMsg;
import com.cliffc.sea.FatalErr;
import com.cliffc.sea.Symbol;
import com.cliffc.sea.SymTab;
import com.cliffc.sea.type.TypeBool;
import com.cliffc.sea.type.TypeInt;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestPrimNode {
  private static final int[] VALS = {0, 1, -1, 7, -13, 1000, Integer.MAX_VALUE, Integer.MIN_VALUE};

  // Folding matches native int math, wrap-around included
  @Test public void testFold() {
    for( int a : VALS )
      for( int b : VALS ) {
        assertEquals(TypeInt.con(a+b),PrimNode.fold('+',a,b));
        assertEquals(TypeInt.con(a-b),PrimNode.fold('-',a,b));
        assertEquals(TypeInt.con(a*b),PrimNode.fold('*',a,b));
        assertSame(TypeBool.con(a<b),PrimNode.fold('<',a,b));
        assertSame(TypeBool.con(a>b),PrimNode.fold('>',a,b));
      }
  }

  @Test public void testBadOp() {
    try { PrimNode.fold('/',1,2); fail(); }
    catch( FatalErr fe ) { assertEquals(ErrMsg.Level.Invariant,fe.level()); }
    UIDs ids = new UIDs();
    Region r = new Region(ids,"Start");
    Node x = new ReadIntNode(ids,r);
    try { PrimNode.make(ids,r,'%',x,x); fail(); }
    catch( FatalErr fe ) { assertEquals(ErrMsg.Level.Invariant,fe.level()); }
  }

  @Test public void testIsOp() {
    for( char c : "+-*<>".toCharArray() ) assertTrue(PrimNode.isOp(c));
    assertFalse(PrimNode.isOp('/'));
    assertFalse(PrimNode.isOp(';'));
    assertFalse(PrimNode.isOp(-1));
  }

  @Test public void testMake() {
    UIDs ids = new UIDs();
    Region r = new Region(ids,"Start");
    Node x = new ReadIntNode(ids,r);
    Node c = new ConNode(ids,r,TypeInt.con(2));
    String[] labels = {"Add","Sub","Mul","LT","GT"};
    char[] ops = "+-*<>".toCharArray();
    for( int i=0; i<ops.length; i++ ) {
      PrimNode p = PrimNode.make(ids,r,ops[i],x,c);
      assertEquals(labels[i],p.label());
      assertEquals(ops[i],p._op);
      assertEquals(2,p.len());
      assertSame(x,p.in(0));
      assertSame(c,p.in(1));
      assertSame(r,p.ctrl(0));
      assertFalse(p.is_con());
    }
  }

  @Test public void testSymStick() {
    UIDs ids = new UIDs();
    Region r = new Region(ids,"Start");
    SymTab top = new SymTab(null);
    Symbol x = top.define("x",null), y = top.define("y",null);
    Node n = new ReadIntNode(ids,r).sym(x);
    n.sym(y);                   // "int y = x;" does not rename x's value
    assertSame(x,n.sym());
  }

  @Test public void testPhi() {
    UIDs ids = new UIDs();
    Region s = new Region(ids,"Start");
    Region t = new Region(ids,"true",s), f = new Region(ids,"false",s);
    Symbol y = new SymTab(null).define("y",null);
    Node a = new ConNode(ids,t,TypeInt.con(13)), b = new ConNode(ids,f,TypeInt.con(7));
    PhiNode phi = new PhiNode(ids,y,new Region[]{t,f},a,b);
    assertTrue(phi.isPhi());
    assertSame(y,phi.sym());
    assertEquals(2,phi.len());
    assertEquals(2,phi.nCtrls());
    assertSame(t,phi.ctrl(0));
    assertSame(b,phi.in(1));
    assertNull(phi.con());
  }

  @Test public void testPhiArity() {
    UIDs ids = new UIDs();
    Region s = new Region(ids,"Start");
    Region t = new Region(ids,"true",s), f = new Region(ids,"false",s);
    Symbol y = new SymTab(null).define("y",null);
    Node a = new ConNode(ids,t,TypeInt.con(1));
    try { new PhiNode(ids,y,new Region[]{t,f},a); fail(); }
    catch( FatalErr fe ) { assertEquals(ErrMsg.Level.Invariant,fe.level()); }
  }

  @Test public void testConNeedsConstant() {
    UIDs ids = new UIDs();
    Region s = new Region(ids,"Start");
    try { new ConNode(ids,s,null); fail(); }
    catch( FatalErr fe ) { assertEquals(ErrMsg.Level.Invariant,fe.level()); }
  }
}
