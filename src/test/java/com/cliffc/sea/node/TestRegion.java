package com.cliffc.sea.node;

import com.cliffc.sea.ErrMsg;
import com.cliffc.sea.FatalErr;
import com.cliffc.sea.type.TypeInt;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestRegion {
  @Test public void testSetOnce() {
    UIDs ids = new UIDs();
    Region start = new Region(ids,"Start");
    Region t = new Region(ids,"true",start);
    Region f = new Region(ids,"false",start);
    assertTrue(start.isStart());
    assertFalse(t.isStart());
    assertNull(start.outs());   // Unset reads as null
    assertNull(start.nodes());
    assertFalse(start.isFinal());

    Node c = new ConNode(ids,start,TypeInt.con(1));
    start.set_nodes(c);
    assertFalse(start.isFinal());
    start.set_outs(t,f);
    assertTrue(start.isFinal());
    assertArrayEquals(new Region[]{t,f},start.outs());
    assertArrayEquals(new Node[]{c},start.nodes());

    try { start.set_outs(t); fail(); }
    catch( FatalErr fe ) { assertEquals(ErrMsg.Level.Invariant,fe.level()); }
    try { start.set_nodes(); fail(); }
    catch( FatalErr fe ) { assertEquals(ErrMsg.Level.Invariant,fe.level()); }
    // Failed sets leave the first values alone
    assertArrayEquals(new Region[]{t,f},start.outs());
    assertArrayEquals(new Node[]{c},start.nodes());
  }

  @Test public void testJump() {
    UIDs ids = new UIDs();
    Region a = new Region(ids,null);
    Region b = new Region(ids,null,a);
    a.jump(b);
    assertEquals(0,a.nodes().length);
    assertArrayEquals(new Region[]{b},a.outs());
    try { a.jump(b); fail(); }
    catch( FatalErr fe ) { assertEquals(ErrMsg.Level.Invariant,fe.level()); }
  }

  @Test public void testIds() {
    UIDs ids = new UIDs();
    Region r1 = new Region(ids,"Start");
    Region r2 = new Region(ids,null,r1);
    Node n1 = new ReadIntNode(ids,r1);
    Node n2 = new ReadIntNode(ids,r2);
    assertEquals(1,r1._uid);
    assertEquals(2,r2._uid);
    assertEquals(1,n1._uid);    // Nodes and Regions count separately
    assertEquals(2,n2._uid);
    assertEquals(2,ids.nodes());
    assertEquals(2,ids.regions());
  }
}
