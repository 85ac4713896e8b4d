package com.cliffc.sea;

import org.junit.Test;

import static org.junit.Assert.*;

public class TestSymTab {
  @Test public void testDefineResolve() {
    SymTab top = new SymTab(null);
    Symbol x = top.define("x",null);
    assertSame(x,top.resolve("x",null));
    assertSame(x,top.resolve("X",null)); // Case-insensitive
    assertEquals("x",x._name);
    assertEquals(1,top.depth());
  }

  @Test public void testDuplicate() {
    SymTab top = new SymTab(null);
    top.define("Foo",null);
    try { top.define("fOO",null); fail(); }
    catch( FatalErr fe ) { assertEquals(ErrMsg.Level.DuplicateSymbol,fe.level()); }
  }

  @Test public void testShadow() {
    SymTab top = new SymTab(null);
    Symbol x0 = top.define("x",null);
    SymTab inner = new SymTab(top);
    assertSame(x0,inner.resolve("x",null)); // Found up the chain
    Symbol x1 = inner.define("x",null);    // Shadowing is fine
    assertNotSame(x0,x1);
    assertSame(x1,inner.resolve("x",null));
    assertSame(x0,top.resolve("x",null));
    assertNull(inner.get("y"));
    assertEquals(2,inner.depth());
  }

  @Test public void testUnknown() {
    SymTab inner = new SymTab(new SymTab(null));
    try { inner.resolve("nope",null); fail(); }
    catch( FatalErr fe ) {
      assertEquals(ErrMsg.Level.UnknownSymbol,fe.level());
      assertEquals("UnknownSymbol: Unknown symbol 'nope'\n",fe._err.toString());
    }
  }
}
