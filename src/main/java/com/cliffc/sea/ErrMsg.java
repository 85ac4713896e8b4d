package com.cliffc.sea;

import com.cliffc.sea.util.SB;

// Error messages.  Every error is fatal to the parse: build the ErrMsg, then
// throw it wrapped in a FatalErr.
public class ErrMsg {

  // Error kinds
  public enum Level {
    Syntax,                   // Missing token or construct, trailing junk
    DuplicateSymbol,          // Name already defined in the same scope
    UnknownSymbol,            // Name not found anywhere on the scope chain
    UnassignedSymbol,         // Declared but read before any assignment
    ScopeDiscipline,          // Unbalanced scope push/pop
    TypeErr,                  // Constant of the wrong flavor
    Invariant,                // Internal graph-building bug
  }

  public final Parse _loc;    // Point in code to blame; null for internal errors
  public final String _msg;   // Printable error message, minus code context
  public final Level _lvl;
  public ErrMsg(Parse loc, String msg, Level lvl) { _loc=loc; _msg=msg; _lvl=lvl; }

  public static ErrMsg syntax(Parse loc, String msg) {
    return new ErrMsg(loc,msg,Level.Syntax);
  }
  public static ErrMsg trailingjunk(Parse loc) {
    return new ErrMsg(loc,"Syntax error; trailing junk",Level.Syntax);
  }
  public static ErrMsg duplicate(Parse loc, String name) {
    return new ErrMsg(loc,"Symbol '"+name+"' already defined in this scope",Level.DuplicateSymbol);
  }
  public static ErrMsg unknown(Parse loc, String name) {
    return new ErrMsg(loc,"Unknown symbol '"+name+"'",Level.UnknownSymbol);
  }
  public static ErrMsg unassigned(Parse loc, String name) {
    return new ErrMsg(loc,"Symbol '"+name+"' not assigned",Level.UnassignedSymbol);
  }
  public static ErrMsg scope(String msg) {
    return new ErrMsg(null,msg,Level.ScopeDiscipline);
  }
  public static ErrMsg typerr(Parse loc, String msg) {
    return new ErrMsg(loc,msg,Level.TypeErr);
  }
  public static ErrMsg invariant(String msg) {
    return new ErrMsg(null,msg,Level.Invariant);
  }

  // Wrap for throwing: "throw ErrMsg.syntax(...).fatal()"
  public FatalErr fatal() { return new FatalErr(this); }

  @Override public String toString() {
    return _loc==null ? new SB().p(_lvl.name()).p(": ").p(_msg).nl().toString() : _loc.errLocMsg(_msg);
  }
}
