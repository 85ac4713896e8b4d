package com.cliffc.sea;

import com.cliffc.sea.node.*;
import com.cliffc.sea.type.Type;
import com.cliffc.sea.type.TypeBool;
import com.cliffc.sea.type.TypeInt;
import com.cliffc.sea.util.SB;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/*** Single pass parser straight into a graph of Regions and Nodes.
 *
 *  GRAMMAR:
 *  prog = block END
 *  block= { stmt* }
 *  stmt = return [expr] ;
 *  stmt = int id [= expr] ;           // Declare in the innermost scope
 *  stmt = if ( expr ) block [else block]
 *  stmt = id = expr ;                 // Re-assign, id resolved up the scope chain
 *  expr = atom [binop expr]           // No precedence; chains group to the right
 *  atom = READ_INT | num | id
 *  binop= + - * < >
 *  id   = [a-zA-Z_][a-zA-Z0-9_]*      // Resolved case-insensitively
 *
 *  Keywords are case-sensitive and only match on a word boundary, so "int"
 *  does not match the front of "internal".  "//" starts a comment to end of
 *  line.
 *
 *  The graph is built as a byproduct of the descent.  Every rule that might
 *  branch takes an {@link Env} and returns a new one; see {@link Env}.
 *  Constant operands fold on the spot, and an if with a constant condition
 *  parses the dead arm under an unlinked Region and throws the result away.
 *  At an if/else join each variable whose value differs between the arms
 *  gets a Phi.
 *
 *  Known gap: a variable with no value before the if, assigned in only one
 *  arm (or in both), has no value after the if.
 */
public class Parse {
  private final String _src;    // Source for error messages; usually a file name
  private final byte[] _buf;    // Bytes being parsed
  private int _x;               // Parser index
  private final boolean _fold;  // Constant folding and branch pruning
  private final UIDs _ids;      // Per-parse Node and Region ids
  private Region _start;        // Set by prog()

  public Parse( String src, String str, boolean fold ) {
    _src = src;
    _buf = str.getBytes(StandardCharsets.UTF_8);
    _x   = 0;
    _fold = fold;
    _ids = new UIDs();
  }
  public Parse( String src, String str ) { this(src,str,SEA.DO_FOLD); }

  public UIDs ids() { return _ids; }
  public Region start() { return _start; }

  /** Parse a top-level:
   *  prog = block END
   *  @return the End region; its outputs are every return, in source order */
  public Region prog() {
    _start = new Region(_ids,"Start");
    Env e = new Env(_ids,_start);
    skipWS();
    Env exit = block(e);
    if( _x < _buf.length ) throw ErrMsg.trailingjunk(errMsg()).fatal();
    // End hangs off the final Region only, but collects returns from anywhere.
    Region end = new Region(_ids,"End",exit._ctrl);
    end.set_nodes(exit.rets());
    end.set_outs();
    exit._ctrl.jump(end);
    return end;
  }

  /** Parse a block in a new scope.  The scope popped at the close must be the
   *  one current at the open, whichever arms ran in between.
   *  block= { stmt* }
   */
  Env block( Env e ) {
    require("{");
    skipWS();
    Env b = e.newScope();
    while( !peek("}") ) {
      if( _x >= _buf.length )
        throw ErrMsg.syntax(errMsg(),"Expected closing '}' but ran out of text").fatal();
      b = stmt(b);
    }
    skipWS();
    return b.popScope(e._scope);
  }

  /** Parse one statement; the cursor ends past trailing whitespace.
   *  stmt = return [expr] ;
   *  stmt = int id [= expr] ;
   *  stmt = if ( expr ) block [else block]
   *  stmt = id = expr ;
   */
  Env stmt( Env e ) {
    if( peek("return") ) return ret(e);
    if( look("int") ) return decl(e);
    if( look("if" ) ) return ifex(e);

    int oldx = _x;
    String tok = ident();
    Symbol sym = e._scope.resolve(tok,errMsg(oldx));
    if( !peek("=") ) throw ErrMsg.syntax(errMsg(),"Expected '=' after '"+tok+"'").fatal();
    skipWS();
    Node n = expr(e).sym(sym);
    require(";");
    skipWS();
    return e.bind(sym,n);
  }

  // return [expr] ;
  // The "return" keyword is already consumed.  Parsing carries on after a
  // return; later statements still build graph.
  private Env ret( Env e ) {
    skipWS();
    Node n = look(";") ? null : expr(e);
    require(";");
    skipWS();
    e.ret(new RetNode(_ids,e._ctrl,n));
    return e;
  }

  // int id [= expr] ;
  // Defined before the initializer is parsed, so "int x = x;" reads an
  // unassigned x.
  private Env decl( Env e ) {
    require("int");
    skipWS();
    int oldx = _x;
    String tok = ident();
    Symbol sym = e._scope.define(tok,errMsg(oldx));
    if( peek("=") ) {
      skipWS();
      Node n = expr(e).sym(sym);
      e = e.bind(sym,n);
    }
    require(";");
    skipWS();
    return e;
  }

  /** Parse an if, with optional else.
   *  stmt = if ( expr ) block [else block]
   *
   *  Constant condition: parse the taken arm in the current Region, and the
   *  other arm (if any) under an unlinked "const-expr-removed" Region whose
   *  values are dropped.  Its returns still reach End.
   *
   *  Otherwise: the current Region outputs the condition and splits to a
   *  "true" Region and either a "false" Region or straight to the merge.  Both
   *  arm exits fall into a new merge Region, and Phis merge the values.
   */
  private Env ifex( Env e ) {
    require("if");
    skipWS();
    require("(");
    skipWS();
    int condx = _x;
    Node cond = expr(e);
    require(")");
    skipWS();

    if( _fold && cond.is_con() ) {
      boolean taken = truth(cond.con(),condx);
      SEA.p(null,"if at "+_src+":"+line(condx)+" is always "+taken+"; pruning the other arm");
      if( taken ) {
        Env after = block(e);
        if( peek("else") ) { skipWS(); block(e.newDeadRegion()); }
        return after;
      }
      block(e.newDeadRegion());
      if( peek("else") ) { skipWS(); return block(e); }
      return e;
    }

    Region head = e._ctrl;
    head.set_nodes(cond);
    Env tenter = e.newRegion("true",head);
    Env texit  = block(tenter);
    Env fexit, merge;
    if( peek("else") ) {
      skipWS();
      Env fenter = e.newRegion("false",head);
      fexit = block(fenter);
      merge = e.newRegion(null,texit._ctrl,fexit._ctrl);
      fexit._ctrl.jump(merge._ctrl);
      head.set_outs(tenter._ctrl,fenter._ctrl);
    } else {
      fexit = e;                // False path skips straight to the merge
      merge = e.newRegion(null,texit._ctrl,head);
      head.set_outs(tenter._ctrl,merge._ctrl);
    }
    texit._ctrl.jump(merge._ctrl);
    return phis(e,texit,fexit,merge);
  }

  // Merge values from the two arms.  Only symbols with a value before the if
  // are considered.  A symbol whose arms agree keeps the common value;
  // otherwise it gets a Phi over (true,false), paired with the arm exits.
  private Env phis( Env pre, Env t, Env f, Env merge ) {
    Region[] ctrls = new Region[]{t._ctrl,f._ctrl};
    for( Map.Entry<Symbol,Node> ent : pre.vals().entrySet() ) {
      Symbol sym = ent.getKey();
      Node n0 = ent.getValue();
      Node nt = t.lookup(sym);
      Node nf = f.lookup(sym);
      if( nt==nf ) {
        if( nt!=n0 ) merge = merge.bind(sym,nt);
        continue;
      }
      PhiNode phi = new PhiNode(_ids,sym,ctrls,nt,nf);
      SEA.p(null,"phi "+phi);
      merge = merge.bind(sym,phi);
    }
    return merge;
  }

  // Truth of a constant condition.  Only bools are conditions.
  private boolean truth( Type t, int condx ) {
    if( t instanceof TypeBool b ) return b._con;
    throw ErrMsg.typerr(errMsg(condx),"Condition is not a boolean: "+t).fatal();
  }

  /** Parse an expression.  No precedence: "a - b - c" is "a - (b - c)".
   *  expr = atom [binop expr]
   */
  Node expr( Env e ) {
    Node lhs = atom(e);
    int opx = _x;
    int c = peekc();
    if( !PrimNode.isOp(c) ) return lhs;
    char op = (char)c;
    _x++;
    skipWS();
    Node rhs = expr(e);
    // Fold before making the operator, so no dead PrimNode is ever built
    if( _fold && lhs.is_con() && rhs.is_con() )
      return new ConNode(_ids,e._ctrl,PrimNode.fold(op,ival(lhs,op,opx),ival(rhs,op,opx)));
    return PrimNode.make(_ids,e._ctrl,op,lhs,rhs);
  }

  private int ival( Node n, char op, int opx ) {
    if( n.con() instanceof TypeInt ti ) return ti._con;
    throw ErrMsg.typerr(errMsg(opx),"Cannot apply '"+op+"' to "+n.con()).fatal();
  }

  /** Parse an atom, and any trailing whitespace.
   *  atom = READ_INT | num | id
   */
  private Node atom( Env e ) {
    if( peek("READ_INT") ) {
      skipWS();
      return new ReadIntNode(_ids,e._ctrl);
    }
    if( isDigit(peekc()) ) return number(e);
    int oldx = _x;
    String tok = ident();
    Symbol sym = e._scope.resolve(tok,errMsg(oldx));
    Node n = e.lookup(sym);
    if( n == null ) throw ErrMsg.unassigned(errMsg(oldx),tok).fatal();
    return n;
  }

  // Parse an integer literal, and any trailing whitespace
  private Node number( Env e ) {
    int oldx = _x;
    long val = 0;
    while( _x < _buf.length && isDigit(_buf[_x]) ) {
      val = val*10 + (_buf[_x++]-'0');
      if( val > Integer.MAX_VALUE )
        throw ErrMsg.syntax(errMsg(oldx),"Integer literal too large").fatal();
    }
    skipWS();
    return new ConNode(_ids,e._ctrl,TypeInt.con((int)val));
  }

  // Parse an identifier, and any trailing whitespace
  String ident() {
    int oldx = _x;
    if( _x >= _buf.length || !isAlpha0(_buf[_x]) )
      throw ErrMsg.syntax(errMsg(),"Expected identifier").fatal();
    while( _x < _buf.length && isAlpha1(_buf[_x]) ) _x++;
    String tok = new String(_buf,oldx,_x-oldx,StandardCharsets.UTF_8);
    skipWS();
    return tok;
  }

  // --------------------------------------------------------------------------
  // Lexical primitives.  None of them skip whitespace on their own, and a miss
  // leaves the cursor exactly where it was.

  // Next byte, without consuming it; -1 at end of input
  int peekc() { return _x < _buf.length ? _buf[_x] : -1; }

  // Match and consume 'tok'; on a miss do not move
  boolean peek( String tok ) { return peek(tok,false); }
  boolean peek( String tok, boolean icase ) {
    if( !look(tok,icase) ) return false;
    _x += tok.length();
    return true;
  }

  // Match 'tok' without consuming it.  A token ending in a word character
  // only matches if the next byte is not a word character.
  boolean look( String tok ) { return look(tok,false); }
  boolean look( String tok, boolean icase ) {
    int len = tok.length();
    if( _x+len > _buf.length ) return false;
    for( int i=0; i<len; i++ ) {
      int c = _buf[_x+i], t = tok.charAt(i);
      if( c != t && !(icase && lower(c)==lower(t)) )
        return false;
    }
    if( !isAlpha1((byte)tok.charAt(len-1)) ) return true;
    return _x+len == _buf.length || !isAlpha1(_buf[_x+len]);
  }

  // Consume 'tok' or fail
  void require( String tok ) {
    if( peek(tok) ) return;
    String found = _x>=_buf.length ? "ran out of text" : "found '"+(char)_buf[_x]+"' instead";
    throw ErrMsg.syntax(errMsg(),"Expected '"+tok+"' but "+found).fatal();
  }

  /** Advance parse pointer to the first non-whitespace character, and return
   *  that character, -1 otherwise.  Line comments count as whitespace. */
  int skipWS() {
    while( _x < _buf.length ) {
      byte c = _buf[_x];
      if( c=='/' && _x+1 < _buf.length && _buf[_x+1]=='/' ) { skipEOL(); continue; }
      if( !isWS(c) ) return c;
      _x++;
    }
    return -1;
  }
  private void skipEOL() { while( _x < _buf.length && _buf[_x] != '\n' ) _x++; }

  /** Return true if `c` passes a test */
  private static boolean isWS    (byte c) { return c == ' ' || c == '\t' || c == '\n' || c == '\r'; }
  private static boolean isAlpha0(byte c) { return ('a'<=c && c <= 'z') || ('A'<=c && c <= 'Z') || (c=='_'); }
  private static boolean isAlpha1(byte c) { return isAlpha0(c) || isDigit(c); }
  private static boolean isDigit (int  c) { return '0' <= c && c <= '9'; }
  private static int lower( int c ) { return 'A'<=c && c<='Z' ? c+('a'-'A') : c; }

  // --------------------------------------------------------------------------
  // Make a private clone just for delayed error messages
  private Parse( Parse P ) {
    _src  = P._src;
    _buf  = P._buf;
    _x    = P._x;
    _fold = P._fold;
    _ids  = null;
  }
  // Delayed error message, just record line/char index and share code buffer
  Parse errMsg() { return errMsg(_x); }
  Parse errMsg(int x) { Parse P = new Parse(this); P._x=x; return P; }

  // 1-based line number of offset x
  private int line( int x ) {
    int line=1;
    for( int i=0; i<x && i<_buf.length; i++ )
      if( _buf[i]=='\n' ) line++;
    return line;
  }

  // Build a string of the given message, the current line being parsed,
  // and line of the pointer to the current index.
  public String errLocMsg(String s) {
    // find line start
    int a=_x;
    while( a > 0 && _buf[a-1] != '\n' ) --a;
    if( a < _buf.length && _buf[a]=='\r' ) a++; // do not include leading \n or \n\r
    // find line end
    int b=_x;
    while( b < _buf.length && _buf[b] != '\n' && _buf[b] != '\r' ) b++;
    SB sb = new SB().p(_src).p(':').p(line(_x)).p(':').p(s).nl();
    sb.p(new String(_buf,a,b-a,StandardCharsets.UTF_8)).nl();
    for( int i=a; i<_x; i++ )
      sb.p(_buf[i]=='\t' ? '\t' : ' ');
    return sb.p('^').nl().toString();
  }

  // Handy for the debugger to print
  @Override public String toString() { return new String(_buf,_x,_buf.length-_x,StandardCharsets.UTF_8); }
}
