package com.cliffc.sea;

import com.cliffc.sea.node.Node;
import com.cliffc.sea.node.Region;
import com.cliffc.sea.node.RetNode;
import com.cliffc.sea.node.UIDs;
import com.cliffc.sea.util.Ary;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** The parse context, threaded through the recursive descent.
 *
 *  An Env is never changed once made.  Grammar rules that bind a value, push
 *  or pop a scope, or start a new Region return a fresh Env, so the two arms
 *  of an if each see their own bindings and merge explicitly afterwards.
 *
 *  Shared by every Env of one parse: the id source, the scope objects
 *  themselves (only ever changed by {@link SymTab#define}) and the return
 *  sink, which every {@code return} appends to no matter which arm it is in.
 */
public class Env {
  // Current value of each symbol, in binding order.  Never mutated after
  // construction; binding copies.
  private final LinkedHashMap<Symbol,Node> _vals;
  public final Region _ctrl;    // Current region
  public final SymTab _scope;   // Innermost scope; the parent links are the chain
  private final Ary<RetNode> _rets; // Shared return sink
  final UIDs _ids;

  private Env( LinkedHashMap<Symbol,Node> vals, Region ctrl, SymTab scope, Ary<RetNode> rets, UIDs ids ) {
    _vals = vals; _ctrl = ctrl; _scope = scope; _rets = rets; _ids = ids;
  }

  // Top-level Env: empty bindings, root scope, fresh return sink
  public Env( UIDs ids, Region start ) {
    this(new LinkedHashMap<>(),start,new SymTab(null),new Ary<>(RetNode.class),ids);
  }

  /** Push a new child scope; everything else carried over. */
  public @NotNull Env newScope() {
    return new Env(_vals,_ctrl,new SymTab(_scope),_rets,_ids);
  }

  /** Pop the innermost scope.
   *  @param expect the scope the caller expects to be current after the pop
   *  @throws FatalErr ScopeDiscipline on underflow or if the popped-to scope
   *  is not 'expect' */
  public @NotNull Env popScope( SymTab expect ) {
    SymTab par = _scope._par;
    if( par == null ) throw ErrMsg.scope("Cannot pop from empty scope stack").fatal();
    if( par != expect ) throw ErrMsg.scope("Symbol table mismatch on scope pop").fatal();
    return new Env(_vals,_ctrl,par,_rets,_ids);
  }

  /** Start a fresh Region with the given predecessors.  Nobody is told the new
   *  Region is their successor; linking is the caller's job. */
  public @NotNull Env newRegion( String label, Region... preds ) {
    return new Env(_vals,new Region(_ids,label,preds),_scope,_rets,_ids);
  }

  /** A Region hanging off the current one which is never linked in, used to
   *  parse an arm removed by a constant condition.  Returns in the dead arm
   *  still go to the shared sink, and so still reach End. */
  public @NotNull Env newDeadRegion() {
    return new Env(_vals,new Region(_ids,"const-expr-removed",_ctrl),_scope,_rets,_ids);
  }

  /** @return a new Env with 'sym' bound to 'n' */
  public @NotNull Env bind( Symbol sym, Node n ) {
    LinkedHashMap<Symbol,Node> vals = new LinkedHashMap<>(_vals);
    vals.put(sym,n);
    return new Env(vals,_ctrl,_scope,_rets,_ids);
  }

  // Current value, or null if never assigned
  public Node lookup( Symbol sym ) { return _vals.get(sym); }
  // Read-only view of all bindings, in binding order
  public Map<Symbol,Node> vals() { return Collections.unmodifiableMap(_vals); }

  // Shared return sink
  void ret( RetNode ret ) { _rets.add(ret); }
  public RetNode[] rets() { return _rets.asAry(); }
}
