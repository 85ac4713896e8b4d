package com.cliffc.sea.node;

import com.cliffc.sea.ErrMsg;
import com.cliffc.sea.type.Type;
import com.cliffc.sea.type.TypeBool;
import com.cliffc.sea.type.TypeInt;

// Primitive binary operators on ints.  The arithmetic ops produce an int and
// the relational ops produce a bool.  The parser folds constants *before*
// making a PrimNode, so a PrimNode always has at least one non-constant input.
public abstract class PrimNode extends Node {
  public final char _op;
  PrimNode( UIDs ids, Region ctrl, char op, Node lhs, Node rhs ) {
    super(ids,new Region[]{ctrl},null,lhs,rhs);
    _op = op;
  }

  // Operator characters the parser accepts as a binop
  public static boolean isOp( int c ) { return c > 0 && "+-*<>".indexOf(c) != -1; }

  // Evaluate the operator over two known ints, with native int semantics
  public static Type fold( char op, int l, int r ) {
    return switch( op ) {
    case '+' -> TypeInt.con(l+r);
    case '-' -> TypeInt.con(l-r);
    case '*' -> TypeInt.con(l*r);
    case '<' -> TypeBool.con(l< r);
    case '>' -> TypeBool.con(l> r);
    default -> throw ErrMsg.invariant("Unsupported binary operator '"+op+"'").fatal();
    };
  }

  public static PrimNode make( UIDs ids, Region ctrl, char op, Node lhs, Node rhs ) {
    return switch( op ) {
    case '+' -> new AddNode(ids,ctrl,lhs,rhs);
    case '-' -> new SubNode(ids,ctrl,lhs,rhs);
    case '*' -> new MulNode(ids,ctrl,lhs,rhs);
    case '<' -> new LTNode (ids,ctrl,lhs,rhs);
    case '>' -> new GTNode (ids,ctrl,lhs,rhs);
    default -> throw ErrMsg.invariant("Unsupported binary operator '"+op+"'").fatal();
    };
  }

  public static class AddNode extends PrimNode {
    AddNode( UIDs ids, Region ctrl, Node lhs, Node rhs ) { super(ids,ctrl,'+',lhs,rhs); }
    @Override public String label() { return "Add"; }
  }
  public static class SubNode extends PrimNode {
    SubNode( UIDs ids, Region ctrl, Node lhs, Node rhs ) { super(ids,ctrl,'-',lhs,rhs); }
    @Override public String label() { return "Sub"; }
  }
  public static class MulNode extends PrimNode {
    MulNode( UIDs ids, Region ctrl, Node lhs, Node rhs ) { super(ids,ctrl,'*',lhs,rhs); }
    @Override public String label() { return "Mul"; }
  }
  public static class LTNode extends PrimNode {
    LTNode( UIDs ids, Region ctrl, Node lhs, Node rhs ) { super(ids,ctrl,'<',lhs,rhs); }
    @Override public String label() { return "LT"; }
  }
  public static class GTNode extends PrimNode {
    GTNode( UIDs ids, Region ctrl, Node lhs, Node rhs ) { super(ids,ctrl,'>',lhs,rhs); }
    @Override public String label() { return "GT"; }
  }
}
