package com.complexity.inferrer.ast;

import com.complexity.inferrer.ast.Ast.ArrayAccess;
import com.complexity.inferrer.ast.Ast.ArrayDecl;
import com.complexity.inferrer.ast.Ast.ArrayRange;
import com.complexity.inferrer.ast.Ast.Assign;
import com.complexity.inferrer.ast.Ast.BinOp;
import com.complexity.inferrer.ast.Ast.Block;
import com.complexity.inferrer.ast.Ast.BooleanLiteral;
import com.complexity.inferrer.ast.Ast.CallExpr;
import com.complexity.inferrer.ast.Ast.CallStmt;
import com.complexity.inferrer.ast.Ast.FieldAccess;
import com.complexity.inferrer.ast.Ast.For;
import com.complexity.inferrer.ast.Ast.If;
import com.complexity.inferrer.ast.Ast.NullLiteral;
import com.complexity.inferrer.ast.Ast.NumberLiteral;
import com.complexity.inferrer.ast.Ast.ObjectDecl;
import com.complexity.inferrer.ast.Ast.Repeat;
import com.complexity.inferrer.ast.Ast.Return;
import com.complexity.inferrer.ast.Ast.StringFunc;
import com.complexity.inferrer.ast.Ast.StringLiteral;
import com.complexity.inferrer.ast.Ast.UnOp;
import com.complexity.inferrer.ast.Ast.Var;
import com.complexity.inferrer.ast.Ast.VarDecl;
import com.complexity.inferrer.ast.Ast.While;

/**
 * Visitor over every node kind, returning {@code R} and threading an argument of type {@code A}.
 * Same shape as JavaParser's {@code GenericVisitor}: one overload per concrete node.
 */
public interface AstVisitor<R, A> {

    R visit(Block n, A arg);

    R visit(For n, A arg);

    R visit(While n, A arg);

    R visit(Repeat n, A arg);

    R visit(If n, A arg);

    R visit(CallStmt n, A arg);

    R visit(Assign n, A arg);

    R visit(Return n, A arg);

    R visit(VarDecl n, A arg);

    R visit(ArrayDecl n, A arg);

    R visit(ObjectDecl n, A arg);

    R visit(NumberLiteral n, A arg);

    R visit(BooleanLiteral n, A arg);

    R visit(StringLiteral n, A arg);

    R visit(NullLiteral n, A arg);

    R visit(Var n, A arg);

    R visit(BinOp n, A arg);

    R visit(UnOp n, A arg);

    R visit(CallExpr n, A arg);

    R visit(ArrayAccess n, A arg);

    R visit(ArrayRange n, A arg);

    R visit(FieldAccess n, A arg);

    R visit(StringFunc n, A arg);
}
