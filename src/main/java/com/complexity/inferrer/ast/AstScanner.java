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
import com.complexity.inferrer.ast.Ast.Node;
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
 * Depth-first traversal that visits every child of every node, in the manner of JavaParser's
 * {@code VoidVisitorAdapter}. Subclasses override the node kinds they care about and call
 * {@code super.visit(n, arg)} to keep descending.
 */
public abstract class AstScanner<A> implements AstVisitor<Void, A> {

    public void scan(Node node, A arg) {
        if (node != null) {
            node.accept(this, arg);
        }
    }

    protected Void scanChildren(Node node, A arg) {
        for (Node child : node.getChildNodes()) {
            child.accept(this, arg);
        }
        return null;
    }

    @Override
    public Void visit(Block n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(For n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(While n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(Repeat n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(If n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(CallStmt n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(Assign n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(Return n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(VarDecl n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(ArrayDecl n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(ObjectDecl n, A arg) {
        return null;
    }

    @Override
    public Void visit(NumberLiteral n, A arg) {
        return null;
    }

    @Override
    public Void visit(BooleanLiteral n, A arg) {
        return null;
    }

    @Override
    public Void visit(StringLiteral n, A arg) {
        return null;
    }

    @Override
    public Void visit(NullLiteral n, A arg) {
        return null;
    }

    @Override
    public Void visit(Var n, A arg) {
        return null;
    }

    @Override
    public Void visit(BinOp n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(UnOp n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(CallExpr n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(ArrayAccess n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(ArrayRange n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(FieldAccess n, A arg) {
        return scanChildren(n, arg);
    }

    @Override
    public Void visit(StringFunc n, A arg) {
        return scanChildren(n, arg);
    }
}
