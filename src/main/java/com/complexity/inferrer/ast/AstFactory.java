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
import com.complexity.inferrer.ast.Ast.Expr;
import com.complexity.inferrer.ast.Ast.FieldAccess;
import com.complexity.inferrer.ast.Ast.For;
import com.complexity.inferrer.ast.Ast.If;
import com.complexity.inferrer.ast.Ast.NullLiteral;
import com.complexity.inferrer.ast.Ast.NumberLiteral;
import com.complexity.inferrer.ast.Ast.ObjectDecl;
import com.complexity.inferrer.ast.Ast.Repeat;
import com.complexity.inferrer.ast.Ast.Return;
import com.complexity.inferrer.ast.Ast.Stmt;
import com.complexity.inferrer.ast.Ast.StringFunc;
import com.complexity.inferrer.ast.Ast.StringLiteral;
import com.complexity.inferrer.ast.Ast.UnOp;
import com.complexity.inferrer.ast.Ast.Var;
import com.complexity.inferrer.ast.Ast.VarDecl;
import com.complexity.inferrer.ast.Ast.While;

import java.util.List;

/**
 * Static constructors for building trees by hand, all with {@link SourceLocation#UNKNOWN}.
 * Meant for {@code import static}.
 */
public final class AstFactory {

    private static final SourceLocation NOWHERE = SourceLocation.UNKNOWN;

    private AstFactory() {
    }

    // statements

    public static Block block(Stmt... statements) {
        return new Block(List.of(statements), NOWHERE);
    }

    public static For forLoop(String variable, Expr start, Expr end, Stmt... body) {
        return new For(variable, start, end, body(body), NOWHERE);
    }

    public static While whileLoop(Expr condition, Stmt... body) {
        return new While(condition, body(body), NOWHERE);
    }

    public static Repeat repeatUntil(Expr condition, Stmt... body) {
        return new Repeat(body(body), condition, NOWHERE);
    }

    public static If ifThen(Expr condition, Stmt thenBranch) {
        return new If(condition, thenBranch, null, NOWHERE);
    }

    public static If ifElse(Expr condition, Stmt thenBranch, Stmt elseBranch) {
        return new If(condition, thenBranch, elseBranch, NOWHERE);
    }

    public static CallStmt call(String name, Expr... args) {
        return new CallStmt(name, List.of(args), NOWHERE);
    }

    public static Assign assign(Expr target, Expr value) {
        return new Assign(target, value, NOWHERE);
    }

    public static Assign assign(String variable, Expr value) {
        return new Assign(ref(variable), value, NOWHERE);
    }

    public static Return ret(Expr value) {
        return new Return(value, NOWHERE);
    }

    public static Return ret() {
        return new Return(null, NOWHERE);
    }

    public static VarDecl varDecl(String name, Expr initializer) {
        return new VarDecl(name, initializer, NOWHERE);
    }

    public static ArrayDecl arrayDecl(String name, Expr... dimensions) {
        return new ArrayDecl(name, List.of(dimensions), NOWHERE);
    }

    public static ObjectDecl objectDecl(String className, String name) {
        return new ObjectDecl(className, name, NOWHERE);
    }

    public static Procedure procedure(String name, List<String> parameters, Stmt... body) {
        return new Procedure(name, parameters, block(body));
    }

    // expressions

    public static NumberLiteral num(double value) {
        return new NumberLiteral(value, NOWHERE);
    }

    public static BooleanLiteral bool(boolean value) {
        return new BooleanLiteral(value, NOWHERE);
    }

    public static StringLiteral str(String value) {
        return new StringLiteral(value, NOWHERE);
    }

    public static NullLiteral nil() {
        return new NullLiteral(NOWHERE);
    }

    public static Var ref(String name) {
        return new Var(name, NOWHERE);
    }

    public static BinOp binOp(BinOp.Operator op, Expr left, Expr right) {
        return new BinOp(op, left, right, NOWHERE);
    }

    public static BinOp plus(Expr left, Expr right) {
        return binOp(BinOp.Operator.PLUS, left, right);
    }

    public static BinOp minus(Expr left, Expr right) {
        return binOp(BinOp.Operator.MINUS, left, right);
    }

    public static BinOp times(Expr left, Expr right) {
        return binOp(BinOp.Operator.TIMES, left, right);
    }

    public static BinOp div(Expr left, Expr right) {
        return binOp(BinOp.Operator.DIV, left, right);
    }

    public static BinOp intDiv(Expr left, Expr right) {
        return binOp(BinOp.Operator.DIV_INT, left, right);
    }

    public static BinOp mod(Expr left, Expr right) {
        return binOp(BinOp.Operator.MOD, left, right);
    }

    public static BinOp pow(Expr left, Expr right) {
        return binOp(BinOp.Operator.POW, left, right);
    }

    public static BinOp and(Expr left, Expr right) {
        return binOp(BinOp.Operator.AND, left, right);
    }

    public static BinOp or(Expr left, Expr right) {
        return binOp(BinOp.Operator.OR, left, right);
    }

    public static BinOp eq(Expr left, Expr right) {
        return binOp(BinOp.Operator.EQ, left, right);
    }

    public static BinOp ne(Expr left, Expr right) {
        return binOp(BinOp.Operator.NE, left, right);
    }

    public static BinOp lt(Expr left, Expr right) {
        return binOp(BinOp.Operator.LT, left, right);
    }

    public static BinOp le(Expr left, Expr right) {
        return binOp(BinOp.Operator.LE, left, right);
    }

    public static BinOp gt(Expr left, Expr right) {
        return binOp(BinOp.Operator.GT, left, right);
    }

    public static BinOp ge(Expr left, Expr right) {
        return binOp(BinOp.Operator.GE, left, right);
    }

    public static UnOp neg(Expr operand) {
        return new UnOp(UnOp.Operator.NEG, operand, NOWHERE);
    }

    public static UnOp not(Expr operand) {
        return new UnOp(UnOp.Operator.NOT, operand, NOWHERE);
    }

    public static UnOp floor(Expr operand) {
        return new UnOp(UnOp.Operator.FLOOR, operand, NOWHERE);
    }

    public static UnOp ceil(Expr operand) {
        return new UnOp(UnOp.Operator.CEIL, operand, NOWHERE);
    }

    public static CallExpr callExpr(String name, Expr... args) {
        return new CallExpr(name, List.of(args), NOWHERE);
    }

    public static ArrayAccess index(Expr array, Expr... indices) {
        return new ArrayAccess(array, List.of(indices), NOWHERE);
    }

    public static ArrayAccess index(String array, Expr... indices) {
        return index(ref(array), indices);
    }

    public static ArrayRange range(Expr array, Expr from, Expr to) {
        return new ArrayRange(array, from, to, NOWHERE);
    }

    public static FieldAccess field(Expr target, String field) {
        return new FieldAccess(target, field, NOWHERE);
    }

    public static StringFunc length(Expr operand) {
        return new StringFunc("length", List.of(operand), NOWHERE);
    }

    private static Stmt body(Stmt... statements) {
        return statements.length == 1 ? statements[0] : block(statements);
    }
}
