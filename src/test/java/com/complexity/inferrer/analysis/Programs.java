package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Procedure;
import com.complexity.inferrer.ast.Program;

import java.util.List;

import static com.complexity.inferrer.ast.AstFactory.*;

/**
 * Classical algorithms written as pseudocode trees. Every builder takes the procedure name, so
 * tests can use neutral names and exercise the structural detection alone.
 */
final class Programs {

    private Programs() {
    }

    /** if n <= 1 return 1 else return n * P(n - 1) */
    static Procedure factorial(String name) {
        return procedure(name, List.of("n"),
                ifElse(le(ref("n"), num(1)),
                        ret(num(1)),
                        ret(times(ref("n"), callExpr(name, minus(ref("n"), num(1)))))));
    }

    /** Recursive search on [lo, hi] through mid = (lo + hi) / 2. */
    static Procedure binarySearch(String name) {
        return procedure(name, List.of("a", "lo", "hi", "x"),
                ifThen(gt(ref("lo"), ref("hi")), ret(num(-1))),
                varDecl("mid", div(plus(ref("lo"), ref("hi")), num(2))),
                ifElse(eq(index("a", ref("mid")), ref("x")),
                        ret(ref("mid")),
                        ifElse(lt(index("a", ref("mid")), ref("x")),
                                ret(callExpr(name, ref("a"), plus(ref("mid"), num(1)), ref("hi"), ref("x"))),
                                ret(callExpr(name, ref("a"), ref("lo"), minus(ref("mid"), num(1)), ref("x"))))));
    }

    /** Two calls on the halves of [lo, hi], then the merge procedure. */
    static Procedure mergeSort(String name, String merge) {
        return procedure(name, List.of("a", "lo", "hi"),
                ifThen(ge(ref("lo"), ref("hi")), ret()),
                varDecl("mid", div(plus(ref("lo"), ref("hi")), num(2))),
                call(name, ref("a"), ref("lo"), ref("mid")),
                call(name, ref("a"), plus(ref("mid"), num(1)), ref("hi")),
                call(merge, ref("a"), ref("lo"), ref("mid"), ref("hi")));
    }

    /** Merges a[lo..mid] and a[mid+1..hi] through a temporary array. */
    static Procedure merge(String name) {
        return procedure(name, List.of("a", "lo", "mid", "hi"),
                varDecl("i", ref("lo")),
                varDecl("j", plus(ref("mid"), num(1))),
                varDecl("k", num(0)),
                arrayDecl("tmp", plus(minus(ref("hi"), ref("lo")), num(1))),
                whileLoop(and(le(ref("i"), ref("mid")), le(ref("j"), ref("hi"))),
                        ifElse(le(index("a", ref("i")), index("a", ref("j"))),
                                block(assign(index("tmp", ref("k")), index("a", ref("i"))),
                                        assign("i", plus(ref("i"), num(1)))),
                                block(assign(index("tmp", ref("k")), index("a", ref("j"))),
                                        assign("j", plus(ref("j"), num(1))))),
                        assign("k", plus(ref("k"), num(1)))),
                whileLoop(le(ref("i"), ref("mid")),
                        assign(index("tmp", ref("k")), index("a", ref("i"))),
                        assign("i", plus(ref("i"), num(1))),
                        assign("k", plus(ref("k"), num(1)))));
    }

    /** Two calls around a partition point and no merge phase. */
    static Procedure quickSort(String name, String partition) {
        return procedure(name, List.of("a", "lo", "hi"),
                ifThen(lt(ref("lo"), ref("hi")), block(
                        varDecl("p", callExpr(partition, ref("a"), ref("lo"), ref("hi"))),
                        call(name, ref("a"), ref("lo"), minus(ref("p"), num(1))),
                        call(name, ref("a"), plus(ref("p"), num(1)), ref("hi")))));
    }

    /** Lomuto partition: one pass over [lo, hi - 1]. */
    static Procedure partition(String name) {
        return procedure(name, List.of("a", "lo", "hi"),
                varDecl("pivot", index("a", ref("hi"))),
                varDecl("i", minus(ref("lo"), num(1))),
                forLoop("j", ref("lo"), minus(ref("hi"), num(1)),
                        ifThen(le(index("a", ref("j")), ref("pivot")), block(
                                assign("i", plus(ref("i"), num(1))),
                                call("swap", ref("a"), ref("i"), ref("j"))))),
                call("swap", ref("a"), plus(ref("i"), num(1)), ref("hi")),
                ret(plus(ref("i"), num(1))));
    }

    /** return P(n - 1) + P(n - 2) */
    static Procedure fibonacci(String name) {
        return procedure(name, List.of("n"),
                ifThen(le(ref("n"), num(1)), ret(ref("n"))),
                ret(plus(callExpr(name, minus(ref("n"), num(1))), callExpr(name, minus(ref("n"), num(2))))));
    }

    /** One call per run, stepping by 1 or by 2 depending on the branch taken. */
    static Procedure alternatingStep(String name) {
        return procedure(name, List.of("n"),
                ifThen(le(ref("n"), num(1)), ret(ref("n"))),
                ifElse(gt(ref("n"), num(5)),
                        ret(callExpr(name, minus(ref("n"), num(1)))),
                        ret(callExpr(name, minus(ref("n"), num(2))))));
    }

    /** Two calls on n - 1 around a constant move. */
    static Procedure hanoi(String name) {
        return procedure(name, List.of("n", "from", "to", "via"),
                ifThen(gt(ref("n"), num(0)), block(
                        call(name, minus(ref("n"), num(1)), ref("from"), ref("via"), ref("to")),
                        call("print", ref("from"), ref("to")),
                        call(name, minus(ref("n"), num(1)), ref("via"), ref("to"), ref("from")))));
    }

    /** return P(b, a mod b) */
    static Procedure gcd(String name) {
        return procedure(name, List.of("a", "b"),
                ifThen(eq(ref("b"), num(0)), ret(ref("a"))),
                ret(callExpr(name, ref("b"), mod(ref("a"), ref("b")))));
    }

    /** Fast exponentiation: one call on n / 2, result squared. */
    static Procedure power(String name) {
        return procedure(name, List.of("x", "n"),
                ifThen(eq(ref("n"), num(0)), ret(num(1))),
                varDecl("half", callExpr(name, ref("x"), div(ref("n"), num(2)))),
                ifElse(eq(mod(ref("n"), num(2)), num(0)),
                        ret(times(ref("half"), ref("half"))),
                        ret(times(ref("x"), times(ref("half"), ref("half"))))));
    }

    /** Three calls on n / 2 plus a linear pass. */
    static Procedure karatsuba(String name) {
        return procedure(name, List.of("n"),
                ifThen(le(ref("n"), num(1)), ret(num(1))),
                forLoop("i", num(1), ref("n"), call("add", ref("i"))),
                varDecl("p1", callExpr(name, div(ref("n"), num(2)))),
                varDecl("p2", callExpr(name, div(ref("n"), num(2)))),
                varDecl("p3", callExpr(name, div(ref("n"), num(2)))),
                ret(plus(ref("p1"), plus(ref("p2"), ref("p3")))));
    }

    /** Four calls on n - 1: a decision tree. */
    static Procedure backtracking(String name) {
        return procedure(name, List.of("n"),
                ifThen(eq(ref("n"), num(0)), ret()),
                call(name, minus(ref("n"), num(1))),
                call(name, minus(ref("n"), num(1))),
                call(name, minus(ref("n"), num(1))),
                call(name, minus(ref("n"), num(1))));
    }

    /** Mutual recursion through another procedure, with work after the call. */
    static Procedure parity(String name, String other) {
        return procedure(name, List.of("n"),
                ifThen(eq(ref("n"), num(0)), ret(bool(true))),
                ret(not(callExpr(other, minus(ref("n"), num(1))))));
    }

    /** for i = 1..n { for j = 1..n { x = x + 1 } } */
    static Procedure nestedLoops(String name) {
        return procedure(name, List.of("n"),
                varDecl("x", num(0)),
                forLoop("i", num(1), ref("n"),
                        forLoop("j", num(1), ref("n"),
                                assign("x", plus(ref("x"), num(1))))),
                ret(ref("x")));
    }

    static Program program(Procedure... procedures) {
        return Program.of(block(), procedures);
    }
}
