package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.Ast.Stmt;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Decides tail recursion structurally.
 *
 * Terminal positions are the last statement of a block, both branches of an {@code if} and the
 * value of any {@code return}.
 * A body is tail recursive when at least one recursive call exists, every recursive call is
 * itself a terminal ({@code call P(...)} or {@code return P(...)}), and none is nested inside
 * another expression. Terminals without recursive calls are base cases and are allowed.
 */
final class TailCallPredicate {

    private final Set<String> targets;

    TailCallPredicate(Set<String> targets) {
        this.targets = targets;
    }

    boolean isTailRecursive(Ast.Block body) {
        List<Ast.Invocation> sites = Shapes.callSites(body, targets);
        if (sites.isEmpty()) {
            return false;
        }
        Set<Ast.Invocation> tailCalls = Collections.newSetFromMap(new IdentityHashMap<>());
        collectTailCalls(body, tailCalls);
        for (Ast.Return ret : body.findAll(Ast.Return.class)) {
            if (ret.value() instanceof Ast.CallExpr) {
                addIfRecursive((Ast.CallExpr) ret.value(), tailCalls);
            }
        }
        for (Ast.Invocation site : sites) {
            if (!tailCalls.contains(site)) {
                return false;
            }
        }
        return true;
    }

    private void collectTailCalls(Stmt stmt, Set<Ast.Invocation> tailCalls) {
        if (stmt instanceof Ast.Block) {
            List<Stmt> statements = ((Ast.Block) stmt).statements();
            if (!statements.isEmpty()) {
                collectTailCalls(statements.get(statements.size() - 1), tailCalls);
            }
        } else if (stmt instanceof Ast.If) {
            Ast.If branch = (Ast.If) stmt;
            collectTailCalls(branch.thenBranch(), tailCalls);
            collectTailCalls(branch.elseBranch(), tailCalls);
        } else if (stmt instanceof Ast.CallStmt) {
            addIfRecursive((Ast.CallStmt) stmt, tailCalls);
        } else if (stmt instanceof Ast.Return) {
            Ast.Expr value = ((Ast.Return) stmt).value();
            if (value instanceof Ast.CallExpr) {
                addIfRecursive((Ast.CallExpr) value, tailCalls);
            }
        }
    }

    private void addIfRecursive(Ast.Invocation call, Set<Ast.Invocation> tailCalls) {
        if (targets.contains(call.name())) {
            tailCalls.add(call);
        }
    }
}
