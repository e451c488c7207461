package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.Ast.BinOp;
import com.complexity.inferrer.ast.Ast.Expr;
import com.complexity.inferrer.ast.Procedure;
import com.complexity.inferrer.ast.Program;
import com.complexity.inferrer.config.AnalyzerConfig;
import com.complexity.inferrer.config.HeuristicRules;
import com.complexity.inferrer.model.RecursionInfo;
import com.complexity.inferrer.model.RecursionInfo.DepthPattern;
import com.complexity.inferrer.model.RecursionInfo.RecursionType;
import com.complexity.inferrer.model.Subproblem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * Detects the recursive structure of every procedure in a program.
 *
 * A procedure is recursive when it lies on a call cycle through declared procedures: directly
 * when it calls itself, indirectly otherwise. Calls to any member of its cycle are its recursive
 * calls. Shapes it cannot interpret end up as {@code UNKNOWN} rather than failing.
 *
 * One instance serves one analysis; it keeps the call graph of the last analyzed program.
 */
public class RecursionAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(RecursionAnalyzer.class);

    /**
     * Evidence a single call site gives about its subproblem, strongest first.
     */
    private enum Evidence {
        MIDPOINT, DIVIDE, PIVOT, SLICE, SUBTRACT, NONE
    }

    private final AnalyzerConfig config;
    private final HeuristicRules rules;
    private CallGraph callGraph = new CallGraph();
    private Program program;

    public RecursionAnalyzer(AnalyzerConfig config) {
        this.config = config;
        this.rules = config.getHeuristicRules();
    }

    public RecursionAnalyzer() {
        this(AnalyzerConfig.defaults());
    }

    /**
     * Computes the recursion info of every declared procedure, in declaration order.
     */
    public Map<String, RecursionInfo> analyze(Program program) {
        this.program = program;
        this.callGraph = new CallGraphBuilder().build(program);

        Map<String, RecursionInfo> result = new LinkedHashMap<>();
        for (Procedure procedure : program.getProcedures().values()) {
            RecursionInfo info;
            try {
                info = analyzeProcedure(procedure);
            } catch (AnalysisException e) {
                logger.warn("Recursion analysis of {} failed, treating its shape as unknown: {}",
                        procedure.name(), e.getMessage());
                info = unknownShape(procedure);
            }
            logger.debug("{}: recursive={}, type={}, calls={}, depth={}, subproblem={}", procedure.name(),
                    info.recursive(), info.type(), info.callCount(), info.depthPattern(), info.subproblem());
            result.put(procedure.name(), info);
        }
        return result;
    }

    public CallGraph getCallGraph() {
        return callGraph;
    }

    /**
     * Names whose calls count as recursive for the given procedure: its cycle members.
     */
    public Set<String> recursiveTargets(String name) {
        return callGraph.getCycleMembers(name);
    }

    private RecursionInfo analyzeProcedure(Procedure procedure) {
        String name = procedure.name();
        List<String> callsTo = callGraph.getCallees(name);
        Set<String> targets = callGraph.getCycleMembers(name);
        if (targets.isEmpty()) {
            return RecursionInfo.nonRecursive(callsTo);
        }

        Ast.Block body = procedure.body();
        RecursionType type = callsTo.contains(name) ? RecursionType.DIRECT : RecursionType.INDIRECT;
        if (new TailCallPredicate(targets).isTailRecursive(body)) {
            type = RecursionType.TAIL;
        }

        int callCount = new RecursiveCallCounter(targets).count(body);
        Subproblem subproblem = inferSubproblem(body, targets, callCount);
        boolean combining = hasCombiningWork(body, targets);
        DepthPattern depth = depthPattern(callCount, subproblem);

        return new RecursionInfo(true, type, callCount, callsTo, depth, subproblem, combining);
    }

    private RecursionInfo unknownShape(Procedure procedure) {
        List<String> callsTo = callGraph.getCallees(procedure.name());
        if (!callGraph.isOnCycle(procedure.name())) {
            return RecursionInfo.nonRecursive(callsTo);
        }
        RecursionType type = callsTo.contains(procedure.name()) ? RecursionType.DIRECT : RecursionType.INDIRECT;
        int count = (int) callsTo.stream().filter(callGraph.getCycleMembers(procedure.name())::contains).count();
        return new RecursionInfo(true, type, count, callsTo, DepthPattern.UNKNOWN, Subproblem.UNKNOWN, false);
    }

    static DepthPattern depthPattern(int callCount, Subproblem subproblem) {
        if (callCount <= 0) {
            return DepthPattern.UNKNOWN;
        }
        if (subproblem.isDivide()) {
            return DepthPattern.DIVIDE_AND_CONQUER;
        }
        return callCount == 1 ? DepthPattern.LINEAR : DepthPattern.TREE;
    }

    // ------------------------------------------------------------------
    // Subproblem inference
    // ------------------------------------------------------------------

    /**
     * Shape of the recursive argument. Distinct subtraction constants only make a mixed shape
     * when at least two calls run together; across exclusive branches the smallest one wins.
     */
    Subproblem inferSubproblem(Ast.Block body, Set<String> targets, int callCount) {
        List<Ast.Invocation> sites = Shapes.callSites(body, targets);
        if (sites.isEmpty()) {
            return Subproblem.UNKNOWN;
        }
        Set<String> midpoints = findMidpointVariables(body);
        Set<String> pivots = findPivotVariables(body, targets);

        Set<Evidence> seen = new HashSet<>();
        int divisor = 0;
        TreeSet<Integer> subtracted = new TreeSet<>();
        for (Ast.Invocation site : sites) {
            Evidence best = Evidence.NONE;
            int siteConstant = Integer.MAX_VALUE;
            for (Expr arg : site.args()) {
                Evidence evidence = classifyArgument(arg, midpoints, pivots);
                if (evidence == Evidence.DIVIDE && divisor == 0) {
                    divisor = Shapes.constantDivisor(arg).orElse(2);
                }
                if (evidence == Evidence.SUBTRACT) {
                    siteConstant = Math.min(siteConstant, Shapes.intValue(((BinOp) arg).right()).orElse(1));
                }
                if (evidence.ordinal() < best.ordinal()) {
                    best = evidence;
                }
            }
            if (best == Evidence.SUBTRACT) {
                subtracted.add(siteConstant);
            }
            seen.add(best);
        }

        if (seen.contains(Evidence.MIDPOINT)) {
            return Subproblem.midpoint();
        }
        if (seen.contains(Evidence.DIVIDE)) {
            return Subproblem.over(divisor);
        }
        if (seen.contains(Evidence.PIVOT)) {
            return Subproblem.over(2);
        }
        if (seen.contains(Evidence.SLICE)) {
            return Subproblem.SLICE;
        }
        if (subtracted.size() >= 2 && callCount >= 2) {
            return Subproblem.MIXED_CONSTANT_SUBTRACT;
        }
        if (!subtracted.isEmpty()) {
            return Subproblem.minus(subtracted.first());
        }
        return Subproblem.UNKNOWN;
    }

    private Evidence classifyArgument(Expr arg, Set<String> midpoints, Set<String> pivots) {
        if (arg == null) {
            return Evidence.NONE;
        }
        if (Shapes.isMidpointExpression(arg) || isOffsetOf(arg, midpoints)) {
            return Evidence.MIDPOINT;
        }
        if (Shapes.constantDivisor(arg).isPresent()) {
            return Evidence.DIVIDE;
        }
        if (isOffsetOf(arg, pivots)) {
            return Evidence.PIVOT;
        }
        if (arg instanceof Ast.ArrayRange) {
            return Evidence.SLICE;
        }
        if (arg instanceof BinOp) {
            BinOp bin = (BinOp) arg;
            OptionalInt k = Shapes.intValue(bin.right());
            if (bin.op() == BinOp.Operator.MINUS && k.isPresent() && k.getAsInt() >= 1) {
                return Evidence.SUBTRACT;
            }
        }
        return Evidence.NONE;
    }

    /**
     * {@code v}, {@code v + c} or {@code v - c} for a variable v from the given set.
     */
    private static boolean isOffsetOf(Expr arg, Set<String> variables) {
        if (variables.isEmpty()) {
            return false;
        }
        String name = Shapes.varName(arg);
        if (name != null) {
            return variables.contains(name);
        }
        if (arg instanceof BinOp) {
            BinOp bin = (BinOp) arg;
            boolean offset = bin.op() == BinOp.Operator.PLUS || bin.op() == BinOp.Operator.MINUS;
            String left = Shapes.varName(bin.left());
            return offset && left != null && variables.contains(left) && Shapes.isConstant(bin.right());
        }
        return false;
    }

    /**
     * Variables holding the midpoint of a range: assigned a midpoint expression, or assigned
     * at all under a conventional midpoint name.
     */
    Set<String> findMidpointVariables(Ast.Block body) {
        Set<String> byShape = new LinkedHashSet<>();
        Set<String> byName = new LinkedHashSet<>();
        for (Ast.Stmt stmt : body.findAll(Ast.Stmt.class)) {
            String name = Shapes.assignedVariable(stmt);
            Expr value = Shapes.assignedValue(stmt);
            if (name == null || value == null) {
                continue;
            }
            if (Shapes.isMidpointExpression(value)) {
                byShape.add(name);
            } else if (rules.isMidpointName(name)) {
                byName.add(name);
            }
        }
        byShape.addAll(byName);
        return byShape;
    }

    /**
     * Variables assigned from a non-recursive call, such as a partition point.
     */
    private Set<String> findPivotVariables(Ast.Block body, Set<String> targets) {
        Set<String> found = new LinkedHashSet<>();
        for (Ast.Stmt stmt : body.findAll(Ast.Stmt.class)) {
            String name = Shapes.assignedVariable(stmt);
            Expr value = Shapes.assignedValue(stmt);
            if (name != null && value instanceof Ast.CallExpr && !targets.contains(((Ast.CallExpr) value).name())) {
                found.add(name);
            }
        }
        return found;
    }

    // ------------------------------------------------------------------
    // Combining work
    // ------------------------------------------------------------------

    /**
     * Looks for a merge phase in the body and in the non-recursive procedures it calls.
     */
    boolean hasCombiningWork(Ast.Block body, Set<String> targets) {
        Set<String> visited = new HashSet<>(targets);
        Deque<Ast.Block> pending = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        pending.push(body);
        depths.push(0);
        while (!pending.isEmpty()) {
            Ast.Block current = pending.pop();
            int depth = depths.pop();
            if (Shapes.containsWithin(current, this::isMergeLoop, config.getMaxSearchDepth())) {
                return true;
            }
            if (depth >= config.getMaxCalleeDepth() || program == null) {
                continue;
            }
            for (Ast.Node node : current.findAll(Ast.Node.class)) {
                if (!(node instanceof Ast.Invocation)) {
                    continue;
                }
                String callee = ((Ast.Invocation) node).name();
                if (visited.add(callee) && program.declares(callee)) {
                    pending.push(program.getProcedures().get(callee).body());
                    depths.push(depth + 1);
                }
            }
        }
        return false;
    }

    /**
     * A loop guarded by a conjunction whose body copies one array element into another.
     */
    private boolean isMergeLoop(Ast.Node node) {
        Expr condition;
        Ast.Stmt loopBody;
        if (node instanceof Ast.While) {
            condition = ((Ast.While) node).condition();
            loopBody = ((Ast.While) node).body();
        } else if (node instanceof Ast.Repeat) {
            condition = ((Ast.Repeat) node).condition();
            loopBody = ((Ast.Repeat) node).body();
        } else {
            return false;
        }
        if (!Shapes.isConjunction(condition) || loopBody == null) {
            return false;
        }
        return Shapes.containsWithin(loopBody, RecursionAnalyzer::isArrayCopy, config.getMaxSearchDepth());
    }

    private static boolean isArrayCopy(Ast.Node node) {
        if (!(node instanceof Ast.Assign)) {
            return false;
        }
        Ast.Assign assign = (Ast.Assign) node;
        return assign.target() instanceof Ast.ArrayAccess && assign.value() instanceof Ast.ArrayAccess;
    }
}
