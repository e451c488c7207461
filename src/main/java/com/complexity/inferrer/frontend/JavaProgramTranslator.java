package com.complexity.inferrer.frontend;

import com.complexity.inferrer.analysis.AnalysisException;
import com.complexity.inferrer.analysis.UnsupportedSyntaxException;
import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.Procedure;
import com.complexity.inferrer.ast.Program;
import com.complexity.inferrer.ast.SourceLocation;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.ArrayCreationLevel;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates Java source into pseudocode programs, one per top-level class.
 *
 * Methods with a body become procedures; a {@code main} method becomes the program body.
 * A method using a construct outside the pseudocode vocabulary is dropped from its program
 * and reported in {@link TranslationResult#failures()}, keyed {@code Class.method}.
 */
public class JavaProgramTranslator {

    private static final Logger logger = LoggerFactory.getLogger(JavaProgramTranslator.class);

    static final String BREAK_FLAG = "break";

    /**
     * Programs keyed by class name, plus the methods that could not be translated.
     */
    public record TranslationResult(Map<String, Program> programs, Map<String, AnalysisException> failures) {

        public TranslationResult {
            programs = Collections.unmodifiableMap(new LinkedHashMap<>(programs));
            failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        }

        public Optional<Program> program(String className) {
            return Optional.ofNullable(programs.get(className));
        }
    }

    private enum FrameKind {
        COUNTING_LOOP, LOOP, SWITCH
    }

    /**
     * Innermost construct a {@code break} leaves.
     */
    private record Frame(FrameKind kind, String variable, Ast.Expr end) {
    }

    private final JavaParser javaParser;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private String currentClass = "";

    public JavaProgramTranslator() {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(parserConfig);
    }

    public JavaParser getJavaParser() {
        return javaParser;
    }

    /**
     * Parses and translates one compilation unit.
     *
     * @throws IllegalArgumentException if the source does not parse
     */
    public TranslationResult translate(String source) {
        ParseResult<CompilationUnit> result = javaParser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new IllegalArgumentException("Source does not parse: " + result.getProblems());
        }
        return translate(result.getResult().get());
    }

    public TranslationResult translate(CompilationUnit cu) {
        Map<String, Program> programs = new LinkedHashMap<>();
        Map<String, AnalysisException> failures = new LinkedHashMap<>();
        for (TypeDeclaration<?> type : cu.getTypes()) {
            if (!type.isClassOrInterfaceDeclaration() || type.asClassOrInterfaceDeclaration().isInterface()) {
                continue;
            }
            ClassOrInterfaceDeclaration classDecl = type.asClassOrInterfaceDeclaration();
            programs.put(classDecl.getNameAsString(), translateClass(classDecl, failures));
        }
        return new TranslationResult(programs, failures);
    }

    private Program translateClass(ClassOrInterfaceDeclaration classDecl, Map<String, AnalysisException> failures) {
        currentClass = classDecl.getNameAsString();
        List<Procedure> procedures = new ArrayList<>();
        List<String> names = new ArrayList<>();
        Ast.Block body = null;

        for (MethodDeclaration method : classDecl.getMethods()) {
            if (method.getBody().isEmpty()) {
                continue;
            }
            String name = method.getNameAsString();
            String key = currentClass + "." + name;
            try {
                frames.clear();
                Ast.Block translated = block(method.getBody().get());
                if (isMain(method)) {
                    body = translated;
                } else if (names.contains(name)) {
                    throw new UnsupportedSyntaxException("Overloaded method " + name + " is already translated",
                            "MethodDeclaration", location(method));
                } else {
                    List<String> parameters = new ArrayList<>();
                    for (Parameter parameter : method.getParameters()) {
                        parameters.add(parameter.getNameAsString());
                    }
                    procedures.add(new Procedure(name, parameters, translated, location(method)));
                    names.add(name);
                }
                logger.trace("Translated {}", key);
            } catch (AnalysisException e) {
                logger.warn("Skipping {}: {}", key, e.getMessage());
                failures.put(key, e);
            }
        }
        logger.debug("Class {}: {} procedures translated", currentClass, procedures.size());
        return new Program(procedures, body);
    }

    private static boolean isMain(MethodDeclaration method) {
        return method.isStatic() && method.getNameAsString().equals("main") && method.getParameters().size() == 1;
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private Ast.Block block(BlockStmt blockStmt) {
        List<Ast.Stmt> statements = new ArrayList<>();
        for (Statement statement : blockStmt.getStatements()) {
            statements.add(statement(statement));
        }
        return new Ast.Block(statements, location(blockStmt));
    }

    private Ast.Stmt statement(Statement s) {
        SourceLocation at = location(s);
        if (s.isBlockStmt()) {
            return block(s.asBlockStmt());
        }
        if (s.isExpressionStmt()) {
            return expressionStatement(s.asExpressionStmt().getExpression());
        }
        if (s.isIfStmt()) {
            IfStmt ifStmt = s.asIfStmt();
            Ast.Stmt elseBranch = ifStmt.getElseStmt().isPresent() ? statement(ifStmt.getElseStmt().get()) : null;
            return new Ast.If(expression(ifStmt.getCondition()), statement(ifStmt.getThenStmt()), elseBranch, at);
        }
        if (s.isWhileStmt()) {
            Ast.Expr condition = expression(s.asWhileStmt().getCondition());
            return new Ast.While(condition, loopBody(s.asWhileStmt().getBody(), new Frame(FrameKind.LOOP, null, null)),
                    at);
        }
        if (s.isDoStmt()) {
            DoStmt doStmt = s.asDoStmt();
            Ast.Stmt body = loopBody(doStmt.getBody(), new Frame(FrameKind.LOOP, null, null));
            Ast.Expr until = new Ast.UnOp(Ast.UnOp.Operator.NOT, expression(doStmt.getCondition()), at);
            return new Ast.Repeat(body, until, at);
        }
        if (s.isForStmt()) {
            return forStatement(s.asForStmt());
        }
        if (s.isForEachStmt()) {
            return forEach(s.asForEachStmt());
        }
        if (s.isSwitchStmt()) {
            return switchStatement(s.asSwitchStmt());
        }
        if (s.isTryStmt()) {
            TryStmt tryStmt = s.asTryStmt();
            List<Ast.Stmt> parts = new ArrayList<>();
            parts.add(block(tryStmt.getTryBlock()));
            tryStmt.getFinallyBlock().ifPresent(finallyBlock -> parts.add(block(finallyBlock)));
            return new Ast.Block(parts, at);
        }
        if (s.isThrowStmt()) {
            return new Ast.Return(null, at);
        }
        if (s.isReturnStmt()) {
            return returnStatement(s.asReturnStmt());
        }
        if (s.isBreakStmt()) {
            return breakStatement(at);
        }
        if (s.isContinueStmt() || s.isEmptyStmt()) {
            return new Ast.Block(List.of(), at);
        }
        if (s.isLabeledStmt()) {
            return statement(s.asLabeledStmt().getStatement());
        }
        if (s.isSynchronizedStmt()) {
            return block(s.asSynchronizedStmt().getBody());
        }
        throw unsupported(s);
    }

    private Ast.Stmt loopBody(Statement body, Frame frame) {
        frames.push(frame);
        try {
            return statement(body);
        } finally {
            frames.pop();
        }
    }

    private Ast.Stmt breakStatement(SourceLocation at) {
        Frame frame = frames.peek();
        if (frame == null || frame.kind() == FrameKind.SWITCH) {
            return new Ast.Block(List.of(), at);
        }
        if (frame.kind() == FrameKind.COUNTING_LOOP) {
            Ast.Expr pastEnd = new Ast.BinOp(Ast.BinOp.Operator.PLUS, frame.end(), new Ast.NumberLiteral(1, at), at);
            return new Ast.Assign(new Ast.Var(frame.variable(), at), pastEnd, at);
        }
        return new Ast.Assign(new Ast.Var(BREAK_FLAG, at), new Ast.BooleanLiteral(true, at), at);
    }

    private Ast.Stmt returnStatement(ReturnStmt returnStmt) {
        SourceLocation at = location(returnStmt);
        if (returnStmt.getExpression().isEmpty()) {
            return new Ast.Return(null, at);
        }
        Expression value = unwrap(returnStmt.getExpression().get());
        if (value.isConditionalExpr()) {
            ConditionalExpr ternary = value.asConditionalExpr();
            return new Ast.If(expression(ternary.getCondition()),
                    new Ast.Return(expression(ternary.getThenExpr()), at),
                    new Ast.Return(expression(ternary.getElseExpr()), at), at);
        }
        return new Ast.Return(expression(value), at);
    }

    private Ast.Stmt expressionStatement(Expression e) {
        SourceLocation at = location(e);
        if (e.isAssignExpr()) {
            return assignment(e.asAssignExpr());
        }
        if (e.isUnaryExpr()) {
            UnaryExpr unary = e.asUnaryExpr();
            Ast.Expr target = expression(unary.getExpression());
            switch (unary.getOperator()) {
                case PREFIX_INCREMENT:
                case POSTFIX_INCREMENT:
                    return new Ast.Assign(target, step(target, Ast.BinOp.Operator.PLUS, at), at);
                case PREFIX_DECREMENT:
                case POSTFIX_DECREMENT:
                    return new Ast.Assign(target, step(target, Ast.BinOp.Operator.MINUS, at), at);
                default:
                    throw unsupported(e);
            }
        }
        if (e.isMethodCallExpr()) {
            MethodCallExpr call = e.asMethodCallExpr();
            return new Ast.CallStmt(calleeName(call), arguments(call.getArguments()), at);
        }
        if (e.isVariableDeclarationExpr()) {
            return declarations(e.asVariableDeclarationExpr());
        }
        throw unsupported(e);
    }

    private static Ast.Expr step(Ast.Expr target, Ast.BinOp.Operator op, SourceLocation at) {
        return new Ast.BinOp(op, target, new Ast.NumberLiteral(1, at), at);
    }

    private Ast.Stmt assignment(AssignExpr assign) {
        SourceLocation at = location(assign);
        Ast.Expr target = expression(assign.getTarget());
        Expression rawValue = unwrap(assign.getValue());
        if (assign.getOperator() == AssignExpr.Operator.ASSIGN && rawValue.isConditionalExpr()) {
            ConditionalExpr ternary = rawValue.asConditionalExpr();
            return new Ast.If(expression(ternary.getCondition()),
                    new Ast.Assign(target, expression(ternary.getThenExpr()), at),
                    new Ast.Assign(target, expression(ternary.getElseExpr()), at), at);
        }
        Ast.Expr value = expression(rawValue);
        if (assign.getOperator() == AssignExpr.Operator.ASSIGN) {
            return new Ast.Assign(target, value, at);
        }
        Optional<BinaryExpr.Operator> binary = assign.getOperator().toBinaryOperator();
        if (binary.isEmpty()) {
            throw unsupported(assign);
        }
        return new Ast.Assign(target, binary(binary.get(), target, value, assign), at);
    }

    private Ast.Stmt declarations(VariableDeclarationExpr declaration) {
        List<Ast.Stmt> statements = new ArrayList<>();
        for (VariableDeclarator variable : declaration.getVariables()) {
            statements.add(declaration(variable));
        }
        return statements.size() == 1 ? statements.get(0) : new Ast.Block(statements, location(declaration));
    }

    private Ast.Stmt declaration(VariableDeclarator variable) {
        SourceLocation at = location(variable);
        String name = variable.getNameAsString();
        if (variable.getInitializer().isEmpty()) {
            return new Ast.VarDecl(name, null, at);
        }
        Expression init = unwrap(variable.getInitializer().get());
        if (init.isArrayCreationExpr()) {
            ArrayCreationExpr creation = init.asArrayCreationExpr();
            List<Ast.Expr> dimensions = new ArrayList<>();
            for (ArrayCreationLevel level : creation.getLevels()) {
                level.getDimension().ifPresent(dimension -> dimensions.add(expression(dimension)));
            }
            if (dimensions.isEmpty() && creation.getInitializer().isPresent()) {
                dimensions.add(new Ast.NumberLiteral(creation.getInitializer().get().getValues().size(), at));
            }
            return new Ast.ArrayDecl(name, dimensions, at);
        }
        if (init.isArrayInitializerExpr()) {
            return new Ast.ArrayDecl(name,
                    List.of(new Ast.NumberLiteral(init.asArrayInitializerExpr().getValues().size(), at)), at);
        }
        if (init.isObjectCreationExpr()) {
            return new Ast.ObjectDecl(init.asObjectCreationExpr().getType().getNameAsString(), name, at);
        }
        if (init.isConditionalExpr()) {
            ConditionalExpr ternary = init.asConditionalExpr();
            Ast.Var target = new Ast.Var(name, at);
            return new Ast.Block(List.of(new Ast.VarDecl(name, null, at),
                    new Ast.If(expression(ternary.getCondition()),
                            new Ast.Assign(target, expression(ternary.getThenExpr()), at),
                            new Ast.Assign(target, expression(ternary.getElseExpr()), at), at)), at);
        }
        return new Ast.VarDecl(name, expression(init), at);
    }

    /**
     * {@code for (int i = s; i < e; i++)} and its decrementing mirror become counting loops;
     * every other shape becomes its initialisation followed by a {@code while}.
     */
    private Ast.Stmt forStatement(ForStmt forStmt) {
        SourceLocation at = location(forStmt);
        Optional<Ast.For> counting = countingLoop(forStmt);
        if (counting.isPresent()) {
            return counting.get();
        }

        List<Ast.Stmt> statements = new ArrayList<>();
        for (Expression init : forStmt.getInitialization()) {
            statements.add(expressionStatement(init));
        }
        Ast.Expr condition = forStmt.getCompare().isPresent()
                ? expression(forStmt.getCompare().get())
                : new Ast.BooleanLiteral(true, at);
        List<Ast.Stmt> body = new ArrayList<>();
        body.add(loopBody(forStmt.getBody(), new Frame(FrameKind.LOOP, null, null)));
        for (Expression update : forStmt.getUpdate()) {
            body.add(expressionStatement(update));
        }
        statements.add(new Ast.While(condition, new Ast.Block(body, at), at));
        return new Ast.Block(statements, at);
    }

    private Optional<Ast.For> countingLoop(ForStmt forStmt) {
        if (forStmt.getInitialization().size() != 1 || forStmt.getUpdate().size() != 1
                || forStmt.getCompare().isEmpty()) {
            return Optional.empty();
        }
        Expression init = forStmt.getInitialization().get(0);
        String variable;
        Expression start;
        if (init.isVariableDeclarationExpr() && init.asVariableDeclarationExpr().getVariables().size() == 1) {
            VariableDeclarator declarator = init.asVariableDeclarationExpr().getVariable(0);
            if (declarator.getInitializer().isEmpty()) {
                return Optional.empty();
            }
            variable = declarator.getNameAsString();
            start = declarator.getInitializer().get();
        } else if (init.isAssignExpr() && init.asAssignExpr().getOperator() == AssignExpr.Operator.ASSIGN
                && init.asAssignExpr().getTarget().isNameExpr()) {
            variable = init.asAssignExpr().getTarget().asNameExpr().getNameAsString();
            start = init.asAssignExpr().getValue();
        } else {
            return Optional.empty();
        }

        int direction = unitStep(forStmt.getUpdate().get(0), variable);
        Expression compare = unwrap(forStmt.getCompare().get());
        if (direction == 0 || !compare.isBinaryExpr() || writesTo(forStmt.getBody(), variable)) {
            return Optional.empty();
        }
        BinaryExpr comparison = compare.asBinaryExpr();
        if (!comparison.getLeft().isNameExpr()
                || !comparison.getLeft().asNameExpr().getNameAsString().equals(variable)) {
            return Optional.empty();
        }

        SourceLocation at = location(forStmt);
        Ast.Expr from = expression(start);
        Ast.Expr bound = expression(comparison.getRight());
        Ast.Expr lower;
        Ast.Expr upper;
        BinaryExpr.Operator op = comparison.getOperator();
        if (direction > 0 && op == BinaryExpr.Operator.LESS) {
            lower = from;
            upper = offset(bound, -1, at);
        } else if (direction > 0 && op == BinaryExpr.Operator.LESS_EQUALS) {
            lower = from;
            upper = bound;
        } else if (direction < 0 && op == BinaryExpr.Operator.GREATER) {
            lower = offset(bound, 1, at);
            upper = from;
        } else if (direction < 0 && op == BinaryExpr.Operator.GREATER_EQUALS) {
            lower = bound;
            upper = from;
        } else {
            return Optional.empty();
        }

        Ast.Stmt body = loopBody(forStmt.getBody(), new Frame(FrameKind.COUNTING_LOOP, variable, upper));
        return Optional.of(new Ast.For(variable, lower, upper, body, at));
    }

    /**
     * +1 for {@code i++}, {@code ++i}, {@code i += 1}; -1 for the decrements; 0 otherwise.
     */
    private static int unitStep(Expression update, String variable) {
        if (update.isUnaryExpr()) {
            UnaryExpr unary = update.asUnaryExpr();
            if (!unary.getExpression().isNameExpr()
                    || !unary.getExpression().asNameExpr().getNameAsString().equals(variable)) {
                return 0;
            }
            switch (unary.getOperator()) {
                case PREFIX_INCREMENT:
                case POSTFIX_INCREMENT:
                    return 1;
                case PREFIX_DECREMENT:
                case POSTFIX_DECREMENT:
                    return -1;
                default:
                    return 0;
            }
        }
        if (update.isAssignExpr()) {
            AssignExpr assign = update.asAssignExpr();
            boolean unit = assign.getValue().isIntegerLiteralExpr()
                    && assign.getValue().asIntegerLiteralExpr().getValue().equals("1");
            if (!unit || !assign.getTarget().isNameExpr()
                    || !assign.getTarget().asNameExpr().getNameAsString().equals(variable)) {
                return 0;
            }
            if (assign.getOperator() == AssignExpr.Operator.PLUS) {
                return 1;
            }
            return assign.getOperator() == AssignExpr.Operator.MINUS ? -1 : 0;
        }
        return 0;
    }

    private static boolean writesTo(Statement body, String variable) {
        boolean assigned = body.findAll(AssignExpr.class).stream()
                .anyMatch(assign -> assign.getTarget().isNameExpr()
                        && assign.getTarget().asNameExpr().getNameAsString().equals(variable));
        boolean stepped = body.findAll(UnaryExpr.class).stream()
                .anyMatch(unary -> (unary.getOperator().isPrefix() || unary.getOperator().isPostfix())
                        && unary.getExpression().isNameExpr()
                        && unary.getExpression().asNameExpr().getNameAsString().equals(variable));
        return assigned || stepped;
    }

    private static Ast.Expr offset(Ast.Expr bound, int delta, SourceLocation at) {
        if (bound instanceof Ast.NumberLiteral) {
            return new Ast.NumberLiteral(((Ast.NumberLiteral) bound).value() + delta, at);
        }
        Ast.BinOp.Operator op = delta < 0 ? Ast.BinOp.Operator.MINUS : Ast.BinOp.Operator.PLUS;
        return new Ast.BinOp(op, bound, new Ast.NumberLiteral(Math.abs(delta), at), at);
    }

    private Ast.Stmt forEach(ForEachStmt forEach) {
        SourceLocation at = location(forEach);
        String variable = forEach.getVariableDeclarator().getNameAsString();
        Ast.Expr size = new Ast.StringFunc("length", List.of(expression(forEach.getIterable())), at);
        Ast.Stmt body = loopBody(forEach.getBody(), new Frame(FrameKind.COUNTING_LOOP, variable, size));
        return new Ast.For(variable, new Ast.NumberLiteral(1, at), size, body, at);
    }

    /**
     * Chained {@code if}s comparing the selector with each label; {@code default} is the final else.
     */
    private Ast.Stmt switchStatement(SwitchStmt switchStmt) {
        SourceLocation at = location(switchStmt);
        Ast.Expr selector = expression(switchStmt.getSelector());
        frames.push(new Frame(FrameKind.SWITCH, null, null));
        try {
            Ast.Stmt otherwise = null;
            List<Ast.Expr> conditions = new ArrayList<>();
            List<Ast.Stmt> branches = new ArrayList<>();
            for (SwitchEntry entry : switchStmt.getEntries()) {
                Ast.Block branch = entryBody(entry);
                if (entry.getLabels().isEmpty()) {
                    otherwise = branch;
                    continue;
                }
                Ast.Expr condition = null;
                for (Expression label : entry.getLabels()) {
                    Ast.Expr test = new Ast.BinOp(Ast.BinOp.Operator.EQ, selector, expression(label), at);
                    condition = condition == null ? test : new Ast.BinOp(Ast.BinOp.Operator.OR, condition, test, at);
                }
                conditions.add(condition);
                branches.add(branch);
            }
            Ast.Stmt chain = otherwise;
            for (int i = conditions.size() - 1; i >= 0; i--) {
                chain = new Ast.If(conditions.get(i), branches.get(i), chain, at);
            }
            return chain == null ? new Ast.Block(List.of(), at) : chain;
        } finally {
            frames.pop();
        }
    }

    private Ast.Block entryBody(SwitchEntry entry) {
        List<Ast.Stmt> statements = new ArrayList<>();
        for (Statement statement : entry.getStatements()) {
            statements.add(statement(statement));
        }
        return new Ast.Block(statements, location(entry));
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    private Ast.Expr expression(Expression e) {
        SourceLocation at = location(e);
        if (e.isEnclosedExpr()) {
            return expression(e.asEnclosedExpr().getInner());
        }
        if (e.isCastExpr()) {
            return expression(e.asCastExpr().getExpression());
        }
        if (e.isIntegerLiteralExpr()) {
            return new Ast.NumberLiteral(e.asIntegerLiteralExpr().asNumber().doubleValue(), at);
        }
        if (e.isLongLiteralExpr()) {
            return new Ast.NumberLiteral(e.asLongLiteralExpr().asNumber().doubleValue(), at);
        }
        if (e.isDoubleLiteralExpr()) {
            return new Ast.NumberLiteral(e.asDoubleLiteralExpr().asDouble(), at);
        }
        if (e.isCharLiteralExpr()) {
            return new Ast.StringLiteral(e.asCharLiteralExpr().getValue(), at);
        }
        if (e.isStringLiteralExpr()) {
            return new Ast.StringLiteral(e.asStringLiteralExpr().getValue(), at);
        }
        if (e.isBooleanLiteralExpr()) {
            return new Ast.BooleanLiteral(e.asBooleanLiteralExpr().getValue(), at);
        }
        if (e.isNullLiteralExpr()) {
            return new Ast.NullLiteral(at);
        }
        if (e.isNameExpr()) {
            return new Ast.Var(e.asNameExpr().getNameAsString(), at);
        }
        if (e.isBinaryExpr()) {
            BinaryExpr bin = e.asBinaryExpr();
            return binary(bin.getOperator(), expression(bin.getLeft()), expression(bin.getRight()), bin);
        }
        if (e.isUnaryExpr()) {
            return unary(e.asUnaryExpr());
        }
        if (e.isMethodCallExpr()) {
            return methodCall(e.asMethodCallExpr());
        }
        if (e.isFieldAccessExpr()) {
            return fieldAccess(e.asFieldAccessExpr());
        }
        if (e.isArrayAccessExpr()) {
            return arrayAccess(e.asArrayAccessExpr());
        }
        if (e.isConditionalExpr()) {
            throw new UnsupportedSyntaxException("Conditional expression inside an expression",
                    "ConditionalExpr", at);
        }
        throw unsupported(e);
    }

    private Ast.Expr binary(BinaryExpr.Operator op, Ast.Expr left, Ast.Expr right, Node origin) {
        SourceLocation at = location(origin);
        switch (op) {
            case PLUS:
                return new Ast.BinOp(Ast.BinOp.Operator.PLUS, left, right, at);
            case MINUS:
                return new Ast.BinOp(Ast.BinOp.Operator.MINUS, left, right, at);
            case MULTIPLY:
                return new Ast.BinOp(Ast.BinOp.Operator.TIMES, left, right, at);
            case DIVIDE:
                return new Ast.BinOp(Ast.BinOp.Operator.DIV, left, right, at);
            case REMAINDER:
                return new Ast.BinOp(Ast.BinOp.Operator.MOD, left, right, at);
            case AND:
                return new Ast.BinOp(Ast.BinOp.Operator.AND, left, right, at);
            case OR:
                return new Ast.BinOp(Ast.BinOp.Operator.OR, left, right, at);
            case EQUALS:
                return new Ast.BinOp(Ast.BinOp.Operator.EQ, left, right, at);
            case NOT_EQUALS:
                return new Ast.BinOp(Ast.BinOp.Operator.NE, left, right, at);
            case LESS:
                return new Ast.BinOp(Ast.BinOp.Operator.LT, left, right, at);
            case LESS_EQUALS:
                return new Ast.BinOp(Ast.BinOp.Operator.LE, left, right, at);
            case GREATER:
                return new Ast.BinOp(Ast.BinOp.Operator.GT, left, right, at);
            case GREATER_EQUALS:
                return new Ast.BinOp(Ast.BinOp.Operator.GE, left, right, at);
            case BINARY_AND:
                return new Ast.BinOp(Ast.BinOp.Operator.BIT_AND, left, right, at);
            case BINARY_OR:
                return new Ast.BinOp(Ast.BinOp.Operator.BIT_OR, left, right, at);
            case XOR:
                return new Ast.BinOp(Ast.BinOp.Operator.BIT_XOR, left, right, at);
            case LEFT_SHIFT:
                return shift(Ast.BinOp.Operator.SHL, Ast.BinOp.Operator.TIMES, left, right, at);
            case SIGNED_RIGHT_SHIFT:
            case UNSIGNED_RIGHT_SHIFT:
                return shift(Ast.BinOp.Operator.SHR, Ast.BinOp.Operator.DIV, left, right, at);
            default:
                throw new UnsupportedSyntaxException("Operator " + op.asString(), "BinaryExpr", at);
        }
    }

    /**
     * A shift by a constant is a multiplication or division by a power of two.
     */
    private static Ast.Expr shift(Ast.BinOp.Operator shiftOp, Ast.BinOp.Operator scaleOp, Ast.Expr left,
                                  Ast.Expr right, SourceLocation at) {
        if (right instanceof Ast.NumberLiteral && ((Ast.NumberLiteral) right).isInteger()) {
            long amount = ((Ast.NumberLiteral) right).longValue();
            if (amount >= 0 && amount < 31) {
                return new Ast.BinOp(scaleOp, left, new Ast.NumberLiteral(1L << amount, at), at);
            }
        }
        return new Ast.BinOp(shiftOp, left, right, at);
    }

    private Ast.Expr unary(UnaryExpr unary) {
        SourceLocation at = location(unary);
        switch (unary.getOperator()) {
            case MINUS:
                return new Ast.UnOp(Ast.UnOp.Operator.NEG, expression(unary.getExpression()), at);
            case PLUS:
                return expression(unary.getExpression());
            case LOGICAL_COMPLEMENT:
                return new Ast.UnOp(Ast.UnOp.Operator.NOT, expression(unary.getExpression()), at);
            default:
                throw new UnsupportedSyntaxException("Operator " + unary.getOperator().asString()
                        + " inside an expression", "UnaryExpr", at);
        }
    }

    private Ast.Expr methodCall(MethodCallExpr call) {
        SourceLocation at = location(call);
        String name = call.getNameAsString();
        Optional<Expression> scope = call.getScope();
        if (scope.isPresent() && scope.get().isNameExpr()
                && scope.get().asNameExpr().getNameAsString().equals("Math")) {
            switch (name) {
                case "floor":
                    return new Ast.UnOp(Ast.UnOp.Operator.FLOOR, expression(call.getArgument(0)), at);
                case "ceil":
                    return new Ast.UnOp(Ast.UnOp.Operator.CEIL, expression(call.getArgument(0)), at);
                case "pow":
                    return new Ast.BinOp(Ast.BinOp.Operator.POW, expression(call.getArgument(0)),
                            expression(call.getArgument(1)), at);
                default:
                    break;
            }
        }
        if (scope.isPresent() && call.getArguments().isEmpty() && (name.equals("length") || name.equals("size"))) {
            return new Ast.StringFunc("length", List.of(expression(scope.get())), at);
        }
        return new Ast.CallExpr(calleeName(call), arguments(call.getArguments()), at);
    }

    /**
     * Unqualified and {@code this.}/own-class calls keep their name; other receivers are kept in
     * the name so they never resolve to a declared procedure.
     */
    private String calleeName(MethodCallExpr call) {
        String name = call.getNameAsString();
        if (call.getScope().isEmpty()) {
            return name;
        }
        Expression scope = call.getScope().get();
        if (scope.isThisExpr() || (scope.isNameExpr() && scope.asNameExpr().getNameAsString().equals(currentClass))) {
            return name;
        }
        return scope + "." + name;
    }

    private List<Ast.Expr> arguments(NodeList<Expression> args) {
        List<Ast.Expr> translated = new ArrayList<>();
        for (Expression arg : args) {
            translated.add(expression(arg));
        }
        return translated;
    }

    private Ast.Expr fieldAccess(FieldAccessExpr access) {
        SourceLocation at = location(access);
        if (access.getNameAsString().equals("length")) {
            return new Ast.StringFunc("length", List.of(expression(access.getScope())), at);
        }
        if (access.getScope().isThisExpr()) {
            return new Ast.Var(access.getNameAsString(), at);
        }
        return new Ast.FieldAccess(expression(access.getScope()), access.getNameAsString(), at);
    }

    private Ast.Expr arrayAccess(ArrayAccessExpr access) {
        List<Ast.Expr> indices = new ArrayList<>();
        Expression current = access;
        while (current.isArrayAccessExpr()) {
            indices.add(0, expression(current.asArrayAccessExpr().getIndex()));
            current = current.asArrayAccessExpr().getName();
        }
        return new Ast.ArrayAccess(expression(current), indices, location(access));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Expression unwrap(Expression e) {
        Expression current = e;
        while (current.isEnclosedExpr()) {
            current = current.asEnclosedExpr().getInner();
        }
        return current;
    }

    private static UnsupportedSyntaxException unsupported(Node node) {
        return new UnsupportedSyntaxException("Unsupported construct: " + node.getClass().getSimpleName(),
                node.getClass().getSimpleName(), location(node));
    }

    static SourceLocation location(Node node) {
        return node.getRange()
                .map(range -> SourceLocation.of(range.begin.line, range.begin.column))
                .orElse(SourceLocation.UNKNOWN);
    }
}
