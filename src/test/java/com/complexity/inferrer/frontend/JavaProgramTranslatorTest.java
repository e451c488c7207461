package com.complexity.inferrer.frontend;

import com.complexity.inferrer.analysis.AnalysisException;
import com.complexity.inferrer.analysis.ComplexityInferrer;
import com.complexity.inferrer.analysis.UnsupportedSyntaxException;
import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.Procedure;
import com.complexity.inferrer.ast.Program;
import com.complexity.inferrer.frontend.JavaProgramTranslator.TranslationResult;
import com.complexity.inferrer.model.CaseComplexity;
import com.complexity.inferrer.model.Complexity;
import com.complexity.inferrer.model.ComplexityExpression;
import com.complexity.inferrer.model.PatternClassification.AlgorithmPattern;
import com.complexity.inferrer.model.ProcedureAnalysis;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaProgramTranslatorTest {

    private final JavaProgramTranslator translator = new JavaProgramTranslator();
    private final ComplexityInferrer inferrer = new ComplexityInferrer();

    private static String sample(String name) throws IOException {
        try (InputStream in = JavaProgramTranslatorTest.class.getResourceAsStream("/samples/" + name)) {
            assertNotNull(in, "missing sample " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private Program program(String sample, String className) throws IOException {
        return translator.translate(sample(sample)).program(className).orElseThrow();
    }

    private static Ast.Block body(Program program, String procedure) {
        return program.getProcedure(procedure).map(Procedure::body).orElseThrow();
    }

    private static Ast.Stmt methodBody(String source) {
        Program program = new JavaProgramTranslator().translate(source).program("T").orElseThrow();
        return body(program, "m").statements().get(0);
    }

    // ------------------------------------------------------------------
    // Recursive methods
    // ------------------------------------------------------------------

    @Test
    void recursiveMethodsAreClassified() throws IOException {
        Complexity result = inferrer.analyze(program("Recursion.java", "Recursion"));

        assertEquals(AlgorithmPattern.FIBONACCI, result.getProcedure("fib").getClassification().getPattern());
        assertEquals(AlgorithmPattern.FACTORIAL, result.getProcedure("factorial").getClassification().getPattern());

        ProcedureAnalysis search = result.getProcedure("search");
        assertEquals(AlgorithmPattern.BINARY_SEARCH, search.getClassification().getPattern());
        assertEquals("O(log n)", search.getSolution().getLabel());
    }

    @Test
    void ternaryReturnBecomesTwoReturns() throws IOException {
        Ast.Stmt only = body(program("Recursion.java", "Recursion"), "factorial").statements().get(0);

        Ast.If branch = assertInstanceOf(Ast.If.class, only);
        assertInstanceOf(Ast.Return.class, branch.thenBranch());
        Ast.Return otherwise = assertInstanceOf(Ast.Return.class, branch.elseBranch());
        Ast.BinOp product = assertInstanceOf(Ast.BinOp.class, otherwise.value());
        assertEquals(Ast.BinOp.Operator.TIMES, product.op());
        assertEquals("factorial", assertInstanceOf(Ast.CallExpr.class, product.right()).name());
    }

    @Test
    void classWithoutMainHasAnEmptyBody() throws IOException {
        Program program = program("Recursion.java", "Recursion");

        assertTrue(program.getBody().isEmpty());
        assertEquals(List.of("fib", "search", "factorial"), List.copyOf(program.getProcedures().keySet()));
        assertEquals(List.of("a", "lo", "hi", "x"), program.getProcedure("search").orElseThrow().parameters());
    }

    // ------------------------------------------------------------------
    // Loops
    // ------------------------------------------------------------------

    @Test
    void mainBecomesTheProgramBody() throws IOException {
        Program program = program("Loops.java", "Loops");

        assertFalse(program.declares("main"));
        List<Ast.Stmt> statements = program.getBody().statements();
        assertEquals(4, statements.size());

        Ast.VarDecl size = assertInstanceOf(Ast.VarDecl.class, statements.get(0));
        Ast.StringFunc length = assertInstanceOf(Ast.StringFunc.class, size.initializer());
        assertEquals("length", length.function());

        Ast.For outer = assertInstanceOf(Ast.For.class, statements.get(2));
        assertEquals("i", outer.variable());
        assertEquals(0.0, assertInstanceOf(Ast.NumberLiteral.class, outer.start()).value());
        Ast.BinOp end = assertInstanceOf(Ast.BinOp.class, outer.end());
        assertEquals(Ast.BinOp.Operator.MINUS, end.op());
        assertEquals("n", assertInstanceOf(Ast.Var.class, end.left()).name());
        assertEquals(1.0, assertInstanceOf(Ast.NumberLiteral.class, end.right()).value());

        Ast.CallStmt print = assertInstanceOf(Ast.CallStmt.class, statements.get(3));
        assertEquals("System.out.println", print.name());
    }

    @Test
    void nestedCountingLoopsInMainAreQuadratic() throws IOException {
        Complexity result = inferrer.analyze(program("Loops.java", "Loops"));

        assertTrue(ComplexityExpression.polynomial(2).sameGrowth(result.getBigO()));
        assertEquals("O(n^2)", result.getBigOLabel());
    }

    @Test
    void literalBoundGivesAnExactEnd() {
        Ast.Stmt loop = methodBody("class T { void m() { for (int i = 0; i < 10; i++) { work(); } } }");

        Ast.For counting = assertInstanceOf(Ast.For.class, loop);
        assertEquals(9.0, assertInstanceOf(Ast.NumberLiteral.class, counting.end()).value());
    }

    @Test
    void decrementingLoopRunsFromTheBoundUp() {
        Ast.Stmt loop = methodBody("class T { void m(int n) { for (int i = n; i > 0; i--) { work(); } } }");

        Ast.For counting = assertInstanceOf(Ast.For.class, loop);
        assertEquals(1.0, assertInstanceOf(Ast.NumberLiteral.class, counting.start()).value());
        assertEquals("n", assertInstanceOf(Ast.Var.class, counting.end()).name());
    }

    @Test
    void loopWritingItsVariableBecomesAWhile() {
        Ast.Stmt loop = methodBody("class T { void m(int n) { for (int i = 1; i < n; i++) { i = i * 2; } } }");

        Ast.Block lowered = assertInstanceOf(Ast.Block.class, loop);
        assertInstanceOf(Ast.VarDecl.class, lowered.statements().get(0));
        assertInstanceOf(Ast.While.class, lowered.statements().get(1));
    }

    @Test
    void breakInACountingLoopMovesPastTheEnd() throws IOException {
        Ast.Block body = body(program("Loops.java", "Loops"), "indexOf");

        Ast.For loop = assertInstanceOf(Ast.For.class, body.statements().get(1));
        Ast.Block loopBody = assertInstanceOf(Ast.Block.class, loop.body());
        Ast.If found = assertInstanceOf(Ast.If.class, loopBody.statements().get(0));
        Ast.Block taken = assertInstanceOf(Ast.Block.class, found.thenBranch());

        Ast.Assign exit = assertInstanceOf(Ast.Assign.class, taken.statements().get(1));
        assertEquals("i", assertInstanceOf(Ast.Var.class, exit.target()).name());
        Ast.BinOp pastEnd = assertInstanceOf(Ast.BinOp.class, exit.value());
        assertEquals(Ast.BinOp.Operator.PLUS, pastEnd.op());
        assertEquals(loop.end(), pastEnd.left());
    }

    @Test
    void breakOutOfAWhileSetsAFlag() {
        Ast.Stmt loop = methodBody("class T { void m(int n) { while (n > 0) { if (n == 3) { break; } n--; } } }");

        Ast.While lowered = assertInstanceOf(Ast.While.class, loop);
        Ast.If test = assertInstanceOf(Ast.If.class, ((Ast.Block) lowered.body()).statements().get(0));
        Ast.Assign flag = assertInstanceOf(Ast.Assign.class, ((Ast.Block) test.thenBranch()).statements().get(0));
        assertEquals(JavaProgramTranslator.BREAK_FLAG, assertInstanceOf(Ast.Var.class, flag.target()).name());
        assertTrue(assertInstanceOf(Ast.BooleanLiteral.class, flag.value()).value());
    }

    @Test
    void earlyBreakMakesTheBestCaseConstant() throws IOException {
        CaseComplexity bounds = inferrer.analyze(program("Loops.java", "Loops"))
                .getProcedure("indexOf").getBounds().reduce();

        assertTrue(ComplexityExpression.linear().sameGrowth(bounds.getWorst()));
        assertTrue(bounds.getBest().isConstant());
        assertTrue(bounds.differs());
    }

    @Test
    void compoundDivisionHalvesTheControlVariable() throws IOException {
        Ast.Block body = body(program("Loops.java", "Loops"), "halvings");

        Ast.While loop = assertInstanceOf(Ast.While.class, body.statements().get(1));
        Ast.Assign halve = assertInstanceOf(Ast.Assign.class, ((Ast.Block) loop.body()).statements().get(0));
        Ast.BinOp value = assertInstanceOf(Ast.BinOp.class, halve.value());
        assertEquals(Ast.BinOp.Operator.DIV, value.op());
        assertEquals("n", assertInstanceOf(Ast.Var.class, value.left()).name());
        assertEquals(2.0, assertInstanceOf(Ast.NumberLiteral.class, value.right()).value());
    }

    @Test
    void shrinkingLoopsAreLogarithmic() throws IOException {
        Complexity result = inferrer.analyze(program("Loops.java", "Loops"));

        for (String name : List.of("halvings", "digits")) {
            ComplexityExpression worst = result.getProcedure(name).getBounds().reduce().getWorst();
            assertTrue(ComplexityExpression.logarithmic().sameGrowth(worst), name + ": " + worst);
        }
    }

    @Test
    void forEachRunsOverTheCollectionLength() throws IOException {
        Ast.Block body = body(program("Loops.java", "Loops"), "sum");

        Ast.For loop = assertInstanceOf(Ast.For.class, body.statements().get(1));
        assertEquals("v", loop.variable());
        Ast.StringFunc length = assertInstanceOf(Ast.StringFunc.class, loop.end());
        assertEquals("values", assertInstanceOf(Ast.Var.class, length.args().get(0)).name());
    }

    @Test
    void doWhileBecomesRepeatUntilTheNegatedCondition() throws IOException {
        Ast.Block body = body(program("Loops.java", "Loops"), "digits");

        Ast.Repeat loop = assertInstanceOf(Ast.Repeat.class, body.statements().get(1));
        Ast.UnOp until = assertInstanceOf(Ast.UnOp.class, loop.condition());
        assertEquals(Ast.UnOp.Operator.NOT, until.op());
        assertEquals(Ast.BinOp.Operator.NE, assertInstanceOf(Ast.BinOp.class, until.operand()).op());
    }

    @Test
    void switchBecomesChainedConditionals() throws IOException {
        Ast.Block body = body(program("Loops.java", "Loops"), "describe");

        Ast.If first = assertInstanceOf(Ast.If.class, body.statements().get(1));
        Ast.BinOp test = assertInstanceOf(Ast.BinOp.class, first.condition());
        assertEquals(Ast.BinOp.Operator.EQ, test.op());
        assertEquals("day", assertInstanceOf(Ast.Var.class, test.left()).name());

        Ast.If second = assertInstanceOf(Ast.If.class, first.elseBranch());
        assertEquals(6.0, assertInstanceOf(Ast.NumberLiteral.class,
                ((Ast.BinOp) second.condition()).right()).value());
        assertInstanceOf(Ast.Block.class, second.elseBranch());
    }

    // ------------------------------------------------------------------
    // Expressions and calls
    // ------------------------------------------------------------------

    @Test
    void compoundAssignmentExpandsToTheOperator() {
        Ast.Stmt stmt = methodBody("class T { void m(int x) { x += 2; } }");

        Ast.Assign assign = assertInstanceOf(Ast.Assign.class, stmt);
        Ast.BinOp value = assertInstanceOf(Ast.BinOp.class, assign.value());
        assertEquals(Ast.BinOp.Operator.PLUS, value.op());
        assertEquals("x", assertInstanceOf(Ast.Var.class, value.left()).name());
        assertEquals(2.0, assertInstanceOf(Ast.NumberLiteral.class, value.right()).value());
    }

    @Test
    void constantShiftIsAScaling() {
        Ast.Stmt stmt = methodBody("class T { void m(int x, int y) { x = y << 1; } }");

        Ast.BinOp value = assertInstanceOf(Ast.BinOp.class, ((Ast.Assign) stmt).value());
        assertEquals(Ast.BinOp.Operator.TIMES, value.op());
        assertEquals(2.0, assertInstanceOf(Ast.NumberLiteral.class, value.right()).value());
    }

    @Test
    void lengthFieldBecomesTheLengthFunction() {
        Ast.Stmt stmt = methodBody("class T { void m(int[] a) { int k = a.length; } }");

        Ast.StringFunc length = assertInstanceOf(Ast.StringFunc.class, ((Ast.VarDecl) stmt).initializer());
        assertEquals("length", length.function());
        assertEquals("a", assertInstanceOf(Ast.Var.class, length.args().get(0)).name());
    }

    @Test
    void ownCallsKeepTheirNameAndForeignCallsKeepTheReceiver() {
        Program program = translator.translate(
                "class T { void m() { this.m(); T.m(); list.add(1); } }").program("T").orElseThrow();
        List<Ast.Stmt> statements = body(program, "m").statements();

        assertEquals("m", ((Ast.CallStmt) statements.get(0)).name());
        assertEquals("m", ((Ast.CallStmt) statements.get(1)).name());
        assertEquals("list.add", ((Ast.CallStmt) statements.get(2)).name());
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void unsupportedMethodsAreReportedAndDropped() throws IOException {
        TranslationResult result = translator.translate(sample("Unsupported.java"));

        assertEquals(List.of("Unsupported"), List.copyOf(result.programs().keySet()));

        AnalysisException lambda = result.failures().get("Unsupported.apply");
        assertInstanceOf(UnsupportedSyntaxException.class, lambda);
        assertEquals("LambdaExpr", lambda.getNodeKind());

        AnalysisException overload = result.failures().get("Unsupported.square");
        assertNotNull(overload);
        assertEquals("MethodDeclaration", overload.getNodeKind());

        Program program = result.program("Unsupported").orElseThrow();
        assertEquals(List.of("square"), List.copyOf(program.getProcedures().keySet()));
        assertEquals(List.of("x"), program.getProcedure("square").orElseThrow().parameters());
    }

    @Test
    void programWithDroppedMethodsStillAnalyzes() throws IOException {
        Program program = program("Unsupported.java", "Unsupported");

        Complexity result = inferrer.analyze(program);

        assertTrue(result.getProcedure("square").getBounds().reduce().getWorst().isConstant());
        assertEquals("O(1)", result.getBigOLabel());
    }

    @Test
    void sourceThatDoesNotParseIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> translator.translate("class Broken { void m( }"));
    }
}
