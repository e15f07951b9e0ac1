package svlower.transforms;

import static org.junit.jupiter.api.Assertions.*;
import static svlower.transforms.Trees.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import svlower.exec.Diagnostic;
import svlower.exec.DiagnosticLog;
import svlower.hir.*;
import svlower.hir.Module;
import svlower.hir.Process;

class LinkJumpTest {

    private static DiagnosticLog lower(Program program) {
        DiagnosticLog log = new DiagnosticLog();
        TransformPass.run(new LinkJump(program, log));
        return log;
    }

    private static DiagnosticLog lower(Module module) {
        return lower(program(module));
    }

    private static int count(Traversable t, Class<? extends Traversable> type) {
        return IRTools.getDescendentsOfType(t, type).size();
    }

    private static List<String> messages(DiagnosticLog log) {
        String[] ret = new String[log.getDiagnostics().size()];
        for (int i = 0; i < ret.length; i++) {
            ret[i] = log.getDiagnostics().get(i).getMessage();
        }
        return Arrays.asList(ret);
    }

    // function int f; if (a == 1) return 5; g(); return 7; endfunction
    private static Module functionWithTwoReturns(VariableDeclaration a) {
        Module module = new Module("top", "t.sv");
        module.addItem(a);
        Procedure f = new Procedure("f", Procedure.Kind.FUNCTION, DataType.INT);
        f.getBody().addStatement(new IfStatement(eq(a, 1),
                new ReturnStatement(lit(5))));
        f.getBody().addStatement(call("g"));
        f.getBody().addStatement(new ReturnStatement(lit(7)));
        module.addItem(f);
        return module;
    }

    @Test
    void functionReturnsAssignValueAndShareOneLabel() {
        VariableDeclaration a = var("a");
        Module module = functionWithTwoReturns(a);
        DiagnosticLog log = lower(module);

        assertTrue(log.isEmpty());
        assertEquals(0, count(module, ReturnStatement.class));
        assertEquals(2, count(module, JumpGo.class));
        assertEquals(1, count(module, JumpLabel.class));

        Procedure f = (Procedure)module.getChildren().get(1);
        List<Statement> body = f.getBody().getStatements();
        assertEquals(2, body.size());
        assertSame(f.getReturnVariable(), body.get(0));
        assertTrue(body.get(1) instanceof JumpBlock);

        Interpreter interp = new Interpreter(module);
        assertEquals(7, interp.call("f"));
        assertEquals(Collections.singletonList("g"), interp.getTrace());

        interp = new Interpreter(module);
        interp.set(a, 1);
        assertEquals(5, interp.call("f"));
        assertTrue(interp.getTrace().isEmpty());
    }

    @Test
    void taskReturnSkipsRestOfTask() {
        VariableDeclaration x = var("x");
        Module module = new Module("top", "t.sv");
        module.addItem(x);
        Procedure t = new Procedure("t", Procedure.Kind.TASK, null);
        t.getBody().addStatement(call("a"));
        t.getBody().addStatement(new IfStatement(eq(x, 0), new ReturnStatement()));
        t.getBody().addStatement(call("b"));
        module.addItem(t);

        assertTrue(lower(module).isEmpty());

        Interpreter interp = new Interpreter(module);
        interp.call("t");
        assertEquals(Arrays.asList("a"), interp.getTrace());

        interp = new Interpreter(module);
        interp.set(x, 1);
        interp.call("t");
        assertEquals(Arrays.asList("a", "b"), interp.getTrace());
    }

    @Test
    void returnUnderForkOutsideProcedureIsForkError() {
        Module module = initialModule(fork(at(2, new ReturnStatement())),
                call("after"));

        DiagnosticLog log = lower(module);

        assertEquals(1, log.getErrorCount());
        assertEquals(Arrays.asList(
                "Return isn't legal under fork (IEEE 1800-2023 9.2.3)"),
                messages(log));
        assertEquals(0, count(module, ReturnStatement.class));
        assertEquals(0, count(module, JumpGo.class));
    }

    @Test
    void constructorMayReturnWithoutValue() {
        Module module = new Module("top", "t.sv");
        Procedure ctor = new Procedure("new", Procedure.Kind.FUNCTION, DataType.INT);
        ctor.setConstructor(true);
        ctor.getBody().addStatement(new ReturnStatement());
        module.addItem(ctor);

        assertTrue(lower(module).isEmpty());
        assertEquals(1, count(module, JumpGo.class));
    }

    @Test
    void illegalReturnsAreReportedAndDropped() {
        Module module = initialModule(at(3, new ReturnStatement()));
        Procedure f = new Procedure("f", Procedure.Kind.FUNCTION, DataType.INT);
        f.getBody().addStatement(at(5, new ReturnStatement()));
        module.addItem(f);
        Procedure t = new Procedure("t", Procedure.Kind.TASK, null);
        t.getBody().addStatement(at(7, new ReturnStatement(lit(1))));
        t.getBody().addStatement(fork(at(8, new ReturnStatement())));
        module.addItem(t);

        DiagnosticLog log = lower(module);

        assertEquals(4, log.getErrorCount());
        assertEquals(Arrays.asList(
                "Return isn't underneath a task or function",
                "Return underneath a function should have return value",
                "Return underneath a task shouldn't have return value",
                "Return isn't legal under fork (IEEE 1800-2023 9.2.3)"),
                messages(log));
        Diagnostic first = log.getDiagnostics().get(0);
        assertEquals(Diagnostic.Severity.ERROR, first.getSeverity());
        assertEquals("t.sv:3", first.getLocation());
        assertEquals(0, count(module, ReturnStatement.class));
        assertEquals(0, count(module, JumpGo.class));
    }

    @Test
    void breakAndContinueInWhileLoop() {
        VariableDeclaration i = var("i");
        Module module = initialModule(
                new WhileLoop(lt(i, 5), block(
                        increment(i),
                        new IfStatement(eq(i, 2), new ContinueStatement()),
                        new IfStatement(eq(i, 4), new BreakStatement()),
                        call("emit", id(i)))),
                call("done"));
        module.addItem(i);

        assertTrue(lower(module).isEmpty());
        assertEquals(0, count(module, BreakStatement.class));
        assertEquals(0, count(module, ContinueStatement.class));
        assertEquals(2, count(module, JumpLabel.class));

        assertEquals(Arrays.asList("emit(1)", "emit(3)", "done"),
                new Interpreter(module).runInitial());
    }

    @Test
    void continueStillRunsIncrement() {
        VariableDeclaration i = var("i");
        Module module = initialModule(
                new WhileLoop(lt(i, 4), block(
                        new IfStatement(eq(i, 1), new ContinueStatement()),
                        call("emit", id(i))),
                        increment(i)));
        module.addItem(i);

        assertTrue(lower(module).isEmpty());
        assertTrue(i.isUsedLoopIndex());
        assertEquals(Arrays.asList("emit(0)", "emit(2)", "emit(3)"),
                new Interpreter(module).runInitial());
    }

    @Test
    void repeatedBreaksShareOneLabel() {
        VariableDeclaration i = var("i");
        Module module = initialModule(
                new WhileLoop(lit(1), block(
                        increment(i),
                        new IfStatement(eq(i, 3), new BreakStatement()),
                        new IfStatement(eq(i, 7), new BreakStatement()))));
        module.addItem(i);

        assertTrue(lower(module).isEmpty());
        assertEquals(2, count(module, JumpGo.class));
        assertEquals(1, count(module, JumpLabel.class));
        Interpreter interp = new Interpreter(module);
        interp.runInitial();
        assertEquals(3, interp.value(i));
    }

    @Test
    void breakInForeachLeavesLoop() {
        Module module = initialModule(
                new ForeachLoop(new NameID("arr"), block(new BreakStatement())));

        assertTrue(lower(module).isEmpty());
        Process p = (Process)module.getChildren().get(0);
        Statement first = p.getBody().getStatements().get(0);
        assertTrue(first instanceof JumpBlock);
        assertTrue(((JumpBlock)first).getStatements().get(0) instanceof ForeachLoop);
    }

    @Test
    void breakAndContinueOutsideLoopAreErrors() {
        Module module = initialModule(
                at(2, new BreakStatement()),
                at(3, new ContinueStatement()),
                call("after"));

        DiagnosticLog log = lower(module);

        assertEquals(Arrays.asList("break isn't underneath a loop",
                "continue isn't underneath a loop"), messages(log));
        assertEquals("t.sv:3", log.getDiagnostics().get(1).getLocation());
        assertEquals(0, count(module, BreakStatement.class));
        assertEquals(Arrays.asList("after"), new Interpreter(module).runInitial());
    }

    @Test
    void breakAndContinueUnderForkInLoopAreErrors() {
        VariableDeclaration i = var("i");
        Module module = initialModule(
                new WhileLoop(lt(i, 3), block(
                        fork(new BreakStatement(), new ContinueStatement()))));
        module.addItem(i);

        DiagnosticLog log = lower(module);

        assertEquals(Arrays.asList("break isn't legal under fork",
                "continue isn't legal under fork"), messages(log));
        assertEquals(0, count(module, JumpGo.class));
    }

    @Test
    void loopInsideForkMayBreak() {
        VariableDeclaration i = var("i");
        Module module = initialModule(fork(
                new WhileLoop(lit(1), block(
                        increment(i),
                        new IfStatement(eq(i, 2), new BreakStatement())))));
        module.addItem(i);

        assertTrue(lower(module).isEmpty());
        assertTrue(LinkJump.checkLowered(module));
        Interpreter interp = new Interpreter(module);
        interp.runInitial();
        assertEquals(2, interp.value(i));
    }

    @Test
    void disableLeavesNamedBlock() {
        VariableDeclaration x = var("x");
        Module module = initialModule(
                named("blk",
                        call("a"),
                        new IfStatement(eq(x, 0), new DisableStatement("blk")),
                        call("b")),
                call("c"));
        module.addItem(x);

        assertTrue(lower(module).isEmpty());
        assertEquals(0, count(module, DisableStatement.class));
        assertEquals(Arrays.asList("a", "c"), new Interpreter(module).runInitial());

        Interpreter interp = new Interpreter(module);
        interp.set(x, 1);
        assertEquals(Arrays.asList("a", "b", "c"), interp.runInitial());
    }

    @Test
    void disableBindsInnermostBlockWithName() {
        Module module = initialModule(
                named("x",
                        named("x", new DisableStatement("x"), call("inner")),
                        call("outer")));

        assertTrue(lower(module).isEmpty());
        assertEquals(Arrays.asList("outer"), new Interpreter(module).runInitial());
    }

    @Test
    void disableFromLoopLeavesLoop() {
        VariableDeclaration i = var("i");
        Module module = initialModule(
                named("outer",
                        new WhileLoop(lit(1), block(
                                increment(i),
                                new IfStatement(eq(i, 3),
                                        new DisableStatement("outer")))),
                        call("skipped")),
                call("after"));
        module.addItem(i);

        assertTrue(lower(module).isEmpty());
        Interpreter interp = new Interpreter(module);
        assertEquals(Arrays.asList("after"), interp.runInitial());
        assertEquals(3, interp.value(i));
    }

    @Test
    void unsupportedDisablesAreWarnedAndDropped() {
        ForkBlock named_fork = new ForkBlock("f", ForkBlock.JoinType.JOIN_ANY);
        named_fork.addStatement(new DisableStatement("f"));
        Module module = initialModule(
                at(4, new DisableStatement("nope")),
                named_fork,
                named("outer", fork(call("x")), new DisableStatement("outer")));

        DiagnosticLog log = lower(module);

        assertEquals(0, log.getErrorCount());
        assertEquals(3, log.getUnsupportedCount());
        assertEquals(Arrays.asList(
                "disable isn't underneath a begin with name: 'nope'",
                "Unsupported: disabling fork by name",
                "Unsupported: disabling block that contains a fork"),
                messages(log));
        assertEquals("%Warning-UNSUPPORTED: t.sv:4: " +
                "disable isn't underneath a begin with name: 'nope'",
                log.getDiagnostics().get(0).toString());
        assertEquals(0, count(module, DisableStatement.class));
        assertEquals(0, count(module, JumpBlock.class));
        assertEquals(0, count(module, JumpLabel.class));
    }

    @Test
    void unknownDisableLeavesRestOfTreeAlone() {
        Module module = initialModule(call("a"),
                named("blk", call("b"), new DisableStatement("nope")),
                call("c"));
        String expected = initialModule(call("a"),
                named("blk", call("b")), call("c")).toString();

        DiagnosticLog log = lower(module);

        assertEquals(1, log.getUnsupportedCount());
        assertEquals(expected, module.toString());
    }

    @Test
    void forkMarksEveryEnclosingBlock() {
        Module module = initialModule(
                named("a", named("b", fork(call("x"))), new DisableStatement("a")));

        DiagnosticLog log = lower(module);

        assertEquals(Arrays.asList(
                "Unsupported: disabling block that contains a fork"),
                messages(log));
    }

    @Test
    void repeatRunsCountTimes() {
        Module module = initialModule(
                new RepeatLoop(lit(3), call("r")),
                new RepeatLoop(lit(0), call("zero")),
                new RepeatLoop(lit(-1), call("negative")));

        assertTrue(lower(module).isEmpty());
        assertEquals(0, count(module, RepeatLoop.class));
        assertEquals(Arrays.asList("r", "r", "r"),
                new Interpreter(module).runInitial());
    }

    @Test
    void repeatCounterIsAutomaticLoopIndex() {
        Module first = initialModule(
                new RepeatLoop(lit(1), call("a")),
                new RepeatLoop(lit(1), call("b")));
        Module second = initialModule(new RepeatLoop(lit(1), call("c")));

        assertTrue(lower(program(first, second)).isEmpty());

        List<VariableDeclaration> vars =
                IRTools.getDescendentsOfType(first, VariableDeclaration.class);
        assertEquals(2, vars.size());
        assertEquals("__Vrepeat0", vars.get(0).getName());
        assertEquals("__Vrepeat1", vars.get(1).getName());
        VariableDeclaration counter = vars.get(0);
        assertEquals(VariableDeclaration.Kind.BLOCK_TEMP, counter.getKind());
        assertEquals(VariableDeclaration.Lifetime.AUTOMATIC, counter.getLifetime());
        assertEquals(DataType.INT, counter.getType());
        assertTrue(counter.isUsedLoopIndex());
        assertEquals("__Vrepeat0", IRTools.getDescendentsOfType(
                second, VariableDeclaration.class).get(0).getName());
    }

    @Test
    void repeatCountIsEvaluatedOnce() {
        VariableDeclaration n = var("n");
        Module module = initialModule(
                new RepeatLoop(id(n), block(increment(n), call("r"))));
        module.addItem(n);

        assertTrue(lower(module).isEmpty());
        Interpreter interp = new Interpreter(module);
        interp.set(n, 2);
        assertEquals(Arrays.asList("r", "r"), interp.runInitial());
        assertEquals(4, interp.value(n));
    }

    @Test
    void breakInRepeatLeavesConvertedLoop() {
        VariableDeclaration i = var("i");
        Module module = initialModule(
                new RepeatLoop(lit(5), block(
                        increment(i),
                        new IfStatement(eq(i, 3), new BreakStatement()))),
                call("done", id(i)));
        module.addItem(i);

        assertTrue(lower(module).isEmpty());
        assertEquals(Arrays.asList("done(3)"), new Interpreter(module).runInitial());
    }

    @Test
    void doLoopRunsBodyBeforeTest() {
        VariableDeclaration i = var("i");
        Module module = initialModule(
                new DoLoop(block(call("emit", id(i)), increment(i)), lt(i, 3)));
        module.addItem(i);

        assertTrue(lower(module).isEmpty());
        assertEquals(0, count(module, DoLoop.class));
        assertEquals(Arrays.asList("emit(0)", "emit(1)", "emit(2)"),
                new Interpreter(module).runInitial());

        Interpreter interp = new Interpreter(module);
        interp.set(i, 5);
        assertEquals(Arrays.asList("emit(5)"), interp.runInitial());

        Process p = (Process)module.getChildren().get(0);
        List<Statement> stmts = p.getBody().getStatements();
        assertEquals(2, stmts.size());
        assertTrue(stmts.get(1) instanceof WhileLoop);
        assertTrue(((WhileLoop)stmts.get(1)).isUnusedWarningOff());
    }

    @Test
    void breakInDoLoopCopyLeavesLoop() {
        VariableDeclaration i = var("i");
        Module module = initialModule(
                new DoLoop(block(
                        increment(i),
                        new IfStatement(eq(i, 2), new BreakStatement()),
                        call("emit", id(i))), lt(i, 5)),
                call("done"));
        module.addItem(i);

        assertTrue(lower(module).isEmpty());
        assertEquals(Arrays.asList("emit(1)", "done"),
                new Interpreter(module).runInitial());

        Interpreter interp = new Interpreter(module);
        interp.set(i, 1);
        assertEquals(Arrays.asList("done"), interp.runInitial());
    }

    @Test
    void continueInDoLoopCopyTargetsCopy() {
        VariableDeclaration i = var("i");
        Module module = initialModule(
                new DoLoop(block(
                        increment(i),
                        new IfStatement(eq(i, 2), new ContinueStatement()),
                        call("emit", id(i))), lt(i, 4)));
        module.addItem(i);

        assertTrue(lower(module).isEmpty());
        assertEquals(Arrays.asList("emit(1)", "emit(3)", "emit(4)"),
                new Interpreter(module).runInitial());

        Interpreter interp = new Interpreter(module);
        interp.set(i, 1);
        assertEquals(Arrays.asList("emit(3)", "emit(4)"), interp.runInitial());

        List<JumpLabel> labels = IRTools.getDescendentsOfType(module, JumpLabel.class);
        assertEquals(2, labels.size());
        assertEquals(LoopNormalizer.first_copy_prefix + "__Vjumplabel0",
                labels.get(0).getName());
        assertEquals(LoopNormalizer.loop_copy_prefix + "__Vjumplabel0",
                labels.get(1).getName());
    }

    @Test
    void doLoopBodyBlocksGetDistinctNames() {
        Module module = initialModule(
                new DoLoop(block(named("b", call("x"))), lit(0)));

        assertTrue(lower(module).isEmpty());
        List<Block> blocks = IRTools.getDescendentsOfType(module, Block.class);
        assertEquals(2, blocks.size());
        assertEquals("__Vdo_while1_b", blocks.get(0).getName());
        assertEquals("__Vdo_while2_b", blocks.get(1).getName());
    }

    @Test
    void disableInsideDoLoopBody() {
        VariableDeclaration i = var("i");
        Module module = initialModule(
                new DoLoop(block(named("b",
                        increment(i),
                        new IfStatement(eq(i, 2), new DisableStatement("b")),
                        call("emit", id(i)))), lt(i, 3)));
        module.addItem(i);

        assertTrue(lower(module).isEmpty());
        assertEquals(Arrays.asList("emit(1)", "emit(3)"),
                new Interpreter(module).runInitial());
    }

    @Test
    void unrollPragmaAppliesToNextLoopOnly() {
        WhileLoop first = new WhileLoop(lit(0), block());
        WhileLoop second = new WhileLoop(lit(0), block());
        Module module = initialModule(
                new PragmaStatement(PragmaStatement.PragmaType.UNROLL_FULL),
                first,
                second,
                new PragmaStatement(PragmaStatement.PragmaType.COVERAGE_BLOCK_OFF));

        assertTrue(lower(module).isEmpty());
        assertEquals(UnrollDirective.FULL, first.getUnroll());
        assertEquals(UnrollDirective.DEFAULT, second.getUnroll());
        List<PragmaStatement> pragmas =
                IRTools.getDescendentsOfType(module, PragmaStatement.class);
        assertEquals(1, pragmas.size());
        assertEquals(PragmaStatement.PragmaType.COVERAGE_BLOCK_OFF,
                pragmas.get(0).getType());
    }

    @Test
    void unrollPragmaAppliesToConvertedLoops() {
        Module module = initialModule(
                new PragmaStatement(PragmaStatement.PragmaType.UNROLL_DISABLE),
                new RepeatLoop(lit(2), block()),
                new PragmaStatement(PragmaStatement.PragmaType.UNROLL_FULL),
                new DoLoop(block(new WhileLoop(lit(0), block())), lit(0)));

        assertTrue(lower(module).isEmpty());
        List<WhileLoop> loops = IRTools.getDescendentsOfType(module, WhileLoop.class);
        // repeat loop, copy of the inner loop, do loop, inner loop
        assertEquals(4, loops.size());
        assertEquals(UnrollDirective.DISABLE, loops.get(0).getUnroll());
        assertEquals(UnrollDirective.DEFAULT, loops.get(1).getUnroll());
        assertEquals(UnrollDirective.FULL, loops.get(2).getUnroll());
        assertEquals(UnrollDirective.DEFAULT, loops.get(3).getUnroll());
    }

    @Test
    void unrollPragmaDoesNotLeaveItsBlock() {
        WhileLoop loop = new WhileLoop(lit(0), block());
        Module module = initialModule(
                named("b", new PragmaStatement(PragmaStatement.PragmaType.UNROLL_FULL)),
                loop);

        assertTrue(lower(module).isEmpty());
        assertEquals(UnrollDirective.DEFAULT, loop.getUnroll());
    }

    @Test
    void loopsInParameterizedModuleHaveUnusedWarningOff() {
        WhileLoop loop = new WhileLoop(lit(0), block());
        Module module = initialModule(loop);
        module.setParameterized(true);
        WhileLoop plain = new WhileLoop(lit(0), block());
        Module other = initialModule(plain);

        assertTrue(lower(program(module, other)).isEmpty());
        assertTrue(loop.isUnusedWarningOff());
        assertFalse(plain.isUnusedWarningOff());
    }

    @Test
    void deadModulesAreLeftAlone() {
        BreakStatement stray = new BreakStatement();
        Module module = initialModule(stray, new RepeatLoop(lit(1), block()));
        module.setDead(true);

        assertTrue(lower(module).isEmpty());
        assertNotNull(stray.getParent());
        assertEquals(1, count(module, RepeatLoop.class));
    }

    @Test
    void checkLoweredRejectsLeftoverTransfers() {
        assertFalse(LinkJump.checkLowered(initialModule(new BreakStatement())));
        assertFalse(LinkJump.checkLowered(
                initialModule(new DoLoop(block(), lit(0)))));
        assertTrue(LinkJump.checkLowered(initialModule(call("a"))));
    }

    @Test
    void checkLoweredRejectsBadJumps() {
        JumpBlock target = new JumpBlock();
        JumpLabel label = new JumpLabel("L");
        target.addStatement(label);
        // The jump is outside of the block owning its label.
        assertFalse(LinkJump.checkLowered(
                initialModule(target, new JumpGo(label))));

        JumpBlock outer = new JumpBlock();
        JumpLabel outer_label = new JumpLabel("M");
        outer.addStatement(fork(new JumpGo(outer_label)));
        outer.addStatement(outer_label);
        assertFalse(LinkJump.checkLowered(initialModule(outer)));

        JumpBlock good = new JumpBlock();
        JumpLabel good_label = new JumpLabel("N");
        good.addStatement(new JumpGo(good_label));
        good.addStatement(good_label);
        assertTrue(LinkJump.checkLowered(initialModule(good)));
    }

}
