package svlower.transforms;

import svlower.exec.DiagnosticSink;
import svlower.hir.*;
import svlower.hir.Module;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
* Lowers return, break, continue and disable statements into jumps to
* labels, and rewrites repeat and do loops into while loops.
*
* <p>After this pass the only non-local control transfers left in live
* modules are {@link JumpGo}s, each targeting the {@link JumpLabel} of an
* enclosing {@link JumpBlock} with no fork block in between. Illegal or
* unsupported transfers are reported to the diagnostic sink and removed.
*/
public class LinkJump extends TransformPass {

    private static final String pass_name = "[LinkJump]";

    private static final String repeat_prefix = "__Vrepeat";

    private final DiagnosticSink diagnostics;

    private LabelInjector labels;

    private LoopNormalizer loops;

    /** Named blocks with a fork block at or below them */
    private final Set<Block> contains_fork;

    /** Enclosing blocks, innermost first */
    private final Deque<Block> block_stack;

    // Traversal context; saved on entry to a construct, restored on exit.
    private Module current_module;
    private Procedure current_procedure;
    private Statement current_loop;
    private boolean in_increment;
    private boolean in_fork;
    private boolean fork_in_loop;
    private UnrollDirective pending_unroll;
    private int repeat_count;

    private int num_returns, num_breaks, num_continues, num_disables;

    private int num_dropped;

    /**
    * Constructs the pass.
    *
    * @param program the program to transform.
    * @param diagnostics receives the illegal and unsupported transfers.
    */
    public LinkJump(Program program, DiagnosticSink diagnostics) {
        super(program);
        this.diagnostics = diagnostics;
        contains_fork = Collections.newSetFromMap(
                new IdentityHashMap<Block, Boolean>());
        block_stack = new ArrayDeque<Block>();
    }

    @Override
    public String getPassName() {
        return pass_name;
    }

    @Override
    public void start() {
        labels = new LabelInjector();
        loops = new LoopNormalizer();
        contains_fork.clear();
        block_stack.clear();
        current_module = null;
        current_procedure = null;
        current_loop = null;
        in_increment = false;
        in_fork = false;
        fork_in_loop = false;
        pending_unroll = UnrollDirective.DEFAULT;
        num_returns = num_breaks = num_continues = num_disables = 0;
        num_dropped = 0;
        for (Module module : new ArrayList<Module>(program.getModules())) {
            visitModule(module);
        }
        PrintTools.printlnStatus(1, pass_name, "lowered", num_returns,
                "return(s),", num_breaks, "break(s),", num_continues,
                "continue(s),", num_disables, "disable(s); dropped",
                num_dropped);
        PrintTools.printlnStatus(1, pass_name, "converted",
                loops.getNumRepeats(), "repeat loop(s),",
                loops.getNumDoLoops(), "do loop(s); created",
                labels.getNumLabels(), "label(s)");
    }

    @Override
    protected boolean checkResult() {
        return checkLowered(program);
    }

    private void visit(Traversable t) {
        if (t instanceof Procedure) {
            visitProcedure((Procedure)t);
        } else if (t instanceof Block) {
            visitBlock((Block)t);
        } else if (t instanceof PragmaStatement) {
            visitPragma((PragmaStatement)t);
        } else if (t instanceof RepeatLoop) {
            visitRepeat((RepeatLoop)t);
        } else if (t instanceof WhileLoop) {
            visitWhile((WhileLoop)t);
        } else if (t instanceof DoLoop) {
            visitDo((DoLoop)t);
        } else if (t instanceof ForeachLoop) {
            visitForeach((ForeachLoop)t);
        } else if (t instanceof ReturnStatement) {
            visitReturn((ReturnStatement)t);
        } else if (t instanceof BreakStatement) {
            visitBreak((BreakStatement)t);
        } else if (t instanceof ContinueStatement) {
            visitContinue((ContinueStatement)t);
        } else if (t instanceof DisableStatement) {
            visitDisable((DisableStatement)t);
        } else if (t instanceof Identifier) {
            visitIdentifier((Identifier)t);
        } else {
            visitChildren(t);
        }
    }

    // Iterates over a snapshot: visited statements may move into a new jump
    // block, and removed ones are skipped.
    private void visitChildren(Traversable t) {
        List<Traversable> children = new ArrayList<Traversable>(t.getChildren());
        for (Traversable child : children) {
            if (child.getParent() != null) {
                visit(child);
            }
        }
    }

    private void visitModule(Module module) {
        if (module.isDead()) {
            PrintTools.printlnStatus(2, pass_name, "skipping dead module",
                    module.getName());
            return;
        }
        PrintTools.printlnStatus(1, pass_name, "module", module.getName());
        Module save_module = current_module;
        int save_repeat_count = repeat_count;
        current_module = module;
        repeat_count = 0;
        try {
            visitChildren(module);
        } finally {
            current_module = save_module;
            repeat_count = save_repeat_count;
        }
    }

    private void visitProcedure(Procedure proc) {
        Procedure save_procedure = current_procedure;
        current_procedure = proc;
        try {
            visitChildren(proc);
        } finally {
            current_procedure = save_procedure;
        }
    }

    private void visitBlock(Block block) {
        boolean save_in_fork = in_fork;
        boolean save_fork_in_loop = fork_in_loop;
        UnrollDirective save_unroll = pending_unroll;
        block_stack.push(block);
        try {
            if (block.isParallel()) {
                in_fork = true;
                fork_in_loop = true;
                // Stop at the first marked block; its ancestors are marked.
                for (Block b : block_stack) {
                    if (!contains_fork.add(b)) {
                        break;
                    }
                }
            }
            if (in_fork) {
                contains_fork.add(block);
            }
            visitChildren(block);
        } finally {
            block_stack.pop();
            in_fork = save_in_fork;
            fork_in_loop = save_fork_in_loop;
            pending_unroll = save_unroll;
        }
    }

    private void visitPragma(PragmaStatement pragma) {
        switch (pragma.getType()) {
        case UNROLL_FULL:
            pending_unroll = UnrollDirective.FULL;
            pragma.detach();
            break;
        case UNROLL_DISABLE:
            pending_unroll = UnrollDirective.DISABLE;
            pragma.detach();
            break;
        default:
            visitChildren(pragma);
            break;
        }
    }

    private void visitRepeat(RepeatLoop loop) {
        String name = repeat_prefix + repeat_count++;
        Block block = loops.convertRepeat(loop, name, pending_unroll);
        pending_unroll = UnrollDirective.DEFAULT;
        visit(block);
    }

    private void visitWhile(WhileLoop loop) {
        if (pending_unroll != UnrollDirective.DEFAULT) {
            loop.setUnroll(pending_unroll);
        }
        pending_unroll = UnrollDirective.DEFAULT;
        if (current_module != null && current_module.isParameterized()) {
            loop.setUnusedWarningOff(true);
        }
        Statement save_loop = current_loop;
        boolean save_in_increment = in_increment;
        boolean save_fork_in_loop = fork_in_loop;
        current_loop = loop;
        in_increment = false;
        fork_in_loop = false;
        try {
            visit(loop.getCondition());
            visit(loop.getBody());
            in_increment = true;
            visit(loop.getIncrement());
        } finally {
            current_loop = save_loop;
            in_increment = save_in_increment;
            fork_in_loop = save_fork_in_loop;
        }
    }

    private void visitDo(DoLoop loop) {
        // The directive belongs to this loop, not to loops in its body.
        UnrollDirective unroll = pending_unroll;
        pending_unroll = UnrollDirective.DEFAULT;
        Statement save_loop = current_loop;
        boolean save_in_increment = in_increment;
        boolean save_fork_in_loop = fork_in_loop;
        current_loop = loop;
        in_increment = false;
        fork_in_loop = false;
        try {
            visit(loop.getBody());
            visit(loop.getCondition());
        } finally {
            current_loop = save_loop;
            in_increment = save_in_increment;
            fork_in_loop = save_fork_in_loop;
        }
        loops.convertDo(loop, unroll);
    }

    private void visitForeach(ForeachLoop loop) {
        Statement save_loop = current_loop;
        boolean save_fork_in_loop = fork_in_loop;
        current_loop = loop;
        fork_in_loop = false;
        try {
            visit(loop.getBody());
        } finally {
            current_loop = save_loop;
            fork_in_loop = save_fork_in_loop;
        }
    }

    private void visitReturn(ReturnStatement stmt) {
        visitChildren(stmt);
        Procedure proc = current_procedure;
        if (in_fork) {
            report(stmt, "Return isn't legal under fork (IEEE 1800-2023 9.2.3)");
        } else if (proc == null) {
            report(stmt, "Return isn't underneath a task or function");
        } else if (proc.isFunction() && stmt.getExpression() == null &&
                   !proc.isConstructor()) {
            report(stmt, "Return underneath a function should have return value");
        } else if (!proc.isFunction() && stmt.getExpression() != null) {
            report(stmt, "Return underneath a task shouldn't have return value");
        } else {
            if (proc.isFunction() && stmt.getExpression() != null) {
                Statement assign = new ExpressionStatement(
                        new AssignmentExpression(
                                new Identifier(proc.getReturnVariable()),
                                AssignmentOperator.NORMAL,
                                stmt.takeExpression()));
                assign.setLineNumber(stmt.where());
                getStatementList(stmt).addStatementBefore(stmt, assign);
            }
            JumpLabel label = labels.findAddLabel(proc, false);
            getStatementList(stmt).addStatementBefore(stmt, newJump(stmt, label));
            num_returns++;
        }
        stmt.detach();
    }

    private void visitBreak(BreakStatement stmt) {
        if (current_loop == null) {
            report(stmt, "break isn't underneath a loop");
        } else if (fork_in_loop) {
            // Jumps never leave a fork, even toward an enclosing loop.
            report(stmt, "break isn't legal under fork");
        } else {
            JumpLabel label = labels.findAddLabel(current_loop, false);
            getStatementList(stmt).addStatementAfter(stmt, newJump(stmt, label));
            num_breaks++;
        }
        stmt.detach();
    }

    private void visitContinue(ContinueStatement stmt) {
        if (current_loop == null) {
            report(stmt, "continue isn't underneath a loop");
        } else if (fork_in_loop) {
            // Same restriction as for break.
            report(stmt, "continue isn't legal under fork");
        } else {
            // The end of the iteration precedes the loop increment.
            JumpLabel label = labels.findAddLabel(current_loop, true);
            getStatementList(stmt).addStatementAfter(stmt, newJump(stmt, label));
            num_continues++;
        }
        stmt.detach();
    }

    private void visitDisable(DisableStatement stmt) {
        Block block = null;
        for (Block b : block_stack) {
            if (b.isNamed() && b.getName().equals(stmt.getTarget())) {
                block = b;
                break;
            }
        }
        if (block == null) {
            reportUnsupported(stmt, "disable isn't underneath a begin with name: '" +
                    stmt.getTarget() + "'");
        } else if (block.isParallel()) {
            reportUnsupported(stmt, "Unsupported: disabling fork by name");
        } else if (contains_fork.contains(block)) {
            reportUnsupported(stmt,
                    "Unsupported: disabling block that contains a fork");
        } else {
            JumpLabel label = labels.findAddLabel(block, false);
            getStatementList(stmt).addStatementAfter(stmt, newJump(stmt, label));
            num_disables++;
        }
        stmt.detach();
    }

    private void visitIdentifier(Identifier id) {
        if (in_increment) {
            id.getSymbol().setUsedLoopIndex(true);
        }
    }

    private void report(Statement stmt, String message) {
        diagnostics.error(stmt, message);
        num_dropped++;
    }

    private void reportUnsupported(Statement stmt, String message) {
        diagnostics.unsupported(stmt, message);
        num_dropped++;
    }

    private static JumpGo newJump(Statement replaced, JumpLabel label) {
        JumpGo go = new JumpGo(label);
        go.setLineNumber(replaced.where());
        return go;
    }

    private static CompoundStatement getStatementList(Statement stmt) {
        if (!(stmt.getParent() instanceof CompoundStatement)) {
            throw new InternalError("Control transfer outside of a statement list: " +
                    IRTools.getLocation(stmt));
        }
        return (CompoundStatement)stmt.getParent();
    }

    /**
    * Checks that no return, break, continue, disable, repeat loop or do loop
    * is left in the live modules under <var>t</var>, and that every jump
    * targets the label of an enclosing jump block without leaving a fork
    * block.
    *
    * @param t the root of the checked subtree.
    * @return true if the subtree is fully lowered.
    */
    public static boolean checkLowered(Traversable t) {
        if (t instanceof Program) {
            for (Module module : ((Program)t).getModules()) {
                if (!module.isDead() && !checkLowered(module)) {
                    return false;
                }
            }
            return true;
        }
        DFIterator<Traversable> iter = new DFIterator<Traversable>(t);
        while (iter.hasNext()) {
            Traversable tr = iter.next();
            if (tr instanceof ReturnStatement || tr instanceof BreakStatement ||
                tr instanceof ContinueStatement ||
                tr instanceof DisableStatement || tr instanceof RepeatLoop ||
                tr instanceof DoLoop) {
                PrintTools.printlnStatus(0, "Unlowered IR =", tr);
                return false;
            }
            if (tr instanceof JumpGo && !isValidJump((JumpGo)tr)) {
                PrintTools.printlnStatus(0, "Invalid jump =", tr,
                        IRTools.getLocation(tr));
                return false;
            }
        }
        return true;
    }

    private static boolean isValidJump(JumpGo go) {
        JumpLabel label = go.getTarget();
        JumpBlock block = label.getBlock();
        if (block == null || block.getLabel() != label) {
            return false;
        }
        Traversable p = go.getParent();
        while (p != null && p != block) {
            if (p instanceof ForkBlock) {
                return false;
            }
            p = p.getParent();
        }
        return p == block;
    }

}
