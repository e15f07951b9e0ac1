package svlower.transforms;

import svlower.hir.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
* Finds or creates the {@link JumpLabel} marking an exit point of a
* construct. A construct has up to two exit points: the end of the current
* iteration, reached by continue, and the end of the whole construct,
* reached by break, return and disable. Each exit point gets at most one
* label, remembered for the lifetime of the injector.
*/
public class LabelInjector {

    private static final String label_prefix = "__Vjumplabel";

    /** Labels reached by continue, keyed by loop */
    private final Map<Traversable, JumpLabel> end_of_iteration;

    /** Labels reached by break, return and disable, keyed by construct */
    private final Map<Traversable, JumpLabel> end_of_construct;

    private int num_labels;

    public LabelInjector() {
        end_of_iteration = new IdentityHashMap<Traversable, JumpLabel>();
        end_of_construct = new IdentityHashMap<Traversable, JumpLabel>();
        num_labels = 0;
    }

    /**
    * Returns the label for the requested exit point of <var>target</var>,
    * creating it on first use.
    *
    * <p>For a block or a procedure, and for the end of an iteration of a
    * loop, the statements of the block or loop body are moved into a new
    * {@link JumpBlock} ending with the label; leading variable declarations
    * stay where they are, and declarations found later in the moved run are
    * moved out to sit right before the jump block. For the end of a whole
    * loop, the loop alone is wrapped, so the label follows it.
    *
    * @param target the construct; a label is returned unchanged.
    * @param end_of_iteration true for the end of the current iteration of a
    *   loop, false for the end of the whole construct.
    * @return the label.
    * @throws InternalError if <var>target</var> cannot be left by a jump or
    *   has no statement to wrap.
    */
    public JumpLabel findAddLabel(Traversable target, boolean end_of_iteration) {
        if (target instanceof JumpLabel) {
            return (JumpLabel)target;
        }
        Map<Traversable, JumpLabel> labels =
                end_of_iteration ? this.end_of_iteration : end_of_construct;
        JumpLabel label = labels.get(target);
        if (label != null) {
            return label;
        }
        CompoundStatement stmts = null;
        Statement under = null;
        boolean relocate = true;
        if (target instanceof Block && !((Block)target).isParallel()) {
            stmts = (Block)target;
        } else if (target instanceof Procedure) {
            stmts = ((Procedure)target).getBody();
        } else if (target instanceof WhileLoop || target instanceof DoLoop ||
                   target instanceof ForeachLoop) {
            if (end_of_iteration) {
                stmts = ((Loop)target).getBody();
            } else {
                under = (Statement)target;
                relocate = false;
                if (!(under.getParent() instanceof CompoundStatement)) {
                    throw new InternalError(
                            "Break/disable/continue not under expected statement");
                }
                stmts = (CompoundStatement)under.getParent();
            }
        } else {
            throw new InternalError("Unknown jump point for break/disable/continue");
        }
        if (relocate) {
            under = firstNonDeclaration(stmts);
        }
        if (under == null) {
            throw new InternalError(
                    "Break/disable/continue not under expected statement");
        }
        if (under instanceof JumpLabel) {
            label = (JumpLabel)under;
        } else {
            label = new JumpLabel(label_prefix + num_labels++);
            wrap(stmts, under, relocate, label);
            PrintTools.printlnStatus(4, "[LabelInjector]", label.getName(),
                    end_of_iteration ? "ends an iteration of" : "ends",
                    IRTools.getLocation(target));
        }
        labels.put(target, label);
        return label;
    }

    /** Returns the number of labels created so far. */
    public int getNumLabels() {
        return num_labels;
    }

    private static Statement firstNonDeclaration(CompoundStatement stmts) {
        for (Statement stmt : stmts.getStatements()) {
            if (!(stmt instanceof VariableDeclaration)) {
                return stmt;
            }
        }
        return null;
    }

    // Replaces "under" (and everything after it if "relocate") with a jump
    // block ending with "label".
    private static void wrap(CompoundStatement stmts, Statement under,
                             boolean relocate, JumpLabel label) {
        List<Statement> run;
        if (relocate) {
            List<Statement> all = stmts.getStatements();
            int index = Tools.identityIndexOf(all, under);
            run = new ArrayList<Statement>(all.subList(index, all.size()));
        } else {
            run = Collections.singletonList(under);
        }
        JumpBlock block = new JumpBlock();
        block.setLineNumber(under.where());
        stmts.addStatementBefore(under, block);
        for (Statement stmt : run) {
            stmt.detach();
            if (stmt instanceof VariableDeclaration) {
                stmts.addStatementBefore(block, stmt);
            } else {
                block.addStatement(stmt);
            }
        }
        block.addStatement(label);
    }

}
