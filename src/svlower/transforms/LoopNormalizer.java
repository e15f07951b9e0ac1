package svlower.transforms;

import svlower.hir.*;

/**
* Rewrites repeat loops and do loops into {@link WhileLoop}s in place.
*/
public class LoopNormalizer {

    /** Prefix of the block names in the copy of a do loop body */
    public static final String first_copy_prefix = "__Vdo_while1_";

    /** Prefix of the block names in the body of a converted do loop */
    public static final String loop_copy_prefix = "__Vdo_while2_";

    private int num_repeats;

    private int num_do_loops;

    public LoopNormalizer() {
        num_repeats = 0;
        num_do_loops = 0;
    }

    /**
    * Replaces <b>repeat (count) body</b> with
    * <pre>
    * begin
    *   automatic int name;
    *   name = count;
    *   while (name &gt; 0) body increment name = name - 1;
    * end
    * </pre>
    * The count is evaluated once; a count that is not positive runs the
    * body zero times.
    *
    * @param loop the repeat loop, which must be attached to the tree.
    * @param name the name of the counter variable.
    * @param unroll the unroll directive for the new loop.
    * @return the block that replaced the loop.
    */
    public Block convertRepeat(RepeatLoop loop, String name,
                               UnrollDirective unroll) {
        int line = loop.where();
        Expression count = loop.getCount();
        count.swapWith(new IntegerLiteral(0));
        CompoundStatement body = loop.getBody();
        body.swapWith(new CompoundStatement());

        VariableDeclaration counter = new VariableDeclaration(
                DataType.INT, name, VariableDeclaration.Kind.BLOCK_TEMP);
        counter.setLifetime(VariableDeclaration.Lifetime.AUTOMATIC);
        counter.setUsedLoopIndex(true);
        counter.setLineNumber(line);

        Statement init = new ExpressionStatement(new AssignmentExpression(
                new Identifier(counter), AssignmentOperator.NORMAL, count));
        init.setLineNumber(line);
        Statement decrement = new ExpressionStatement(new AssignmentExpression(
                new Identifier(counter), AssignmentOperator.NORMAL,
                new BinaryExpression(new Identifier(counter),
                        BinaryOperator.SUBTRACT, new IntegerLiteral(1))));
        decrement.setLineNumber(line);
        WhileLoop w = new WhileLoop(
                new BinaryExpression(new Identifier(counter),
                        BinaryOperator.COMPARE_GT, new IntegerLiteral(0)),
                body, decrement);
        w.setUnroll(unroll);
        w.setLineNumber(line);

        Block block = new Block();
        block.setLineNumber(line);
        block.addStatement(counter);
        block.addStatement(init);
        block.addStatement(w);
        loop.swapWith(block);
        num_repeats++;
        return block;
    }

    /**
    * Replaces <b>do body while (cond)</b> with <b>body' while (cond)
    * body</b>, where body' is a copy of the body that runs once before the
    * condition is first tested. Named blocks and labels in the copy and in
    * the loop body get distinct prefixes so that block names stay unique.
    *
    * @param loop the do loop, which must be attached to a compound
    *   statement.
    * @param unroll the unroll directive for the new loop.
    * @return the while loop that replaced the do loop.
    * @throws InternalError if the loop is not in a compound statement.
    */
    public WhileLoop convertDo(DoLoop loop, UnrollDirective unroll) {
        if (!(loop.getParent() instanceof CompoundStatement)) {
            throw new InternalError("do loop outside of a statement list");
        }
        CompoundStatement parent = (CompoundStatement)loop.getParent();
        Expression condition = loop.getCondition();
        condition.swapWith(new IntegerLiteral(0));
        CompoundStatement body = loop.getBody();
        body.swapWith(new CompoundStatement());

        WhileLoop w = new WhileLoop(condition, body);
        w.setUnroll(unroll);
        // The body always runs once, so the loop is never unused.
        w.setUnusedWarningOff(true);
        w.setLineNumber(loop.where());
        loop.swapWith(w);

        if (!body.isEmpty()) {
            CompoundStatement copy = body.clone();
            addPrefixToBlocks(first_copy_prefix, copy);
            addPrefixToBlocks(loop_copy_prefix, body);
            parent.addStatementBefore(w, copy);
        }
        num_do_loops++;
        return w;
    }

    /**
    * Prepends <var>prefix</var> to the names of the named blocks and jump
    * labels inside <var>t</var>.
    */
    public static void addPrefixToBlocks(String prefix, Traversable t) {
        for (Block b : IRTools.getDescendentsOfType(t, Block.class)) {
            if (b.isNamed()) {
                b.setName(prefix + b.getName());
            }
        }
        for (JumpLabel l : IRTools.getDescendentsOfType(t, JumpLabel.class)) {
            l.setName(prefix + l.getName());
        }
    }

    public int getNumRepeats() {
        return num_repeats;
    }

    public int getNumDoLoops() {
        return num_do_loops;
    }

}
