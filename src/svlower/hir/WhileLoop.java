package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents the canonical loop: the condition is tested before every
* iteration, and the increment statements run after the body of each
* iteration, including iterations left early by a continue.
*/
public class WhileLoop extends Statement implements Loop {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = WhileLoop.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    private UnrollDirective unroll;

    private boolean unused_warning_off;

    /**
    * Creates a while loop without increment statements.
    *
    * @param condition the loop condition.
    * @param body the loop body.
    * @throws NotAnOrphanException if <b>condition</b> or <b>body</b> has a
    *   parent.
    */
    public WhileLoop(Expression condition, Statement body) {
        this(condition, body, null);
    }

    /**
    * Creates a while loop with increment statements.
    *
    * @param condition the loop condition.
    * @param body the loop body.
    * @param increment the statements run after each iteration, may be null.
    * @throws NotAnOrphanException if any argument has a parent.
    */
    public WhileLoop(Expression condition, Statement body,
                     Statement increment) {
        super(3);
        object_print_method = class_print_method;
        addChild(condition);
        addChild(IRTools.toCompound(body));
        addChild(IRTools.toCompound(increment));
        unroll = UnrollDirective.DEFAULT;
        unused_warning_off = false;
    }

    @Override
    public WhileLoop clone() {
        return (WhileLoop)super.clone();
    }

    public Expression getCondition() {
        return (Expression)children.get(0);
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(1);
    }

    /** Returns the increment statements; empty if the loop has none. */
    public CompoundStatement getIncrement() {
        return (CompoundStatement)children.get(2);
    }

    public UnrollDirective getUnroll() {
        return unroll;
    }

    public void setUnroll(UnrollDirective unroll) {
        this.unroll = unroll;
    }

    /** Checks if later lint passes must not warn about this loop being unused. */
    public boolean isUnusedWarningOff() {
        return unused_warning_off;
    }

    public void setUnusedWarningOff(boolean off) {
        unused_warning_off = off;
    }

    public static void defaultPrint(WhileLoop l, PrintWriter o) {
        if (l.unroll != UnrollDirective.DEFAULT) {
            o.println("// unroll " + l.unroll.name().toLowerCase());
        }
        o.print("while (");
        l.getCondition().print(o);
        o.print(") ");
        l.getBody().print(o);
        if (!l.getIncrement().isEmpty()) {
            o.print(" increment ");
            l.getIncrement().print(o);
        }
    }

}
