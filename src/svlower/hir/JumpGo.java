package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents an unconditional jump to a {@link JumpLabel}. The target label
* is referenced, not owned, by the jump.
*/
public class JumpGo extends Statement {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = JumpGo.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    private JumpLabel target;

    /**
    * Creates a jump to the specified label.
    *
    * @param target the target label.
    * @throws IllegalArgumentException if <b>target</b> is null.
    */
    public JumpGo(JumpLabel target) {
        super(-1);
        if (target == null) {
            throw new IllegalArgumentException("null jump target");
        }
        object_print_method = class_print_method;
        this.target = target;
    }

    /** The copy jumps to the same label. */
    @Override
    public JumpGo clone() {
        return (JumpGo)super.clone();
    }

    public JumpLabel getTarget() {
        return target;
    }

    public void setTarget(JumpLabel target) {
        if (target == null) {
            throw new IllegalArgumentException("null jump target");
        }
        this.target = target;
    }

    public static void defaultPrint(JumpGo s, PrintWriter o) {
        o.print("goto ");
        o.print(s.target.getName());
        o.print(";");
    }

}
