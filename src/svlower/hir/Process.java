package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a module-level process: an <b>initial</b>, <b>always</b> or
* <b>final</b> construct owning a body. Statements in a process are not
* inside any function or task.
*/
public class Process extends Statement {

    /** The process kinds. */
    public enum Kind {
        INITIAL,
        ALWAYS,
        FINAL
    }

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = Process.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    private Kind kind;

    /**
    * Creates a process with the specified body.
    *
    * @param kind the process kind.
    * @param body the body of the process.
    * @throws NotAnOrphanException if <b>body</b> has a parent.
    */
    public Process(Kind kind, Statement body) {
        super(1);
        object_print_method = class_print_method;
        this.kind = kind;
        addChild(IRTools.toCompound(body));
    }

    @Override
    public Process clone() {
        return (Process)super.clone();
    }

    public Kind getKind() {
        return kind;
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(0);
    }

    public static void defaultPrint(Process p, PrintWriter o) {
        o.print(p.kind.name().toLowerCase());
        o.print(" ");
        p.getBody().print(o);
    }

}
