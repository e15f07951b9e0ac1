package svlower.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a function or a task. A function stores its value in a return
* variable that is declared as the first statement of its body.
*/
public final class Procedure implements Traversable {

    /** Distinguishes functions from tasks. */
    public enum Kind {
        FUNCTION,
        TASK
    }

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = Procedure.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    private Method object_print_method;

    private Traversable parent;

    private List<Traversable> children;

    private String name;

    private Kind kind;

    private boolean constructor;

    private VariableDeclaration return_var;

    /**
    * Creates a procedure with an empty body.
    *
    * @param name the procedure name.
    * @param kind function or task.
    * @param return_type the type of the function value; null for tasks.
    * @throws IllegalArgumentException if a function has no return type or
    *   a task has one.
    */
    public Procedure(String name, Kind kind, DataType return_type) {
        if ((kind == Kind.FUNCTION) != (return_type != null)) {
            throw new IllegalArgumentException(
                    "only functions have a return type: " + name);
        }
        object_print_method = class_print_method;
        parent = null;
        children = new ArrayList<Traversable>(1);
        this.name = name;
        this.kind = kind;
        constructor = false;
        CompoundStatement body = new CompoundStatement();
        children.add(body);
        body.setParent(this);
        if (return_type != null) {
            return_var = new VariableDeclaration(return_type, name,
                    VariableDeclaration.Kind.FUNCTION_RETURN);
            body.addStatement(return_var);
        }
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFunction() {
        return kind == Kind.FUNCTION;
    }

    /** Checks if this function is a class constructor. */
    public boolean isConstructor() {
        return constructor;
    }

    public void setConstructor(boolean constructor) {
        this.constructor = constructor;
    }

    /** Returns the variable holding the function value; null for tasks. */
    public VariableDeclaration getReturnVariable() {
        return return_var;
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(0);
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    /**
    * The body cannot be removed.
    * @throws UnsupportedOperationException always
    */
    public void removeChild(Traversable child) {
        throw new UnsupportedOperationException(
                "Procedures do not support removal of their body.");
    }

    public void setChild(int index, Traversable t) {
        if (index != 0 || !(t instanceof CompoundStatement)) {
            throw new IllegalArgumentException();
        }
        if (t.getParent() != null) {
            throw new NotAnOrphanException();
        }
        children.get(0).setParent(null);
        children.set(0, t);
        t.setParent(this);
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    public void print(PrintWriter o) {
        if (object_print_method == null) {
            return;
        }
        try {
            object_print_method.invoke(null, new Object[] {this, o});
        } catch(IllegalAccessException e) {
            throw new InternalError(e.getMessage());
        } catch(InvocationTargetException e) {
            throw new InternalError(e.getMessage());
        }
    }

    public static void defaultPrint(Procedure p, PrintWriter o) {
        if (p.isFunction()) {
            o.print("function ");
            if (!p.constructor) {
                o.print(p.return_var.getType() + " ");
            }
        } else {
            o.print("task ");
        }
        o.print(p.name);
        o.print("; ");
        p.getBody().print(o);
        o.print(p.isFunction() ? " endfunction" : " endtask");
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

}
