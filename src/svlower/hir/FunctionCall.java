package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.List;

/**
* Represents a function or task call. The first child is the callee name
* and the remaining children are the arguments.
*/
public class FunctionCall extends Expression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = FunctionCall.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /**
    * Creates a call with no arguments.
    *
    * @param function the name of the callee.
    */
    public FunctionCall(NameID function) {
        super(1);
        object_print_method = class_print_method;
        addChild(function);
    }

    /**
    * Creates a call with the specified arguments.
    *
    * @param function the name of the callee.
    * @param args the list of arguments.
    * @throws NotAnOrphanException if an argument has a parent.
    */
    public FunctionCall(NameID function, List<Expression> args) {
        super(args.size() + 1);
        object_print_method = class_print_method;
        addChild(function);
        for (Expression arg : args) {
            addChild(arg);
        }
    }

    @Override
    public FunctionCall clone() {
        return (FunctionCall)super.clone();
    }

    public static void defaultPrint(FunctionCall c, PrintWriter o) {
        c.getName().print(o);
        o.print("(");
        PrintTools.printListWithComma(c.getArguments(), o);
        o.print(")");
    }

    /** Returns the callee name. */
    public NameID getName() {
        return (NameID)children.get(0);
    }

    /** Returns the number of arguments. */
    public int getNumArguments() {
        return children.size() - 1;
    }

    /** Returns the <var>n</var><i>th</i> argument. */
    public Expression getArgument(int n) {
        return (Expression)children.get(n + 1);
    }

    /** Returns the arguments as a view of the child list. */
    public List<Traversable> getArguments() {
        return children.subList(1, children.size());
    }

}
