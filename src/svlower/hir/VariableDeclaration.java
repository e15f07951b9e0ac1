package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Declares a variable in the enclosing scope. The declaration is also the
* symbol that {@link Identifier}s refer to.
*/
public class VariableDeclaration extends Statement {

    /** The role of the variable. */
    public enum Kind {
        /** A variable declared in the source. */
        VARIABLE,
        /** A temporary created by a compiler pass for its block. */
        BLOCK_TEMP,
        /** The variable holding the value of a function. */
        FUNCTION_RETURN
    }

    /** The storage lifetime of the variable. */
    public enum Lifetime {
        STATIC,
        AUTOMATIC
    }

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = VariableDeclaration.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    private String name;

    private DataType type;

    private Kind kind;

    private Lifetime lifetime;

    private boolean used_loop_index;

    /**
    * Declares a static source variable.
    *
    * @param type the data type.
    * @param name the variable name.
    */
    public VariableDeclaration(DataType type, String name) {
        this(type, name, Kind.VARIABLE);
    }

    /**
    * Declares a static variable with the specified role.
    *
    * @param type the data type.
    * @param name the variable name.
    * @param kind the role of the variable.
    */
    public VariableDeclaration(DataType type, String name, Kind kind) {
        super(-1);
        object_print_method = class_print_method;
        this.type = type;
        this.name = name;
        this.kind = kind;
        lifetime = Lifetime.STATIC;
        used_loop_index = false;
    }

    @Override
    public VariableDeclaration clone() {
        return (VariableDeclaration)super.clone();
    }

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    public Kind getKind() {
        return kind;
    }

    public Lifetime getLifetime() {
        return lifetime;
    }

    public void setLifetime(Lifetime lifetime) {
        this.lifetime = lifetime;
    }

    /** Checks if the variable is updated by the increment of a loop. */
    public boolean isUsedLoopIndex() {
        return used_loop_index;
    }

    public void setUsedLoopIndex(boolean used) {
        used_loop_index = used;
    }

    public static void defaultPrint(VariableDeclaration d, PrintWriter o) {
        if (d.lifetime == Lifetime.AUTOMATIC) {
            o.print("automatic ");
        }
        o.print(d.type);
        o.print(" ");
        o.print(d.name);
        o.print(";");
    }

}
