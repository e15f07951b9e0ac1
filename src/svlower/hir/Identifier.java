package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;

/**
* Represents a reference to a declared variable. The referenced
* {@link VariableDeclaration} is not a child of the identifier.
*/
public class Identifier extends Expression {

    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = Identifier.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /** The referenced variable */
    private VariableDeclaration symbol;

    /**
    * Constructs an identifier referring to the specified variable.
    *
    * @param symbol the referenced variable.
    * @throws IllegalArgumentException if <b>symbol</b> is null.
    */
    public Identifier(VariableDeclaration symbol) {
        super(-1);
        if (symbol == null) {
            throw new IllegalArgumentException("null symbol");
        }
        object_print_method = class_print_method;
        this.symbol = symbol;
    }

    /** The copy keeps referring to the same variable. */
    @Override
    public Identifier clone() {
        return (Identifier)super.clone();
    }

    public static void defaultPrint(Identifier i, PrintWriter o) {
        o.print(i.symbol.getName());
    }

    /** Returns the name of the referenced variable. */
    public String getName() {
        return symbol.getName();
    }

    /** Returns the referenced variable. */
    public VariableDeclaration getSymbol() {
        return symbol;
    }

    /**
    * Rebinds the identifier to the specified variable.
    *
    * @param symbol the new referenced variable.
    */
    public void setSymbol(VariableDeclaration symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("null symbol");
        }
        this.symbol = symbol;
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && symbol == ((Identifier)o).symbol);
    }

    @Override
    public String toString() {
        return symbol.getName();
    }

}
