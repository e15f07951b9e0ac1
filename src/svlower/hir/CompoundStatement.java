package svlower.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.List;

/**
* <b>CompoundStatement</b> represents a sequence of statements that are
* treated as a single statement. The statement following a statement in
* execution order is its next sibling in the enclosing compound statement.
*/
public class CompoundStatement extends Statement {

    /** The default print method for CompoundStatement */
    private static Method class_print_method;

    static {
        Class<?>[] params = new Class<?>[2];
        try {
            params[0] = CompoundStatement.class;
            params[1] = PrintWriter.class;
            class_print_method = params[0].getMethod("defaultPrint", params);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

    /** Creates an empty compound statement. */
    public CompoundStatement() {
        object_print_method = class_print_method;
    }

    /**
    * Adds a statement to the end of this compound statement.
    *
    * @param stmt The statement to add.
    * @throws IllegalArgumentException If <b>stmt</b> is null.
    * @throws NotAnOrphanException if <b>stmt</b> has a parent.
    */
    public void addStatement(Statement stmt) {
        addChild(stmt);
    }

    /**
    * Add a new statement before the reference statement.
    *
    * @param ref_stmt the reference statement.
    * @param new_stmt the statement to be added.
    * @throws NotAChildException If <b>ref_stmt</b> is not found.
    * @throws NotAnOrphanException if <b>new_stmt</b> has a parent.
    */
    public void addStatementBefore(Statement ref_stmt, Statement new_stmt) {
        int index = Tools.identityIndexOf(children, ref_stmt);
        if (index == -1) {
            throw new NotAChildException();
        }
        addChild(index, new_stmt);
    }

    /**
    * Add a new statement after the reference statement.
    *
    * @param ref_stmt the reference statement.
    * @param new_stmt the statement to be added.
    * @throws NotAChildException If <b>ref_stmt</b> is not found.
    * @throws NotAnOrphanException if <b>new_stmt</b> has a parent.
    */
    public void addStatementAfter(Statement ref_stmt, Statement new_stmt) {
        int index = Tools.identityIndexOf(children, ref_stmt);
        if (index == -1) {
            throw new NotAChildException();
        }
        addChild(index + 1, new_stmt);
    }

    /**
    * Remove the given statement if it exists.
    *
    * @param stmt the statement to be removed.
    */
    public void removeStatement(Statement stmt) {
        removeChild(stmt);
    }

    /**
    * Returns the statements of this compound statement. The returned list
    * is the live child list; take a copy before modifying the tree while
    * iterating over it.
    */
    @SuppressWarnings("unchecked")
    public List<Statement> getStatements() {
        return (List)children;
    }

    /** Checks if this compound statement has no statement. */
    public boolean isEmpty() {
        return children.isEmpty();
    }

    /**
    * Returns a clone of this compound statement. Jumps and variable
    * references inside the copy that pointed into the original subtree
    * point into the copy.
    *
    * @return the cloned compound statement.
    */
    @Override
    public CompoundStatement clone() {
        CompoundStatement o = (CompoundStatement)super.clone();
        IRTools.relinkReferences(this, o);
        return o;
    }

    /**
    * Prints a statement to the given print writer.
    *
    * @param s The statement to print.
    * @param o The writer on which to print the statement.
    */
    public static void defaultPrint(CompoundStatement s, PrintWriter o) {
        o.println("begin");
        printBody(s, o);
        o.print("end");
    }

    /**
    * Prints the statements one per line; used by the print methods of the
    * derived block classes.
    */
    protected static void printBody(CompoundStatement s, PrintWriter o) {
        if (!s.children.isEmpty()) {
            PrintTools.printlnList(s.children, o);
        }
    }

    /**
    * Removes the specified child object if it exists.
    *
    * @param child the child object to be removed.
    * @throws NotAChildException if <b>child</b> is not found.
    */
    public void removeChild(Traversable child) {
        int index = Tools.identityIndexOf(children, child);
        if (index == -1) {
            throw new NotAChildException();
        }
        children.remove(index);
        child.setParent(null);
    }

    /**
    * Accepts only statements as children.
    *
    * @throws IllegalArgumentException if <b>t</b> is not a statement.
    */
    @Override
    public void setChild(int index, Traversable t) {
        if (!(t instanceof Statement)) {
            throw new IllegalArgumentException();
        }
        super.setChild(index, t);
    }

    @Override
    protected void addChild(int index, Traversable t) {
        if (!(t instanceof Statement)) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        super.addChild(index, t);
    }

    @Override
    protected void addChild(Traversable t) {
        if (t != null && !(t instanceof Statement)) {
            throw new IllegalArgumentException("invalid child inserted.");
        }
        super.addChild(t);
    }

}
