package svlower.hir;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
* <b>IRTools</b> provides tools that perform search/replace in the IR tree.
*/
public final class IRTools {

    private IRTools() {
    }

    /**
    * Checks the consistency of the IR subtree rooted at <var>t</var>. The
    * parent of every node must list the node as its child.
    *
    * @param t the root of the subtree to check.
    * @return true if the subtree is consistent.
    */
    public static boolean checkConsistency(Traversable t) {
        DFIterator<Traversable> iter = new DFIterator<Traversable>(t);
        iter.next();
        while (iter.hasNext()) {
            Traversable tr = iter.next();
            Traversable p = tr.getParent();
            if (p == null ||
                Tools.identityIndexOf(p.getChildren(), tr) < 0) {
                PrintTools.printlnStatus(0, "Affected IR =", tr);
                PrintTools.printlnStatus(0, "Affected parent =", p);
                return false;
            }
        }
        return true;
    }

    /**
    * Returns the closest ancestor of <var>t</var> with the specified type,
    * excluding <var>t</var> itself.
    *
    * @param t the node to start from.
    * @param type the type of the ancestor.
    * @return the ancestor, or null if there is none.
    */
    @SuppressWarnings("unchecked")
    public static <T extends Traversable> T
            getAncestorOfType(Traversable t, Class<T> type) {
        Traversable p = (t == null) ? null : t.getParent();
        while (p != null && !type.isInstance(p)) {
            p = p.getParent();
        }
        return (T)p;
    }

    /**
    * Returns all nodes of the specified type in the subtree rooted at
    * <var>t</var>, in depth-first order, including <var>t</var> itself.
    *
    * @param t the root of the subtree.
    * @param type the type of the nodes to collect.
    * @return the list of matching nodes.
    */
    public static <T extends Traversable> List<T>
            getDescendentsOfType(Traversable t, Class<T> type) {
        return new DFIterator<T>(t, type).getList();
    }

    /**
    * Normalizes a statement used as the body of a compound construct. A
    * plain compound statement is used as it is, null becomes an empty
    * compound statement and any other statement, including a block, is
    * wrapped in a new compound statement.
    *
    * @param stmt the statement to normalize.
    * @return a compound statement containing <var>stmt</var>.
    */
    public static CompoundStatement toCompound(Statement stmt) {
        if (stmt != null && stmt.getClass() == CompoundStatement.class) {
            return (CompoundStatement)stmt;
        }
        CompoundStatement ret = new CompoundStatement();
        if (stmt != null) {
            ret.addStatement(stmt);
        }
        return ret;
    }

    /**
    * Fixes the references of a deep copy. Jumps to labels and identifiers of
    * variables that are declared inside <var>original</var> are redirected
    * to the corresponding labels and variables inside <var>copy</var>;
    * references to nodes outside the original are left unchanged.
    *
    * @param original the copied subtree.
    * @param copy the result of copying <var>original</var>.
    * @throws InternalError if the two subtrees differ in shape.
    */
    public static void relinkReferences(Traversable original, Traversable copy) {
        List<Traversable> from = new DFIterator<Traversable>(original).getList();
        List<Traversable> to = new DFIterator<Traversable>(copy).getList();
        if (from.size() != to.size()) {
            throw new InternalError("copy differs in shape from its original");
        }
        Map<Traversable, Traversable> copies =
                new IdentityHashMap<Traversable, Traversable>();
        for (int i = 0; i < from.size(); i++) {
            Traversable t = from.get(i);
            if (t instanceof JumpLabel || t instanceof VariableDeclaration) {
                copies.put(t, to.get(i));
            }
        }
        if (copies.isEmpty()) {
            return;
        }
        for (Traversable t : to) {
            if (t instanceof JumpGo) {
                JumpGo go = (JumpGo)t;
                JumpLabel label = (JumpLabel)copies.get(go.getTarget());
                if (label != null) {
                    go.setTarget(label);
                }
            } else if (t instanceof Identifier) {
                Identifier id = (Identifier)t;
                VariableDeclaration var =
                        (VariableDeclaration)copies.get(id.getSymbol());
                if (var != null) {
                    id.setSymbol(var);
                }
            }
        }
    }

    /**
    * Returns the source location of the specified IR node as
    * <b>file:line</b>. The line is taken from the closest enclosing
    * statement that has one; the file is the one of the enclosing module.
    *
    * @param t the IR node.
    * @return the location string.
    */
    public static String getLocation(Traversable t) {
        int line = -1;
        Traversable p = t;
        while (p != null && line < 0) {
            if (p instanceof Statement) {
                line = ((Statement)p).where();
            }
            p = p.getParent();
        }
        Module module = (t instanceof Module) ?
                (Module)t : getAncestorOfType(t, Module.class);
        String file = (module == null) ? "<unknown>" : module.getFileName();
        return (line < 0) ? file : file + ":" + line;
    }

}
