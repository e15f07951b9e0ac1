package svlower.hir;

import java.io.PrintWriter;
import java.util.HashMap;

/**
* Operators for blocking and non-blocking assignments.
*/
public class AssignmentOperator extends BinaryOperator {

    private static HashMap<String, AssignmentOperator> op_map =
            new HashMap<String, AssignmentOperator>(4);

    private static String[] names = {"=", "<="};

    /**
    * = (blocking)
    */
    public static final AssignmentOperator NORMAL = new AssignmentOperator(0);

    /**
    * &lt;= (non-blocking)
    */
    public static final AssignmentOperator NONBLOCKING =
            new AssignmentOperator(1);

    /**
    * Used internally -- you may not create arbitrary assignment operators
    * and may only use the ones provided as static members.
    *
    * @param value The numeric code of the operator.
    */
    private AssignmentOperator(int value) {
        this.value = value;
        op_map.put(names[value], this);
    }

    /**
    * Returns an assignment operator that matches the specified string.
    * @param s the string to be matched.
    * @return the matching assignment operator.
    */
    public static AssignmentOperator fromString(String s) {
        return op_map.get(s);
    }

    @Override
    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    @Override
    public String toString() {
        return names[value];
    }

    @Override
    public boolean isCompare() {
        return false;
    }

    @Override
    public boolean isLogical() {
        return false;
    }

}
