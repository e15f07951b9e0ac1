package svlower.transforms;

import svlower.hir.*;
import svlower.hir.Module;
import svlower.hir.Process;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
* Runs lowered designs sequentially. Calls to functions and tasks of the
* module are executed; calls to anything else are appended to the trace
* together with their argument values. Fork blocks run their statements one
* after another.
*/
final class Interpreter {

    private static final int max_steps = 100000;

    /** Unwinds execution up to the jump block owning the label. */
    private static final class Jump extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private final JumpLabel label;

        Jump(JumpLabel label) {
            super(null, null, false, false);
            this.label = label;
        }
    }

    private final Module module;

    private final Map<VariableDeclaration, Long> values;

    private final List<String> trace;

    private int steps;

    Interpreter(Module module) {
        this.module = module;
        values = new IdentityHashMap<VariableDeclaration, Long>();
        trace = new ArrayList<String>();
        steps = 0;
    }

    /** Runs the initial processes of the module and returns the trace. */
    List<String> runInitial() {
        for (Traversable item : module.getChildren()) {
            if (item instanceof Process &&
                ((Process)item).getKind() == Process.Kind.INITIAL) {
                exec(((Process)item).getBody());
            }
        }
        return trace;
    }

    /** Calls the named function or task and returns its value. */
    long call(String name) {
        Procedure proc = findProcedure(name);
        if (proc == null) {
            throw new IllegalArgumentException("no procedure " + name);
        }
        exec(proc.getBody());
        if (proc.getReturnVariable() == null) {
            return 0;
        }
        return value(proc.getReturnVariable());
    }

    List<String> getTrace() {
        return trace;
    }

    void set(VariableDeclaration var, long value) {
        values.put(var, value);
    }

    long value(VariableDeclaration var) {
        Long v = values.get(var);
        return (v == null) ? 0 : v;
    }

    private Procedure findProcedure(String name) {
        for (Traversable item : module.getChildren()) {
            if (item instanceof Procedure &&
                ((Procedure)item).getName().equals(name)) {
                return (Procedure)item;
            }
        }
        return null;
    }

    private void exec(Statement stmt) {
        if (++steps > max_steps) {
            throw new IllegalStateException("step limit exceeded");
        }
        if (stmt instanceof JumpBlock) {
            JumpBlock block = (JumpBlock)stmt;
            try {
                execList(block);
            } catch (Jump j) {
                if (j.label != block.getLabel()) {
                    throw j;
                }
            }
        } else if (stmt instanceof CompoundStatement) {
            execList((CompoundStatement)stmt);
        } else if (stmt instanceof VariableDeclaration) {
            values.put((VariableDeclaration)stmt, 0L);
        } else if (stmt instanceof ExpressionStatement) {
            eval(((ExpressionStatement)stmt).getExpression());
        } else if (stmt instanceof IfStatement) {
            IfStatement s = (IfStatement)stmt;
            if (eval(s.getCondition()) != 0) {
                exec(s.getThenStatement());
            } else if (s.getElseStatement() != null) {
                exec(s.getElseStatement());
            }
        } else if (stmt instanceof WhileLoop) {
            WhileLoop loop = (WhileLoop)stmt;
            while (eval(loop.getCondition()) != 0) {
                exec(loop.getBody());
                exec(loop.getIncrement());
            }
        } else if (stmt instanceof JumpGo) {
            throw new Jump(((JumpGo)stmt).getTarget());
        } else if (stmt instanceof JumpLabel) {
            // falls through to the end of its block
        } else {
            throw new IllegalStateException(
                    "not a lowered statement: " + stmt.getClass().getSimpleName());
        }
    }

    private void execList(CompoundStatement stmts) {
        for (Statement stmt : new ArrayList<Statement>(stmts.getStatements())) {
            exec(stmt);
        }
    }

    private long eval(Expression expr) {
        if (expr instanceof IntegerLiteral) {
            return ((IntegerLiteral)expr).getValue();
        } else if (expr instanceof Identifier) {
            return value(((Identifier)expr).getSymbol());
        } else if (expr instanceof AssignmentExpression) {
            AssignmentExpression a = (AssignmentExpression)expr;
            long v = eval(a.getRHS());
            values.put(((Identifier)a.getLHS()).getSymbol(), v);
            return v;
        } else if (expr instanceof BinaryExpression) {
            BinaryExpression b = (BinaryExpression)expr;
            return apply(b.getOperator(), eval(b.getLHS()), eval(b.getRHS()));
        } else if (expr instanceof FunctionCall) {
            FunctionCall c = (FunctionCall)expr;
            String name = c.getName().getName();
            if (findProcedure(name) != null) {
                return call(name);
            }
            StringBuilder sb = new StringBuilder(name);
            for (int i = 0; i < c.getNumArguments(); i++) {
                sb.append(i == 0 ? "(" : ",").append(eval(c.getArgument(i)));
            }
            if (c.getNumArguments() > 0) {
                sb.append(")");
            }
            trace.add(sb.toString());
            return 0;
        }
        throw new IllegalStateException("cannot evaluate " + expr);
    }

    private static long apply(BinaryOperator op, long l, long r) {
        if (op == BinaryOperator.ADD) {
            return l + r;
        } else if (op == BinaryOperator.SUBTRACT) {
            return l - r;
        } else if (op == BinaryOperator.MULTIPLY) {
            return l * r;
        } else if (op == BinaryOperator.COMPARE_EQ) {
            return (l == r) ? 1 : 0;
        } else if (op == BinaryOperator.COMPARE_NE) {
            return (l != r) ? 1 : 0;
        } else if (op == BinaryOperator.COMPARE_GT) {
            return (l > r) ? 1 : 0;
        } else if (op == BinaryOperator.COMPARE_GE) {
            return (l >= r) ? 1 : 0;
        } else if (op == BinaryOperator.COMPARE_LT) {
            return (l < r) ? 1 : 0;
        } else if (op == BinaryOperator.COMPARE_LE) {
            return (l <= r) ? 1 : 0;
        } else if (op == BinaryOperator.LOGICAL_AND) {
            return (l != 0 && r != 0) ? 1 : 0;
        } else if (op == BinaryOperator.LOGICAL_OR) {
            return (l != 0 || r != 0) ? 1 : 0;
        }
        throw new IllegalStateException("unknown operator " + op);
    }

}
