package svlower.transforms;

import svlower.exec.Driver;
import svlower.hir.*;

import java.io.PrintWriter;

/**
* Base class of all transformation passes. For consistent compilation, there
* are a series of checking processes at the end of every transformation pass.
*/
public abstract class TransformPass {

    /** The associated program */
    protected Program program;

    /** Constructs a transform pass with the given program */
    protected TransformPass(Program program) {
        this.program = program;
    }

    /** Returns the name of the transform pass */
    public abstract String getPassName();

    /**
    * Invokes the specified transform pass.
    * @param pass the transform pass that is to be run.
    */
    public static void run(TransformPass pass) {
        double timer = Tools.getTime();
        PrintTools.printlnStatus(0, pass.getPassName(), "begin");
        pass.start();
        PrintTools.printlnStatus(0, pass.getPassName(), "end in",
                String.format("%.2f seconds", Tools.getTime(timer)));
        if (!IRTools.checkConsistency(pass.program)) {
            throw new InternalError("Inconsistent IR after " +
                                    pass.getPassName());
        }
        if (!pass.checkResult()) {
            throw new InternalError("Invalid IR after " + pass.getPassName());
        }
        if (PrintTools.getVerbosity() >= 3 ||
            Driver.getOptionValue("dump-tree") != null) {
            PrintWriter w = new PrintWriter(System.err);
            w.println("// tree after " + pass.getPassName());
            pass.program.print(w);
            w.flush();
        }
    }

    /**
    * Checks the properties the pass guarantees on its output. Called after
    * the generic consistency check.
    *
    * @return true if the output is valid.
    */
    protected boolean checkResult() {
        return true;
    }

    /** Starts a transform pass */
    public abstract void start();

}
