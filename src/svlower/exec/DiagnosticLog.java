package svlower.exec;

import svlower.hir.IRTools;
import svlower.hir.PrintTools;
import svlower.hir.Traversable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Collects the diagnostics of a compilation and prints each one to
* {@link System#err} as it arrives.
*/
public class DiagnosticLog implements DiagnosticSink {

    private final List<Diagnostic> diagnostics;

    private int num_errors;

    private int num_unsupported;

    public DiagnosticLog() {
        diagnostics = new ArrayList<Diagnostic>();
        num_errors = 0;
        num_unsupported = 0;
    }

    public void error(Traversable where, String message) {
        num_errors++;
        report(new Diagnostic(Diagnostic.Severity.ERROR,
                IRTools.getLocation(where), message));
    }

    public void unsupported(Traversable where, String message) {
        num_unsupported++;
        report(new Diagnostic(Diagnostic.Severity.UNSUPPORTED,
                IRTools.getLocation(where), message));
    }

    private void report(Diagnostic d) {
        diagnostics.add(d);
        PrintTools.printlnStatus(0, d);
    }

    /** Returns the diagnostics in the order they were reported. */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public int getErrorCount() {
        return num_errors;
    }

    public int getUnsupportedCount() {
        return num_unsupported;
    }

    /** Checks if nothing has been reported. */
    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

}
