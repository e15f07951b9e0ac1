package svlower.exec;

/**
* One reported problem: its severity, its source location and its message.
*/
public final class Diagnostic {

    /** The severity of a diagnostic. */
    public enum Severity {
        /** The construct is illegal. */
        ERROR("%Error"),
        /** The construct is legal but not supported. */
        UNSUPPORTED("%Warning-UNSUPPORTED");

        private final String prefix;

        Severity(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    private final Severity severity;

    private final String location;

    private final String message;

    public Diagnostic(Severity severity, String location, String message) {
        this.severity = severity;
        this.location = location;
        this.message = message;
    }

    public Severity getSeverity() {
        return severity;
    }

    /** Returns the location as <b>file:line</b>. */
    public String getLocation() {
        return location;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return severity.getPrefix() + ": " + location + ": " + message;
    }

}
