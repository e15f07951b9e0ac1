package svlower.exec;

import svlower.hir.Traversable;

/**
* Receives the problems that passes find in the input design. Reporting a
* problem never stops the pass; the pass drops the offending construct and
* continues so later problems are reported too.
*/
public interface DiagnosticSink {

    /**
    * Reports a construct that is illegal in the language.
    *
    * @param where the offending IR node.
    * @param message the human-readable description.
    */
    void error(Traversable where, String message);

    /**
    * Reports a legal construct that is not supported.
    *
    * @param where the offending IR node.
    * @param message the human-readable description.
    */
    void unsupported(Traversable where, String message);

}
