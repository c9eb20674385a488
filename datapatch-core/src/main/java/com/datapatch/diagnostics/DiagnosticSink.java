package com.datapatch.diagnostics;

/**
 * Receives diagnostics from transformation and execution. Implementations supplied by the host
 * decide whether to log, collect or abort.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void report(Diagnostic diagnostic);

    static DiagnosticSink ignoring() {
        return diagnostic -> { };
    }

    default DiagnosticSink andThen(DiagnosticSink next) {
        return diagnostic -> {
            report(diagnostic);
            next.report(diagnostic);
        };
    }
}
