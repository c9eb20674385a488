package com.datapatch.diagnostics;

import org.apache.log4j.Logger;

/**
 * Writes syntax problems as errors and runtime problems as warnings.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

    private static final Logger log = Logger.getLogger(LoggingDiagnosticSink.class);

    @Override
    public void report(Diagnostic diagnostic) {
        if (diagnostic.kind() == DiagnosticKind.SYNTAX) {
            log.error(diagnostic);
        } else {
            log.warn(diagnostic.kind() + " " + diagnostic);
        }
    }
}
