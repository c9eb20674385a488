package com.datapatch.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every reported diagnostic in order. Not thread-safe; use one per document.
 */
public class CollectingDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<String> messages() {
        return diagnostics.stream().map(Diagnostic::message).toList();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}
