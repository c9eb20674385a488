package com.datapatch.diagnostics;

import com.datapatch.ast.Coordinate;

public record Diagnostic(
    DiagnosticKind kind,
    Coordinate coordinate,
    String message
) {

    @Override
    public String toString() {
        return coordinate + ": " + message;
    }
}
