package com.datapatch.diagnostics;

import com.datapatch.ast.Coordinate;

public class PatchTypeException extends PatchRuntimeException {

    public PatchTypeException(Coordinate coordinate, String message) {
        super(DiagnosticKind.TYPE, coordinate, message);
    }

    public PatchTypeException(Coordinate coordinate, String message, Throwable cause) {
        super(DiagnosticKind.TYPE, coordinate, message, cause);
    }
}
