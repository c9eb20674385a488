package com.datapatch.diagnostics;

import com.datapatch.ast.Coordinate;

public class ArityException extends PatchRuntimeException {

    public ArityException(Coordinate coordinate, String message) {
        super(DiagnosticKind.ARITY, coordinate, message);
    }
}
