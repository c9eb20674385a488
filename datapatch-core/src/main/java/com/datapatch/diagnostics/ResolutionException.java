package com.datapatch.diagnostics;

import com.datapatch.ast.Coordinate;

public class ResolutionException extends PatchRuntimeException {

    public ResolutionException(Coordinate coordinate, String message) {
        super(DiagnosticKind.RESOLUTION, coordinate, message);
    }

    public ResolutionException(String message) {
        super(DiagnosticKind.RESOLUTION, null, message);
    }
}
