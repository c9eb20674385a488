package com.datapatch.diagnostics;

import com.datapatch.ast.Coordinate;

public class HostRejectionException extends PatchRuntimeException {

    public HostRejectionException(Coordinate coordinate, String message) {
        super(DiagnosticKind.HOST_REJECTION, coordinate, message);
    }

    /**
     * For hosts, which do not know the coordinate of the statement issuing the edit.
     */
    public HostRejectionException(String message) {
        super(DiagnosticKind.HOST_REJECTION, null, message);
    }
}
