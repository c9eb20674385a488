package com.datapatch.diagnostics;

import com.datapatch.ast.Coordinate;

/**
 * Base class of errors raised while executing a patch. An error aborts the patch being executed
 * and nothing else.
 *
 * <p>Hosts may throw subclasses without a coordinate; the interpreter attaches the coordinate of
 * the innermost statement being executed.</p>
 */
public class PatchRuntimeException extends RuntimeException {

    private final DiagnosticKind kind;
    private Coordinate coordinate;

    public PatchRuntimeException(DiagnosticKind kind, Coordinate coordinate, String message) {
        super(message);
        this.kind = kind;
        this.coordinate = coordinate;
    }

    public PatchRuntimeException(DiagnosticKind kind, Coordinate coordinate, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.coordinate = coordinate;
    }

    public DiagnosticKind kind() {
        return kind;
    }

    /**
     * @return where the error happened, or null if it has not been located yet
     */
    public Coordinate coordinate() {
        return coordinate;
    }

    /**
     * Sets the coordinate unless one is already known.
     */
    public PatchRuntimeException locate(Coordinate where) {
        if (coordinate == null) {
            coordinate = where;
        }
        return this;
    }

    public Diagnostic toDiagnostic() {
        return new Diagnostic(kind, coordinate != null ? coordinate : Coordinate.UNKNOWN, getMessage());
    }

    @Override
    public String toString() {
        return (coordinate != null ? coordinate + ": " : "") + getMessage();
    }
}
