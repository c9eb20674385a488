package com.datapatch.diagnostics;

public enum DiagnosticKind {
    /** Malformed literal, priority or index found while transforming; scanning continues. */
    SYNTAX,
    /** Unknown ruleset, mixin, function, library or variable. */
    RESOLUTION,
    /** Operator or statement applied to values of the wrong kind. */
    TYPE,
    /** Call arguments do not fit the callee's parameters. */
    ARITY,
    /** The host refused an edit. */
    HOST_REJECTION,
    /** A loop or a chain of calls ran past its limit. */
    LIMIT
}
