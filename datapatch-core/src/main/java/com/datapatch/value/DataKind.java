package com.datapatch.value;

public enum DataKind {
    NONE("none"),
    DELETION("deletion"),
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    LIST("list"),
    OBJECT("object");

    private final String displayName;

    DataKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}
