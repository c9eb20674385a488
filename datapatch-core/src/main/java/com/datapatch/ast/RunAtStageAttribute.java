package com.datapatch.ast;

public record RunAtStageAttribute(
    Coordinate coordinate,
    String stage
) implements Attribute {

    @Override
    public String type() {
        return "RunAtStageAttribute";
    }
}
