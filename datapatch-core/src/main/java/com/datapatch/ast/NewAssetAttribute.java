package com.datapatch.ast;

import java.util.List;

public record NewAssetAttribute(
    Coordinate coordinate,
    List<Expression> arguments
) implements Attribute {

    public NewAssetAttribute {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "NewAssetAttribute";
    }
}
