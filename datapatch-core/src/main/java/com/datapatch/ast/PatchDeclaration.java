package com.datapatch.ast;

import java.util.List;

/**
 * Declares the asset labels a patch applies to.
 */
public record PatchDeclaration(
    Coordinate coordinate,
    List<String> labels
) implements Statement {

    public PatchDeclaration {
        labels = List.copyOf(labels);
    }

    @Override
    public String type() {
        return "PatchDeclaration";
    }
}
