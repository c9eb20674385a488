package com.datapatch.ast;

/**
 * Statements of every block level. Which kinds are legal at the top level, inside a
 * selection block or inside a function body is enforced by the interpreter.
 */
public sealed interface Statement extends Node permits
    PatchDeclaration,
    Import,
    VariableDeclaration,
    StageDefinition,
    FunctionDefinition,
    MixinDefinition,
    Conditional,
    Block,
    SelectionBlock,
    SetValue,
    DeleteValue,
    MergeValue,
    Field,
    MixinInclude,
    Return,
    For,
    Each,
    While,
    ErrorNode {
}
