package com.datapatch.ast;

public sealed interface Expression extends Node permits
    Literal,
    VariableReference,
    LocalVariableReference,
    UnaryExpression,
    BinaryExpression,
    ImplicitExpression,
    Subscript,
    SimpleCall,
    MemberCall,
    Ternary,
    ListExpression,
    ObjectExpression,
    Closure,
    ErrorNode {
}
