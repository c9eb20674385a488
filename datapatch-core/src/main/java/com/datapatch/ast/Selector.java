package com.datapatch.ast;

/**
 * Structural pattern tested against host elements.
 */
public sealed interface Selector extends Node permits
    ElementSelector,
    NameSelector,
    ClassSelector,
    RulesetSelector,
    WildcardSelector,
    WithoutClassSelector,
    WithoutNameSelector,
    ChildSelector,
    IntersectionSelector,
    CombinationSelector,
    ElementAdditionSelector,
    ErrorNode {
}
