package com.datapatch.ast;

public sealed interface Attribute extends Node permits
    RequireModAttribute,
    RequireNotModAttribute,
    RunAtStageAttribute,
    NewAssetAttribute,
    ErrorNode {
}
