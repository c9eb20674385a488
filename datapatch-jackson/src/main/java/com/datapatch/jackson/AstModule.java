package com.datapatch.jackson;

import com.datapatch.ast.Attribute;
import com.datapatch.ast.Expression;
import com.datapatch.ast.Indexer;
import com.datapatch.ast.Node;
import com.datapatch.ast.Selector;
import com.datapatch.ast.Statement;
import com.datapatch.value.DataValue;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Jackson module that configures serialization/deserialization for the patch AST.
 *
 * This module handles:
 * - Polymorphic node types, written with a "type" property holding the record's simple name
 * - Values (DataValue) written as plain JSON
 */
public class AstModule extends SimpleModule {

    // Interfaces whose declared fields hold nodes of several kinds
    private static final List<Class<?>> POLYMORPHIC_ROOTS = List.of(
        Node.class, Statement.class, Expression.class, Selector.class, Indexer.class, Attribute.class);

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.datapatch", "datapatch-jackson"));
        addSerializer(DataValue.class, new DataValueSerializer());
        addDeserializer(DataValue.class, new DataValueDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        for (Class<?> root : POLYMORPHIC_ROOTS) {
            context.setMixInAnnotations(root, NodeMixin.class);
        }

        Set<Class<?>> records = nodeRecords();
        NamedType[] types = new NamedType[records.size()];
        int i = 0;
        for (Class<?> record : records) {
            types[i++] = new NamedType(record, record.getSimpleName());
        }
        context.registerSubtypes(types);
    }

    /**
     * Walks the sealed hierarchy below {@link Node} and returns every concrete node record.
     */
    static Set<Class<?>> nodeRecords() {
        Set<Class<?>> records = new LinkedHashSet<>();
        Deque<Class<?>> pending = new ArrayDeque<>(List.of(Node.class));
        while (!pending.isEmpty()) {
            Class<?> type = pending.pop();
            if (type.isRecord()) {
                records.add(type);
            } else if (type.isSealed()) {
                for (Class<?> permitted : type.getPermittedSubclasses()) {
                    pending.push(permitted);
                }
            }
        }
        return records;
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    private abstract static class NodeMixin {
    }
}
