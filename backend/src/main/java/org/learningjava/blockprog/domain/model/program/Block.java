package org.learningjava.blockprog.domain.model.program;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One statement unit of a block program.
 *
 * @param blockType  value of the {@code type} attribute, empty when absent
 * @param id         value of the {@code id} attribute, empty when absent
 * @param fields     field values keyed by field name
 * @param statements statement slot bodies keyed by slot name
 */
public record Block(
        String blockType,
        String id,
        Map<String, FieldValue> fields,
        Map<String, StatementBody> statements
) {

    public Block {
        // keeps document order for stable iteration
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        statements = Collections.unmodifiableMap(new LinkedHashMap<>(statements));
    }

    public FieldValue field(String name) {
        return fields.get(name);
    }

    public StatementBody statement(String name) {
        return statements.get(name);
    }
}
