package org.learningjava.blockprog.domain.model.program;

import java.util.Objects;

public record SimpleField(String text) implements FieldValue {

    public SimpleField {
        Objects.requireNonNull(text, "text");
    }
}
