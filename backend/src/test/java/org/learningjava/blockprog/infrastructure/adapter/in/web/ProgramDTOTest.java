package org.learningjava.blockprog.infrastructure.adapter.in.web;

import org.junit.jupiter.api.Test;
import org.learningjava.blockprog.domain.model.program.Block;
import org.learningjava.blockprog.domain.model.program.ExpressionField;
import org.learningjava.blockprog.domain.model.program.SimpleField;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProgramDTOTest {

    @Test
    void simple_field_maps_to_text() {
        ProgramDTO.FieldDTO dto = ProgramDTO.FieldDTO.from(new SimpleField("300"));

        assertEquals("simple", dto.kind());
        assertEquals("300", dto.text());
        assertNull(dto.block());
    }

    @Test
    void expression_field_maps_to_nested_block() {
        var number = new Block("math_number", "n1", Map.of("NUM", new SimpleField("7")), Map.of());

        ProgramDTO.FieldDTO dto = ProgramDTO.FieldDTO.from(new ExpressionField(number));

        assertEquals("expression", dto.kind());
        assertNull(dto.text());
        assertEquals("math_number", dto.block().type());
        assertEquals("n1", dto.block().id());
        assertEquals("7", dto.block().fields().get("NUM").text());
    }
}
