package org.learningjava.blockprog.domain.service.assembly;

import org.junit.jupiter.api.Test;
import org.learningjava.blockprog.domain.model.program.Program;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProgramStatisticsTest {

    private final ProgramAssembler assembler = new ProgramAssembler(TestDocuments.PARSER);

    @Test
    void empty_program_has_zero_everything() {
        var stats = ProgramStatistics.of(new Program(List.of()));

        assertEquals(0, stats.groups());
        assertEquals(0, stats.blocks());
        assertEquals(0, stats.maxDepth());
        assertTrue(stats.blockTypes().isEmpty());
    }

    @Test
    void counts_blocks_through_statement_slots() throws Exception {
        var stats = ProgramStatistics.of(assembler.assemble(TestDocuments.resource("/programs/led_blink.xml")));

        assertEquals(1, stats.groups());
        assertEquals(6, stats.blocks());
        assertEquals(3, stats.maxDepth());
        assertEquals(Set.of("main_loop", "inner_loop", "led_on", "led_off"), stats.blockTypes());
    }

    @Test
    void separate_groups_are_counted_separately() throws Exception {
        var stats = ProgramStatistics.of(assembler.assemble(
                "<xml><block type=\"a\"/><block type=\"b\"><next><block type=\"a\"/></next></block></xml>"));

        assertEquals(2, stats.groups());
        assertEquals(3, stats.blocks());
        assertEquals(1, stats.maxDepth());
        assertEquals(List.of("a", "b"), List.copyOf(stats.blockTypes()));
    }
}
