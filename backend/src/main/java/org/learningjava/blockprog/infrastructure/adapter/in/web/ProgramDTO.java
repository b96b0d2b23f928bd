package org.learningjava.blockprog.infrastructure.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.learningjava.blockprog.application.usecase.ParseOutcome;
import org.learningjava.blockprog.domain.model.program.Block;
import org.learningjava.blockprog.domain.model.program.ExpressionField;
import org.learningjava.blockprog.domain.model.program.FieldValue;
import org.learningjava.blockprog.domain.model.program.Program;
import org.learningjava.blockprog.domain.model.program.SimpleField;
import org.learningjava.blockprog.domain.model.program.StatementBody;
import org.learningjava.blockprog.domain.service.assembly.ProgramStatistics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record ProgramDTO(List<StatementBodyDTO> groups, SummaryDTO summary) {

    static ProgramDTO from(Program p) {
        return new ProgramDTO(
                p.groups().stream().map(StatementBodyDTO::from).toList(),
                SummaryDTO.from(ProgramStatistics.of(p))
        );
    }

    public record StatementBodyDTO(List<BlockDTO> blocks) {
        static StatementBodyDTO from(StatementBody body) {
            return new StatementBodyDTO(body.blocks().stream().map(BlockDTO::from).toList());
        }
    }

    public record BlockDTO(
            String type,
            String id,
            Map<String, FieldDTO> fields,
            Map<String, StatementBodyDTO> statements
    ) {
        static BlockDTO from(Block b) {
            Map<String, FieldDTO> fields = new LinkedHashMap<>();
            b.fields().forEach((name, value) -> fields.put(name, FieldDTO.from(value)));
            Map<String, StatementBodyDTO> statements = new LinkedHashMap<>();
            b.statements().forEach((name, body) -> statements.put(name, StatementBodyDTO.from(body)));
            return new BlockDTO(b.blockType(), b.id(), fields, statements);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FieldDTO(String kind, String text, BlockDTO block) {
        static FieldDTO from(FieldValue v) {
            if (v instanceof SimpleField s) {
                return new FieldDTO("simple", s.text(), null);
            }
            ExpressionField e = (ExpressionField) v;
            return new FieldDTO("expression", null, BlockDTO.from(e.block()));
        }
    }

    public record SummaryDTO(int groups, int blocks, int maxDepth, Set<String> blockTypes) {
        static SummaryDTO from(ProgramStatistics s) {
            return new SummaryDTO(s.groups(), s.blocks(), s.maxDepth(), s.blockTypes());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OutcomeDTO(String source, boolean ok, ProgramDTO program, String errorCode, String message) {
        static OutcomeDTO from(ParseOutcome o) {
            return new OutcomeDTO(
                    o.source(),
                    o.succeeded(),
                    o.succeeded() ? ProgramDTO.from(o.program()) : null,
                    o.errorCode() != null ? o.errorCode().name() : null,
                    o.message()
            );
        }
    }
}
