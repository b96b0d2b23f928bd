package org.learningjava.blockprog.application.usecase;

import org.learningjava.blockprog.application.port.DocumentSourcePort;
import org.learningjava.blockprog.application.port.DocumentsNotFoundException;
import org.learningjava.blockprog.domain.exception.ProgramParseException;
import org.learningjava.blockprog.domain.model.program.Program;
import org.learningjava.blockprog.domain.service.assembly.ProgramAssembler;
import org.learningjava.blockprog.domain.service.assembly.ProgramStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Service
public class ParseProgramUseCase {

    private static final Logger log = LoggerFactory.getLogger(ParseProgramUseCase.class);

    private final ProgramAssembler assembler;
    private final DocumentSourcePort documents;

    public ParseProgramUseCase(ProgramAssembler assembler, DocumentSourcePort documents) {
        this.assembler = assembler;
        this.documents = documents;
    }

    public Program parse(String xml) throws ProgramParseException {
        return summarize(assembler.assemble(xml));
    }

    public Program parse(byte[] content) throws ProgramParseException {
        return summarize(assembler.assemble(content));
    }

    private Program summarize(Program program) {
        if (log.isInfoEnabled()) {
            ProgramStatistics stats = ProgramStatistics.of(program);
            log.info("Parsed program: {} groups, {} blocks, depth {}", stats.groups(), stats.blocks(), stats.maxDepth());
        }
        return program;
    }

    public Program parseFile(Path path) throws ProgramParseException {
        log.info("Parsing block program from {}", path);
        return parse(documents.read(path));
    }

    /**
     * Parses every document under {@code rootDir} on its own; a broken file is
     * reported in its outcome and does not stop the others.
     */
    public List<ParseOutcome> parseDirectory(String rootDir) {
        List<Path> paths = documents.discoverDocuments(rootDir);

        if (paths == null || paths.isEmpty()) {
            log.warn("No block documents found in {}", rootDir);
            throw new DocumentsNotFoundException("No block documents found in " + rootDir);
        }

        List<ParseOutcome> outcomes = new ArrayList<>();
        for (Path path : paths) {
            try {
                outcomes.add(ParseOutcome.success(path.toString(), parseFile(path)));
            } catch (ProgramParseException e) {
                log.warn("Skipping {}: [{}] {}", path, e.code(), e.getMessage());
                outcomes.add(ParseOutcome.failure(path.toString(), e));
            } catch (UncheckedIOException e) {
                log.warn("Skipping unreadable {}: {}", path, e.getMessage());
                outcomes.add(ParseOutcome.unreadable(path.toString(), e));
            }
        }

        long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
        log.info("Parsed {} documents from {} ({} failed)", outcomes.size(), rootDir, failed);
        return outcomes;
    }
}
