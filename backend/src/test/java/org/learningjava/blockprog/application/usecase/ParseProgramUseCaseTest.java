package org.learningjava.blockprog.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.blockprog.application.port.DocumentSourcePort;
import org.learningjava.blockprog.application.port.DocumentsNotFoundException;
import org.learningjava.blockprog.domain.exception.EmptyFieldException;
import org.learningjava.blockprog.domain.exception.ParseErrorCode;
import org.learningjava.blockprog.domain.model.program.Block;
import org.learningjava.blockprog.domain.model.program.Program;
import org.learningjava.blockprog.domain.model.program.StatementBody;
import org.learningjava.blockprog.domain.service.assembly.ProgramAssembler;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ParseProgramUseCaseTest {

    private ProgramAssembler assembler;
    private DocumentSourcePort documents;

    private ParseProgramUseCase useCase;

    private static Program oneBlock(String type) {
        var block = new Block(type, "id-" + type, Map.of(), Map.of());
        return new Program(List.of(new StatementBody(List.of(block))));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @BeforeEach
    void setUp() {
        assembler = mock(ProgramAssembler.class);
        documents = mock(DocumentSourcePort.class);
        useCase = new ParseProgramUseCase(assembler, documents);
    }

    @Test
    void parse_delegates_to_assembler() throws Exception {
        var program = oneBlock("a");
        when(assembler.assemble("<xml/>")).thenReturn(program);

        assertSame(program, useCase.parse("<xml/>"));
        verify(assembler).assemble("<xml/>");
        verifyNoInteractions(documents);
    }

    @Test
    void parse_propagates_the_first_error() throws Exception {
        when(assembler.assemble(anyString())).thenThrow(new EmptyFieldException("COUNT"));

        assertThrows(EmptyFieldException.class, () -> useCase.parse("<xml/>"));
    }

    @Test
    void parseFile_reads_through_the_source_port() throws Exception {
        Path file = Path.of("p.xml");
        byte[] content = bytes("<xml>a</xml>");
        var program = oneBlock("a");
        when(documents.read(file)).thenReturn(content);
        when(assembler.assemble(content)).thenReturn(program);

        assertSame(program, useCase.parseFile(file));
    }

    @Test
    void parseDirectory_reports_each_file_independently() throws Exception {
        Path good = Path.of("root/good.xml");
        Path bad = Path.of("root/bad.xml");
        Path alsoGood = Path.of("root/z.xml");
        byte[] goodBytes = bytes("good");
        byte[] badBytes = bytes("bad");
        byte[] zBytes = bytes("z");
        when(documents.discoverDocuments("root")).thenReturn(List.of(good, bad, alsoGood));
        when(documents.read(good)).thenReturn(goodBytes);
        when(documents.read(bad)).thenReturn(badBytes);
        when(documents.read(alsoGood)).thenReturn(zBytes);
        when(assembler.assemble(goodBytes)).thenReturn(oneBlock("g"));
        when(assembler.assemble(badBytes)).thenThrow(new EmptyFieldException("F"));
        when(assembler.assemble(zBytes)).thenReturn(oneBlock("z"));

        List<ParseOutcome> outcomes = useCase.parseDirectory("root");

        assertEquals(3, outcomes.size());
        assertTrue(outcomes.get(0).succeeded());
        assertEquals(good.toString(), outcomes.get(0).source());

        assertFalse(outcomes.get(1).succeeded());
        assertEquals(ParseErrorCode.EMPTY_FIELD, outcomes.get(1).errorCode());
        assertNull(outcomes.get(1).program());

        assertTrue(outcomes.get(2).succeeded());
        assertEquals("z", outcomes.get(2).program().groups().get(0).blocks().get(0).blockType());
    }

    @Test
    void parseDirectory_keeps_going_when_a_file_cannot_be_read() throws Exception {
        Path locked = Path.of("root/locked.xml");
        Path good = Path.of("root/good.xml");
        byte[] goodBytes = bytes("good");
        when(documents.discoverDocuments("root")).thenReturn(List.of(locked, good));
        when(documents.read(locked)).thenThrow(new UncheckedIOException(new AccessDeniedException("root/locked.xml")));
        when(documents.read(good)).thenReturn(goodBytes);
        when(assembler.assemble(goodBytes)).thenReturn(oneBlock("g"));

        List<ParseOutcome> outcomes = useCase.parseDirectory("root");

        assertEquals(2, outcomes.size());
        assertFalse(outcomes.get(0).succeeded());
        assertEquals(ParseErrorCode.DOCUMENT_UNREADABLE, outcomes.get(0).errorCode());
        assertTrue(outcomes.get(0).message().contains("locked.xml"));
        assertTrue(outcomes.get(1).succeeded());
    }

    @Test
    void parseDirectory_without_documents_fails() {
        when(documents.discoverDocuments("empty")).thenReturn(List.of());

        DocumentsNotFoundException e = assertThrows(DocumentsNotFoundException.class,
                () -> useCase.parseDirectory("empty"));
        assertTrue(e.getMessage().contains("empty"));
        verifyNoInteractions(assembler);
    }
}
