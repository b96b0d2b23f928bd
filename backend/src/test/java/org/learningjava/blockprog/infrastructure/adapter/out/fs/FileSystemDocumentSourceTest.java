package org.learningjava.blockprog.infrastructure.adapter.out.fs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.learningjava.blockprog.application.port.DocumentsNotFoundException;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemDocumentSourceTest {

    @TempDir
    Path tmp;

    private final FileSystemDocumentSource source = new FileSystemDocumentSource(".xml");

    @Test
    void discovers_xml_files_recursively_sorted() throws Exception {
        Files.createDirectories(tmp.resolve("nested"));
        Files.writeString(tmp.resolve("b.xml"), "<xml/>");
        Files.writeString(tmp.resolve("nested/a.XML"), "<xml/>");
        Files.writeString(tmp.resolve("notes.txt"), "skip me");

        List<Path> found = source.discoverDocuments(tmp.toString());

        assertEquals(List.of(tmp.resolve("b.xml"), tmp.resolve("nested/a.XML")), found);
    }

    @Test
    void empty_directory_gives_empty_list() {
        assertTrue(source.discoverDocuments(tmp.toString()).isEmpty());
    }

    @Test
    void missing_directory_is_reported() {
        DocumentsNotFoundException e = assertThrows(DocumentsNotFoundException.class,
                () -> source.discoverDocuments(tmp.resolve("nope").toString()));
        assertTrue(e.getMessage().contains("Directory not found"));
    }

    @Test
    void reads_bytes_without_decoding() throws Exception {
        Path file = tmp.resolve("p.xml");
        byte[] latin1 = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><xml><!-- café --></xml>"
                .getBytes(StandardCharsets.ISO_8859_1);
        Files.write(file, latin1);

        assertArrayEquals(latin1, source.read(file));
    }

    @Test
    void unreadable_path_is_unchecked() {
        assertThrows(UncheckedIOException.class, () -> source.read(tmp.resolve("gone.xml")));
    }
}
