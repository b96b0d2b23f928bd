package org.learningjava.blockprog.infrastructure.adapter.out.fs;

import org.learningjava.blockprog.application.port.DocumentSourcePort;
import org.learningjava.blockprog.application.port.DocumentsNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class FileSystemDocumentSource implements DocumentSourcePort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentSource.class);

    private final String extension;

    public FileSystemDocumentSource(String extension) {
        this.extension = extension.toLowerCase(Locale.ROOT);
    }

    @Override
    public List<Path> discoverDocuments(String rootDir) {
        Path root = Path.of(rootDir);
        if (!Files.isDirectory(root)) {
            throw new DocumentsNotFoundException("Directory not found: " + rootDir);
        }

        try (var s = Files.walk(root)) {
            List<Path> out = s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
                    .sorted()
                    .toList();
            log.info("Discovered {} {} documents under {}", out.size(), extension, rootDir);
            return out;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public byte[] read(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
