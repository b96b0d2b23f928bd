package org.learningjava.blockprog.application.port;

import java.nio.file.Path;
import java.util.List;

public interface DocumentSourcePort {

    /**
     * Regular files under {@code rootDir} with the configured extension, sorted by path.
     */
    List<Path> discoverDocuments(String rootDir);

    /**
     * Raw bytes of a document; decoding is left to the XML parser.
     */
    byte[] read(Path path);
}
