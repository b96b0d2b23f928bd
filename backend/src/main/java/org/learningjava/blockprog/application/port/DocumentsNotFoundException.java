package org.learningjava.blockprog.application.port;

/**
 * Nothing to parse: the directory does not exist or holds no documents.
 */
public class DocumentsNotFoundException extends RuntimeException {

    public DocumentsNotFoundException(String message) {
        super(message);
    }
}
