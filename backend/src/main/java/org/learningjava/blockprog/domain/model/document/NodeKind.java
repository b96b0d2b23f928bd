package org.learningjava.blockprog.domain.model.document;

public enum NodeKind {
    DOCUMENT,
    ELEMENT,
    TEXT,
    // comments, processing instructions, doctype
    OTHER
}
