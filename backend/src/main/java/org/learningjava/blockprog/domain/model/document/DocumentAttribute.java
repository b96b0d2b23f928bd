package org.learningjava.blockprog.domain.model.document;

public record DocumentAttribute(String localName, String value) {
}
