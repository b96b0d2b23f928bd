package org.learningjava.blockprog.application.usecase;

import org.learningjava.blockprog.domain.exception.ParseErrorCode;
import org.learningjava.blockprog.domain.exception.ProgramParseException;
import org.learningjava.blockprog.domain.model.program.Program;

/**
 * Result for one document of a batch: either a program or the error that stopped it.
 */
public record ParseOutcome(String source, Program program, ParseErrorCode errorCode, String message) {

    public static ParseOutcome success(String source, Program program) {
        return new ParseOutcome(source, program, null, null);
    }

    public static ParseOutcome failure(String source, ProgramParseException e) {
        return new ParseOutcome(source, null, e.code(), e.getMessage());
    }

    public static ParseOutcome unreadable(String source, Exception e) {
        return new ParseOutcome(source, null, ParseErrorCode.DOCUMENT_UNREADABLE, e.getMessage());
    }

    public boolean succeeded() {
        return program != null;
    }
}
