package com.vrforacle.ingestion.parser;

/**
 * Classification of one raw log line. {@code value} is the payload text for {@link Kind#DATA}
 * and the program id for the invoke/return/in-program kinds.
 */
record LogLine(Kind kind, String value) {

    enum Kind {
        TRIVIA,
        DATA,
        INVOKE,
        RETURN,
        IN_PROGRAM,
        MALFORMED_INVOKE,
        MALFORMED_RETURN
    }

    static final LogLine TRIVIA = new LogLine(Kind.TRIVIA, null);

    static LogLine data(String payload) {
        return new LogLine(Kind.DATA, payload);
    }

    static LogLine invoke(String programId) {
        return new LogLine(Kind.INVOKE, programId);
    }

    static LogLine ret(String programId) {
        return new LogLine(Kind.RETURN, programId);
    }

    static LogLine inProgram(String programId) {
        return new LogLine(Kind.IN_PROGRAM, programId);
    }
}
