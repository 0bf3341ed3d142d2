package com.vrforacle.ingestion.parser;

/**
 * Per-line diagnostic produced while parsing a transaction's logs. Non-fatal for the parse itself.
 *
 * @param current  program on top of the invocation stack when the line was seen, null if the stack was empty
 * @param expected program id named by the line
 * @param detail   decoder message for {@link Type#PAYLOAD_DECODE}
 */
public record ParseLogError(Type type, String line, String current, String expected, String detail) {

    public enum Type {
        PROGRAM_ID_MISMATCH,
        NO_CURRENT_PROGRAM_ID,
        PAYLOAD_DECODE,
        MALFORMED_INVOKE,
        MALFORMED_RETURN
    }

    public static ParseLogError programIdMismatch(String line, String current, String expected) {
        return new ParseLogError(Type.PROGRAM_ID_MISMATCH, line, current, expected, null);
    }

    public static ParseLogError noCurrentProgramId(String line) {
        return new ParseLogError(Type.NO_CURRENT_PROGRAM_ID, line, null, null, null);
    }

    public static ParseLogError payloadDecode(String line, String detail) {
        return new ParseLogError(Type.PAYLOAD_DECODE, line, null, null, detail);
    }

    public static ParseLogError malformedInvoke(String line) {
        return new ParseLogError(Type.MALFORMED_INVOKE, line, null, null, null);
    }

    public static ParseLogError malformedReturn(String line) {
        return new ParseLogError(Type.MALFORMED_RETURN, line, null, null, null);
    }

    @Override
    public String toString() {
        return switch (type) {
            case PROGRAM_ID_MISMATCH -> "ProgramIdMismatch { line: \"" + line + "\", current: " + current
                    + ", expected: " + expected + " }";
            case NO_CURRENT_PROGRAM_ID -> "NoCurrentProgramId { line: \"" + line + "\" }";
            case PAYLOAD_DECODE -> "PayloadDecodeError { line: \"" + line + "\", error: " + detail + " }";
            case MALFORMED_INVOKE -> "MalformedInvokeLine { line: \"" + line + "\" }";
            case MALFORMED_RETURN -> "MalformedReturnLine { line: \"" + line + "\" }";
        };
    }
}
