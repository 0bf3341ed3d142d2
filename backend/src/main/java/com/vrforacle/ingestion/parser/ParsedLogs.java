package com.vrforacle.ingestion.parser;

import java.util.List;
import java.util.stream.Collectors;

public record ParsedLogs(List<ProgramEvent> events, List<ParseLogError> errors) {

    public ParsedLogs {
        events = List.copyOf(events);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** All errors, one per line. */
    public String describeErrors() {
        return errors.stream().map(ParseLogError::toString).collect(Collectors.joining("\n"));
    }
}
