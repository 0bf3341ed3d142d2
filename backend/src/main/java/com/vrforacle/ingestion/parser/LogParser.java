package com.vrforacle.ingestion.parser;

import com.vrforacle.domain.PublicKey;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one transaction's raw log lines into program-attributed events.
 * <p>
 * Logs are a flat trace of nested program invocations; an invocation stack rebuilt from the
 * invoke/success lines tells which program emitted each data line. Inconsistent lines become
 * {@link ParseLogError}s and parsing continues with the next line. Stateless and thread-safe.
 * <p>
 * Program ids in invoke and success lines must be base58 addresses; any other id text makes the
 * line a {@code MalformedInvokeLine} or {@code MalformedReturnLine}.
 */
@Component
public class LogParser {

    private static final String LOG_PREFIX = "Program log: ";
    private static final String DATA_PREFIX = "Program data: ";
    private static final String PROGRAM_PREFIX = "Program ";

    private static final Pattern INVOKE = Pattern.compile("^Program (.*) invoke.*$");
    private static final Pattern RETURN = Pattern.compile("^Program (.*) success*$");
    private static final Pattern BASE64_TEXT = Pattern.compile("^[A-Za-z0-9+/=]*$");
    /** Base58 address, 32-44 chars. */
    private static final Pattern PROGRAM_ID = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");

    public ParsedLogs parse(List<String> logs, Collection<PublicKey> trackedProgramIds) {
        Map<String, PublicKey> tracked = new HashMap<>();
        for (PublicKey id : trackedProgramIds) {
            tracked.put(id.toBase58(), id);
        }

        List<ProgramEvent> events = new ArrayList<>();
        List<ParseLogError> errors = new ArrayList<>();
        Deque<String> stack = new ArrayDeque<>();

        for (String line : logs) {
            LogLine parsed = classify(line);
            switch (parsed.kind()) {
                case INVOKE -> stack.push(parsed.value());
                case RETURN -> {
                    String popped = stack.poll();
                    if (popped != null && !popped.equals(parsed.value())) {
                        errors.add(ParseLogError.programIdMismatch(line, popped, parsed.value()));
                    }
                }
                case IN_PROGRAM -> {
                    String current = stack.peek();
                    if (current == null) {
                        errors.add(ParseLogError.noCurrentProgramId(line));
                    } else if (!current.equals(parsed.value())) {
                        errors.add(ParseLogError.programIdMismatch(line, current, parsed.value()));
                    }
                }
                case DATA -> {
                    String current = stack.peek();
                    if (current == null) {
                        errors.add(ParseLogError.noCurrentProgramId(line));
                        continue;
                    }
                    PublicKey programId = tracked.get(current);
                    if (programId == null) {
                        continue;
                    }
                    try {
                        events.add(new ProgramEvent(programId, decodeBase64(parsed.value())));
                    } catch (IllegalArgumentException e) {
                        errors.add(ParseLogError.payloadDecode(line, e.getMessage()));
                    }
                }
                case MALFORMED_INVOKE -> errors.add(ParseLogError.malformedInvoke(line));
                case MALFORMED_RETURN -> errors.add(ParseLogError.malformedReturn(line));
                case TRIVIA -> {
                }
            }
        }
        return new ParsedLogs(events, errors);
    }

    /**
     * First match wins: output prefix, invoke, success, other {@code Program <id> ...}, trivia.
     */
    LogLine classify(String line) {
        String payload = stripOutputPrefix(line);
        if (payload != null) {
            return BASE64_TEXT.matcher(payload).matches() ? LogLine.data(payload) : LogLine.TRIVIA;
        }

        Matcher invoke = INVOKE.matcher(line);
        if (invoke.matches()) {
            String id = invoke.group(1);
            return PROGRAM_ID.matcher(id).matches()
                    ? LogLine.invoke(id)
                    : new LogLine(LogLine.Kind.MALFORMED_INVOKE, id);
        }

        Matcher ret = RETURN.matcher(line);
        if (ret.matches()) {
            String id = ret.group(1);
            return PROGRAM_ID.matcher(id).matches()
                    ? LogLine.ret(id)
                    : new LogLine(LogLine.Kind.MALFORMED_RETURN, id);
        }

        if (line.startsWith(PROGRAM_PREFIX)) {
            String rest = line.substring(PROGRAM_PREFIX.length());
            int end = rest.indexOf(' ');
            // "Program return: ..." and similar runtime lines name no program
            if (end > 0 && PROGRAM_ID.matcher(rest.substring(0, end)).matches()) {
                return LogLine.inProgram(rest.substring(0, end));
            }
        }
        return LogLine.TRIVIA;
    }

    private static String stripOutputPrefix(String line) {
        if (line.startsWith(LOG_PREFIX)) {
            return line.substring(LOG_PREFIX.length());
        }
        if (line.startsWith(DATA_PREFIX)) {
            return line.substring(DATA_PREFIX.length());
        }
        return null;
    }

    /** Standard alphabet with mandatory padding. */
    private static byte[] decodeBase64(String text) {
        if (text.length() % 4 != 0) {
            throw new IllegalArgumentException("Invalid padding: length " + text.length() + " is not a multiple of 4");
        }
        return Base64.getDecoder().decode(text);
    }
}
