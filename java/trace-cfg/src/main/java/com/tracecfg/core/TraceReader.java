package com.tracecfg.core;

import com.tracecfg.core.domain.JumpKind;
import com.tracecfg.core.domain.TraceRecord;
import com.tracecfg.core.domain.ValidationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the line-oriented trace format:
 *
 * <pre>
 * # comment
 * entry 0x0
 * 0x1 insn LOAD 1
 * 0x4 jump JNE BRANCH_TAKEN 0x10 0x5
 * 0x12 jump JMP UNCONDITIONAL 0x0
 * </pre>
 *
 * Addresses are decimal or {@code 0x}-prefixed hexadecimal. An {@code entry}
 * line is optional and must come before the first event.
 *
 * A {@code #} opens a comment at the start of a line, and after whitespace
 * on {@code entry} and {@code jump} lines. The operand of an {@code insn}
 * line is everything after the mnemonic, taken verbatim, so immediates such
 * as {@code MOV r0, #1} survive.
 */
public class TraceReader {

    private static final String ENTRY = "entry";
    private static final String INSTRUCTION = "insn";
    private static final String JUMP = "jump";
    private static final String COMMENT = "#";

    public Trace read(Path traceFile) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(traceFile, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public Trace parse(String traceText) throws IOException {
        return read(new StringReader(traceText));
    }

    public Trace read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);

        Long entry = null;
        List<TraceEvent> events = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String content = line.trim();
            if (content.isEmpty() || content.startsWith(COMMENT)) {
                continue;
            }
            try {
                if (ENTRY.equals(content.split("\\s+", 2)[0])) {
                    String[] tokens = stripTrailingComment(content).split("\\s+");
                    if (entry != null || !events.isEmpty()) {
                        throw ValidationException.invalid("entry", "entry must be declared once, before any event");
                    }
                    if (tokens.length != 2) {
                        throw ValidationException.invalid("entry", "expected `entry <address>`");
                    }
                    entry = parseAddress("entry", tokens[1]);
                } else {
                    events.add(parseEvent(content, lineNumber));
                }
            } catch (ValidationException e) {
                throw e.atLine(lineNumber);
            }
        }
        return new Trace(entry, events);
    }

    private TraceEvent parseEvent(String content, int lineNumber) {
        String[] tokens = content.split("\\s+", 4);
        if (tokens.length < 3) {
            throw ValidationException.invalid("event", "expected `<address> insn|jump <mnemonic> ...`");
        }
        long address = parseAddress("address", tokens[0]);
        Map<String, Object> fields = new HashMap<>();
        fields.put("name", tokens[2]);

        if (INSTRUCTION.equals(tokens[1])) {
            fields.put("operand", tokens.length == 4 ? tokens[3] : "");
        } else if (JUMP.equals(tokens[1])) {
            tokens = stripTrailingComment(content).split("\\s+");
            if (tokens.length < 5 || tokens.length > 6) {
                throw ValidationException.invalid("event",
                    "expected `<address> jump <mnemonic> <kind> <success> [failure]`");
            }
            fields.put("kind", parseKind(tokens[3]));
            fields.put("successAddress", parseAddress("successAddress", tokens[4]));
            if (tokens.length == 6) {
                fields.put("failureAddress", parseAddress("failureAddress", tokens[5]));
            }
        } else {
            throw ValidationException.invalid("event", "unknown event type `" + tokens[1] + "`, expected insn or jump");
        }
        return new TraceEvent(address, TraceRecord.fromFields(fields), lineNumber);
    }

    private static JumpKind parseKind(String token) {
        try {
            return JumpKind.valueOf(token);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("kind", "The field `kind` is invalid: unknown jump kind `" + token
                + "`, expected one of " + Arrays.toString(JumpKind.values()), e);
        }
    }

    /**
     * Addresses are unsigned 64-bit values, so {@code 0xffffffff81000000} is
     * returned as the negative {@code long} with the same bits.
     *
     * @throws ValidationException if {@code token} is not a decimal or 0x-hex number below 2^64
     */
    public static long parseAddress(String field, String token) {
        try {
            return token.startsWith("0x") || token.startsWith("0X")
                ? Long.parseUnsignedLong(token.substring(2), 16)
                : Long.parseUnsignedLong(token);
        } catch (NumberFormatException e) {
            throw new ValidationException(field, "The field `" + field + "` is invalid: `" + token
                + "` is not an address", e);
        }
    }

    private static String stripTrailingComment(String content) {
        for (int i = 1; i < content.length(); i++) {
            if (content.charAt(i) == '#' && Character.isWhitespace(content.charAt(i - 1))) {
                return content.substring(0, i).trim();
            }
        }
        return content;
    }
}
