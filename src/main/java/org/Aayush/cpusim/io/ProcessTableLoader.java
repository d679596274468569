package org.Aayush.cpusim.io;

import org.Aayush.cpusim.core.SimulationException;
import org.Aayush.cpusim.process.ProcessTable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses process tables from the plain-text input format.
 *
 * <p>Format: the process count {@code n} on the first non-blank line, followed by
 * {@code n} lines of {@code arrival,burst}. Blank lines are skipped, whitespace around
 * numbers is ignored and lines beyond the declared count are not read.</p>
 */
public final class ProcessTableLoader {
    public static final String REASON_INPUT_FORMAT = "INPUT_FORMAT";

    private final int maxProcesses;

    /**
     * @param maxProcesses capacity enforced on the declared count.
     */
    public ProcessTableLoader(int maxProcesses) {
        if (maxProcesses <= 0) {
            throw new IllegalArgumentException("maxProcesses must be > 0");
        }
        this.maxProcesses = maxProcesses;
    }

    /**
     * Reads and parses a UTF-8 input file.
     *
     * @throws IOException when the file cannot be read.
     * @throws SimulationException on malformed content or capacity breach.
     */
    public ProcessTable load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Parses input text.
     *
     * @throws SimulationException with {@link #REASON_INPUT_FORMAT},
     *         {@link ProcessTable#REASON_CAPACITY_EXCEEDED} or
     *         {@link ProcessTable#REASON_INVALID_PROCESS_SPEC}.
     */
    public ProcessTable parse(String content) {
        Objects.requireNonNull(content, "content");
        List<String> lines = new ArrayList<>();
        for (String line : content.split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line.trim());
            }
        }
        if (lines.isEmpty()) {
            throw new SimulationException(REASON_INPUT_FORMAT, "missing process count");
        }

        int count = parseInt(lines.get(0), "process count", 1);
        if (count < 0) {
            throw new SimulationException(REASON_INPUT_FORMAT, "process count must be >= 0, got " + count);
        }
        if (count > maxProcesses) {
            throw new SimulationException(
                    ProcessTable.REASON_CAPACITY_EXCEEDED,
                    "process count " + count + " exceeds capacity " + maxProcesses
            );
        }
        if (lines.size() - 1 < count) {
            throw new SimulationException(
                    REASON_INPUT_FORMAT,
                    "expected " + count + " process lines, found " + (lines.size() - 1)
            );
        }

        ProcessTable.Builder builder = ProcessTable.builder().maxProcesses(maxProcesses);
        for (int i = 1; i <= count; i++) {
            String line = lines.get(i);
            String[] fields = line.split(",", -1);
            if (fields.length != 2) {
                throw new SimulationException(
                        REASON_INPUT_FORMAT,
                        "line " + (i + 1) + ": expected 'arrival,burst' but was '" + line + "'"
                );
            }
            builder.add(parseInt(fields[0], "arrival", i + 1), parseInt(fields[1], "burst", i + 1));
        }
        return builder.build();
    }

    private static int parseInt(String raw, String field, int lineNumber) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new SimulationException(
                    REASON_INPUT_FORMAT,
                    "line " + lineNumber + ": " + field + " is not an integer: '" + raw.trim() + "'",
                    ex
            );
        }
    }
}
