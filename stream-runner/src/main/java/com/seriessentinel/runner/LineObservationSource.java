package com.seriessentinel.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Reads one value per line from a text stream.
 *
 * <p>
 * Blank lines and lines starting with {@code #} are skipped. Lines that do
 * not parse as a number are logged and dropped so that a single bad record
 * does not stop the stream. {@code NaN} and {@code Infinity} parse and are
 * passed on unchanged.
 * </p>
 */
public class LineObservationSource implements ObservationSource {

    private static final Logger LOG = LoggerFactory.getLogger(LineObservationSource.class);

    private final BufferedReader reader;
    private final String name;
    private final boolean closeReader;

    private long lineNumber;
    private long malformedLines;

    /**
     * @param reader      line source; must not be {@code null}
     * @param name        description used in logs
     * @param closeReader whether {@link #close()} closes {@code reader}
     */
    public LineObservationSource(BufferedReader reader, String name, boolean closeReader) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.closeReader = closeReader;
    }

    /**
     * @param path UTF-8 text file
     * @return source reading {@code path}
     * @throws IOException if the file cannot be opened
     */
    public static LineObservationSource fromPath(Path path) throws IOException {
        return new LineObservationSource(Files.newBufferedReader(path, StandardCharsets.UTF_8),
                path.toString(), true);
    }

    /**
     * @return source reading standard input; closing it leaves stdin open
     */
    public static LineObservationSource fromStdin() {
        return new LineObservationSource(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                "stdin", false);
    }

    @Override
    public OptionalDouble next() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            try {
                return OptionalDouble.of(Double.parseDouble(trimmed));
            } catch (NumberFormatException e) {
                malformedLines++;
                LOG.warn("Skipping malformed value at {}:{} – '{}'", name, lineNumber, trimmed);
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * @return number of lines dropped because they were not numbers
     */
    public long getMalformedLines() {
        return malformedLines;
    }

    @Override
    public String describe() {
        return "lines(" + name + ")";
    }

    @Override
    public void close() throws IOException {
        if (closeReader) {
            reader.close();
        }
    }
}
