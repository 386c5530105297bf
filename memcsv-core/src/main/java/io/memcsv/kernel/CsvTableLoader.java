package io.memcsv.kernel;

import io.memcsv.core.CsvLoadException;
import io.memcsv.core.MemcsvConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads a whole delimited text source into a {@link CsvTable}.
 * <p>
 * The first line is the header. Each data line is split on the delimiter, fields are
 * trimmed, and the row is padded with empty cells or truncated to the header width.
 * A trailing delimiter does not open an extra field.
 */
public final class CsvTableLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvTableLoader.class);

    private final MemcsvConfiguration configuration;

    public CsvTableLoader(MemcsvConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
    }

    public CsvTable load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path required");
        }
        if (!Files.exists(path)) {
            throw new CsvLoadException("path '" + path + "' does not exist");
        }
        try (BufferedReader reader = Files.newBufferedReader(path, configuration.charset())) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new CsvLoadException("failed to read '" + path + "'", e);
        }
    }

    public CsvTable load(Reader reader, String sourceName) {
        if (reader == null) {
            throw new IllegalArgumentException("reader required");
        }
        try {
            BufferedReader buffered = reader instanceof BufferedReader
                    ? (BufferedReader) reader
                    : new BufferedReader(reader);
            return read(buffered, sourceName);
        } catch (IOException e) {
            throw new CsvLoadException("failed to read " + sourceName, e);
        }
    }

    private CsvTable read(BufferedReader reader, String sourceName) throws IOException {
        String headerLine = reader.readLine();
        if (headerLine == null) {
            log.debug("Source {} is empty", sourceName);
            return CsvTable.of(sourceName, Collections.emptyList(), Collections.emptyList());
        }
        List<String> header = splitLine(headerLine, -1);
        int width = header.size();

        List<List<String>> rows = new ArrayList<>();
        for (String line = reader.readLine(); line != null; line = reader.readLine()) {
            if (configuration.skipBlankLines() && line.isBlank()) {
                continue;
            }
            rows.add(splitLine(line, width));
        }

        CsvTable table = CsvTable.of(sourceName, header, rows);
        log.debug("Loaded {} rows x {} columns from {}", table.rowCount(), table.columnCount(), sourceName);
        return table;
    }

    /**
     * Split one line into fields; pads or truncates to {@code expectedSize} when it is not negative.
     */
    List<String> splitLine(String line, int expectedSize) {
        char delimiter = configuration.delimiter();
        List<String> cells = new ArrayList<>(expectedSize > 0 ? expectedSize : 8);

        int start = 0;
        while (start < line.length()) {
            int end = line.indexOf(delimiter, start);
            if (end < 0) {
                end = line.length();
            }
            String cell = line.substring(start, end);
            cells.add(configuration.trimWhitespace() ? cell.strip() : cell);
            start = end + 1;
        }

        if (expectedSize >= 0) {
            while (cells.size() < expectedSize) {
                cells.add("");
            }
            if (cells.size() > expectedSize) {
                return new ArrayList<>(cells.subList(0, expectedSize));
            }
        }
        return cells;
    }
}
