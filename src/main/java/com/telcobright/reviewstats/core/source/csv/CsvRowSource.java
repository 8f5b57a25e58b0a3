package com.telcobright.reviewstats.core.source.csv;

import com.telcobright.reviewstats.core.source.Row;
import com.telcobright.reviewstats.core.source.RowBatch;
import com.telcobright.reviewstats.core.source.RowSource;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Reads reviews from a delimited text file with a header line.
 *
 * Row index {@code i} is the {@code i}-th data record after the header, so a
 * quoted field spanning several lines is still one row. Every
 * {@link #readRange} call opens its own parser; ranges far into the file are
 * reached by skipping records.
 */
public class CsvRowSource implements RowSource {

    private final Path path;
    private final CSVFormat format;

    public CsvRowSource(Path path) {
        this(path, CSVFormat.DEFAULT);
    }

    public CsvRowSource(Path path, CSVFormat baseFormat) {
        this.path = path;
        this.format = baseFormat.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .build();
    }

    public Path getPath() {
        return path;
    }

    @Override
    public boolean isAvailable() {
        return Files.isRegularFile(path) && Files.isReadable(path);
    }

    @Override
    public RowBatch readRange(long lo, long hi) throws IOException {
        if (lo < 0 || hi < lo) {
            throw new IllegalArgumentException("Invalid row range [" + lo + ", " + hi + ")");
        }
        BufferedReader reader = new BufferedReader(new InputStreamReader(
            BOMInputStream.builder().setPath(path).get(), StandardCharsets.UTF_8));
        try {
            return new CsvRowBatch(format.parse(reader), lo, hi);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    @Override
    public String toString() {
        return "CsvRowSource[" + path + "]";
    }

    private static final class CsvRowBatch implements RowBatch {
        private final CSVParser parser;
        private final Set<String> columns;
        private final long lo;
        private final long hi;
        private boolean iterated;

        CsvRowBatch(CSVParser parser, long lo, long hi) {
            this.parser = parser;
            this.columns = Collections.unmodifiableSet(new LinkedHashSet<>(parser.getHeaderNames()));
            this.lo = lo;
            this.hi = hi;
        }

        @Override
        public Set<String> getColumns() {
            return columns;
        }

        @Override
        public Iterator<Row> iterator() {
            if (iterated) {
                throw new IllegalStateException("Row batch can only be iterated once");
            }
            iterated = true;

            Iterator<CSVRecord> records = parser.iterator();
            for (long skipped = 0; skipped < lo && records.hasNext(); skipped++) {
                records.next();
            }

            return new Iterator<Row>() {
                private long remaining = hi - lo;

                @Override
                public boolean hasNext() {
                    return remaining > 0 && records.hasNext();
                }

                @Override
                public Row next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    remaining--;
                    return Row.of(records.next().toMap());
                }
            };
        }

        @Override
        public void close() throws IOException {
            parser.close();
        }
    }
}
