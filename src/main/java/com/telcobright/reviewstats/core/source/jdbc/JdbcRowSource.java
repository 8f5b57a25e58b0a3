package com.telcobright.reviewstats.core.source.jdbc;

import com.telcobright.reviewstats.core.source.Row;
import com.telcobright.reviewstats.core.source.RowBatch;
import com.telcobright.reviewstats.core.source.RowSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads reviews from a MySQL table. Row index {@code i} is the {@code i}-th
 * row in {@code ORDER BY orderColumn}; the order column must be unique for
 * ranges to be disjoint.
 */
public class JdbcRowSource implements RowSource {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final int FETCH_SIZE = 1000;

    private final DataSource dataSource;
    private final String tableName;
    private final String orderColumn;

    public JdbcRowSource(DataSource dataSource, String tableName, String orderColumn) {
        this.dataSource = dataSource;
        this.tableName = requireIdentifier(tableName, "table");
        this.orderColumn = requireIdentifier(orderColumn, "order column");
    }

    @Override
    public boolean isAvailable() {
        try (Connection connection = dataSource.getConnection();
             ResultSet tables = connection.getMetaData()
                 .getTables(connection.getCatalog(), null, tableName, new String[]{"TABLE"})) {
            return tables.next();
        } catch (SQLException e) {
            // unreachable database is reported as an unavailable dataset
            return false;
        }
    }

    @Override
    public RowBatch readRange(long lo, long hi) throws IOException {
        if (lo < 0 || hi < lo) {
            throw new IllegalArgumentException("Invalid row range [" + lo + ", " + hi + ")");
        }
        String sql = "SELECT * FROM `" + tableName + "` ORDER BY `" + orderColumn + "` LIMIT ? OFFSET ?";

        Connection connection = null;
        PreparedStatement ps = null;
        try {
            connection = dataSource.getConnection();
            ps = connection.prepareStatement(sql);
            ps.setFetchSize(FETCH_SIZE);
            ps.setLong(1, hi - lo);
            ps.setLong(2, lo);
            ResultSet rs = ps.executeQuery();
            return new JdbcRowBatch(connection, ps, rs);
        } catch (SQLException e) {
            closeQuietly(ps, e);
            closeQuietly(connection, e);
            throw new IOException("Failed to read rows [" + lo + ", " + hi + ") from " + tableName, e);
        }
    }

    private static String requireIdentifier(String name, String what) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid " + what + " name: " + name);
        }
        return name;
    }

    private static void closeQuietly(AutoCloseable closeable, Exception primary) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            primary.addSuppressed(e);
        }
    }

    @Override
    public String toString() {
        return "JdbcRowSource[" + tableName + " by " + orderColumn + "]";
    }

    private static final class JdbcRowBatch implements RowBatch {
        private final Connection connection;
        private final PreparedStatement statement;
        private final ResultSet resultSet;
        private final String[] labels;
        private final Set<String> columns;
        private boolean iterated;

        JdbcRowBatch(Connection connection, PreparedStatement statement, ResultSet resultSet) throws SQLException {
            this.connection = connection;
            this.statement = statement;
            this.resultSet = resultSet;

            ResultSetMetaData metadata = resultSet.getMetaData();
            this.labels = new String[metadata.getColumnCount()];
            Set<String> names = new LinkedHashSet<>();
            for (int i = 0; i < labels.length; i++) {
                labels[i] = metadata.getColumnLabel(i + 1);
                names.add(labels[i]);
            }
            this.columns = Collections.unmodifiableSet(names);
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

            return new Iterator<Row>() {
                private Boolean hasNext;

                @Override
                public boolean hasNext() {
                    if (hasNext == null) {
                        try {
                            hasNext = resultSet.next();
                        } catch (SQLException e) {
                            throw new UncheckedIOException(new IOException("Failed to fetch row", e));
                        }
                    }
                    return hasNext;
                }

                @Override
                public Row next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    hasNext = null;
                    try {
                        Map<String, String> fields = new HashMap<>();
                        for (int i = 0; i < labels.length; i++) {
                            fields.put(labels[i], resultSet.getString(i + 1));
                        }
                        return Row.of(fields);
                    } catch (SQLException e) {
                        throw new UncheckedIOException(new IOException("Failed to read row", e));
                    }
                }
            };
        }

        @Override
        public void close() throws IOException {
            try (Connection c = connection; PreparedStatement ps = statement; ResultSet rs = resultSet) {
                // closed in reverse order by try-with-resources
            } catch (SQLException e) {
                throw new IOException("Failed to release JDBC resources", e);
            }
        }
    }
}
