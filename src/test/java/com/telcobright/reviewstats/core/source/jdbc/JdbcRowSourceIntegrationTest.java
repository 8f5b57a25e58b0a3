package com.telcobright.reviewstats.core.source.jdbc;

import com.telcobright.reviewstats.core.config.JdbcSourceConfig;
import com.telcobright.reviewstats.core.config.JobConfig;
import com.telcobright.reviewstats.core.job.AggregationJob;
import com.telcobright.reviewstats.core.job.JobResult;
import com.telcobright.reviewstats.core.logging.Slf4jLogger;
import com.telcobright.reviewstats.core.query.ReviewQueries;
import com.telcobright.reviewstats.core.query.ReviewQuery;
import com.telcobright.reviewstats.core.source.Row;
import com.telcobright.reviewstats.core.source.RowBatch;
import com.telcobright.reviewstats.core.source.csv.CsvRowSource;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Reads reviews out of MySQL and checks the answers match the CSV source.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcRowSourceIntegrationTest {

    private static final Logger logger = LoggerFactory.getLogger(JdbcRowSourceIntegrationTest.class);

    @Container
    static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0.33")
        .withDatabaseName("reviews_db")
        .withUsername("test_user")
        .withPassword("test_password");

    private static final String[][] REVIEWS = {
        {"U1", "Amy", "B1", "Dune", "2.00", "5"},
        {"U2", "Bob", "B1", "Dune", "2.00", "5"},
        {"U1", "Amy", "B2", "Emma", "19.50", "3"},
        {"U3", "Cat", "B2", "Emma", "19.50", "2"},
        {"U1", "Amy", "B3", "Ulysses", null, "1"},
        {"U2", "Bob", "B3", "Ulysses", "30.00", "4"},
        {"U1", "Amy", "B4", "Walden", "8.25", "5"},
        {"U2", "Bobby", "B4", "Walden", "8.25", "3"},
        {"U2", "Bob", "B5", "Beloved", "2.00", "4"},
    };

    private static JdbcSourceConfig sourceConfig;
    private static HikariDataSource dataSource;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void createTable() throws Exception {
        logger.info("MySQL container at {}", mysql.getJdbcUrl());
        sourceConfig = JdbcSourceConfig.create(mysql.getHost(), mysql.getFirstMappedPort(), mysql.getDatabaseName(),
            mysql.getUsername(), mysql.getPassword(), 4);
        dataSource = sourceConfig.createDataSource();

        try (Connection connection = dataSource.getConnection()) {
            try (Statement stmt = connection.createStatement()) {
                stmt.executeUpdate("CREATE TABLE reviews ("
                    + "id INT PRIMARY KEY, UId VARCHAR(16), UName VARCHAR(64), BId VARCHAR(16), "
                    + "BTitle VARCHAR(128), BPrice DECIMAL(10,2) NULL, RScore DECIMAL(3,1))");
            }
            try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO reviews (id, UId, UName, BId, BTitle, BPrice, RScore) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                for (int i = 0; i < REVIEWS.length; i++) {
                    ps.setInt(1, i);
                    for (int c = 0; c < 6; c++) {
                        ps.setString(c + 2, REVIEWS[i][c]);
                    }
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        }
    }

    @AfterAll
    static void closePool() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    private JdbcRowSource tableSource(String table) {
        return new JdbcRowSource(dataSource, table, "id");
    }

    private Path writeCsv() throws Exception {
        StringBuilder csv = new StringBuilder("UId,UName,BId,BTitle,BPrice,RScore\n");
        for (String[] review : REVIEWS) {
            csv.append(String.join(",", review[0], review[1], review[2], review[3],
                review[4] == null ? "" : review[4], review[5])).append('\n');
        }
        Path file = tempDir.resolve("reviews.csv");
        Files.write(file, csv.toString().getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void readsRangesInIdOrderWithNullAsMissing() throws Exception {
        List<Row> rows = new ArrayList<>();
        try (RowBatch batch = tableSource("reviews").readRange(3, 5)) {
            assertThat(batch.getColumns()).contains("UId", "BPrice", "RScore");
            for (Row row : batch) {
                rows.add(row);
            }
        }

        assertThat(rows).extracting(row -> row.get("UName")).containsExactly("Cat", "Amy");
        assertThat(rows.get(1).get("BPrice")).isNull();
    }

    @Test
    void availabilityFollowsTheTable() {
        assertThat(tableSource("reviews").isAvailable()).isTrue();
        assertThat(tableSource("no_such_table").isAvailable()).isFalse();
        assertThatThrownBy(() -> tableSource("reviews; DROP TABLE reviews"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void answersMatchTheCsvSource() throws Exception {
        Path csv = writeCsv();

        for (int workers = 1; workers <= 3; workers++) {
            JobResult<Long> fromTable = run(ReviewQueries.perfectBargains(), "reviews", workers, true);
            JobResult<Long> fromFile = run(ReviewQueries.perfectBargains(), csv.toString(), workers, false);
            assertThat(fromTable.getFinalAnswer()).isEqualTo(fromFile.getFinalAnswer()).isEqualTo(1L);

            JobResult<String> reviewersFromTable = run(ReviewQueries.topReviewers(), "reviews", workers, true);
            JobResult<String> reviewersFromFile = run(ReviewQueries.topReviewers(), csv.toString(), workers, false);
            assertThat(reviewersFromTable.getFinalAnswer()).isEqualTo(reviewersFromFile.getFinalAnswer());

            JobResult<Map<String, BigDecimal>> pricesFromTable = run(ReviewQueries.priciestLowlyRated(), "reviews", workers, true);
            JobResult<Map<String, BigDecimal>> pricesFromFile = run(ReviewQueries.priciestLowlyRated(), csv.toString(), workers, false);
            assertThat(pricesFromTable.getFinalAnswer().keySet())
                .containsExactlyElementsOf(pricesFromFile.getFinalAnswer().keySet())
                .containsExactly("Ulysses", "Emma");
        }
    }

    private <R> JobResult<R> run(ReviewQuery<R> query, String location,
                                 int workers, boolean fromTable) {
        JobResult<R> result = AggregationJob.builder(query)
            .config(JobConfig.builder().datasetLocation(location).totalRowCount(REVIEWS.length).workerCount(workers).build())
            .rowSourceFactory(fromTable ? sourceConfig.rowSourceFactory(dataSource) : name -> new CsvRowSource(Paths.get(name)))
            .logger(new Slf4jLogger(JdbcRowSourceIntegrationTest.class))
            .build()
            .run();
        assertThat(result.isSuccess()).as("%s", result).isTrue();
        return result;
    }
}
