package com.telcobright.reviewstats.core.config;

import com.telcobright.reviewstats.core.source.RowSourceFactory;
import com.telcobright.reviewstats.core.source.jdbc.JdbcRowSource;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;

/**
 * Where to read reviews from when the dataset lives in MySQL.
 *
 * The dataset location of a job is then a table name in {@link #getDatabase()},
 * and rows are numbered in {@link #getOrderColumn()} order.
 */
public class JdbcSourceConfig {
    public static final String DEFAULT_ORDER_COLUMN = "id";

    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;
    private final int maximumPoolSize;
    private final String orderColumn;

    private JdbcSourceConfig(String host, int port, String database, String username, String password,
                             int maximumPoolSize, String orderColumn) {
        this.host = host;
        this.port = port;
        this.database = database;
        this.username = username;
        this.password = password;
        this.maximumPoolSize = maximumPoolSize;
        this.orderColumn = orderColumn;
    }

    /**
     * Local server as {@code root} without a password.
     */
    public static JdbcSourceConfig create(String host, int port, String database) {
        return create(host, port, database, "root", "");
    }

    public static JdbcSourceConfig create(String host, int port, String database, String username, String password) {
        return create(host, port, database, username, password, 10);
    }

    /**
     * @param maximumPoolSize connections shared by all workers of a job
     * @throws ConfigurationException for a blank host or database, a bad port or an empty pool
     */
    public static JdbcSourceConfig create(String host, int port, String database, String username,
                                          String password, int maximumPoolSize) {
        return create(host, port, database, username, password, maximumPoolSize, DEFAULT_ORDER_COLUMN);
    }

    public static JdbcSourceConfig create(String host, int port, String database, String username,
                                          String password, int maximumPoolSize, String orderColumn) {
        requireText(host, "MySQL host");
        requireText(database, "Review database");
        requireText(orderColumn, "Order column");
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("MySQL port out of range: " + port);
        }
        if (maximumPoolSize < 1) {
            throw new ConfigurationException("Connection pool needs at least 1 connection, got " + maximumPoolSize);
        }
        return new JdbcSourceConfig(host, port, database, username != null ? username : "root",
            password != null ? password : "", maximumPoolSize, orderColumn);
    }

    private static void requireText(String value, String what) {
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException(what + " is missing");
        }
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public String getOrderColumn() { return orderColumn; }

    public String getJdbcUrl() {
        return "jdbc:mysql://" + host + ":" + port + "/" + database
            + "?useSSL=false&serverTimezone=UTC&allowPublicKeyRetrieval=true";
    }

    /**
     * Opens a HikariCP pool on the review database. Closing it is up to the caller.
     */
    public HikariDataSource createDataSource() {
        HikariConfig pool = new HikariConfig();
        pool.setPoolName("review-source-" + database);
        pool.setDriverClassName("com.mysql.cj.jdbc.Driver");
        pool.setJdbcUrl(getJdbcUrl());
        pool.setUsername(username);
        pool.setPassword(password);
        pool.setMaximumPoolSize(maximumPoolSize);
        pool.setMinimumIdle(1);
        return new HikariDataSource(pool);
    }

    /**
     * Row sources reading the table named by a job's dataset location.
     */
    public RowSourceFactory rowSourceFactory(DataSource dataSource) {
        return tableName -> new JdbcRowSource(dataSource, tableName, orderColumn);
    }

    @Override
    public String toString() {
        return "JdbcSource[" + host + ":" + port + "/" + database + " by " + orderColumn + "]";
    }
}
