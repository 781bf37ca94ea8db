package com.flapmyport.plugins.jdbc;

import com.flapmyport.core.model.CacheKind;
import com.flapmyport.core.model.CacheTtl;
import com.flapmyport.core.model.LinkEvent;
import com.flapmyport.core.spi.EventStore;
import com.flapmyport.core.spi.StoreException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link EventStore} over JDBC (MySQL in production, pooled by HikariCP).
 * <p>
 * All operations take one process-wide lock around their transaction, so callers see the
 * store as strictly sequential. Cache timestamps come from the injected {@link Clock}, and
 * liveness is decided at read time by comparing them with {@code now - ttl}.
 */
public class JdbcEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    static final String SCHEMA_RESOURCE = "/db/schema.sql";

    private final DataSource dataSource;
    private final CacheTtl ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public JdbcEventStore(DataSource dataSource, CacheTtl ttl, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens a pooled store and checks that the database answers.
     */
    public static JdbcEventStore open(String jdbcUrl, String user, String password, int poolSize,
                                      CacheTtl ttl, Clock clock) throws StoreException {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(user);
        config.setPassword(password);
        config.setMaximumPoolSize(Math.max(1, poolSize));
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);
        config.setPoolName("snmpflapd");

        HikariDataSource ds;
        try {
            ds = new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new StoreException("unable to connect to " + jdbcUrl, e);
        }
        log.info("[start] connected to {} (pool size {})", jdbcUrl, config.getMaximumPoolSize());
        return new JdbcEventStore(ds, ttl, clock);
    }

    /** Runs the bundled DDL; every statement is CREATE ... IF NOT EXISTS. */
    public void initSchema() throws StoreException {
        String script;
        try (InputStream in = JdbcEventStore.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) throw new IOException(SCHEMA_RESOURCE + " not on classpath");
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("unable to read schema", e);
        }
        inTransaction("init schema", conn -> {
            try (Statement st = conn.createStatement()) {
                for (String sql : SqlScript.statements(script)) {
                    st.execute(sql);
                }
            }
            return null;
        });
        log.info("Schema initialized");
    }

    // ===== events =====

    @Override
    public void insertEvent(LinkEvent e) throws StoreException {
        inTransaction("insert event " + e.sid(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(INSERT_EVENT)) {
                ps.setString(1, e.ipAddress());
                setNullable(ps, 2, e.hostName());
                ps.setInt(3, e.ifIndex());
                setNullable(ps, 4, e.ifName());
                setNullable(ps, 5, e.ifAlias());
                ps.setString(6, e.adminStatusText());
                ps.setString(7, e.operStatusText());
                ps.setTimestamp(8, Timestamp.valueOf(e.eventTime()));
                ps.setString(9, e.sid());
                ps.setLong(10, e.timeTicks());
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public void updateEvent(String sid, String hostName, String ifName, String ifAlias) throws StoreException {
        int rows = inTransaction("update event " + sid, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(UPDATE_EVENT)) {
                setNullable(ps, 1, hostName);
                setNullable(ps, 2, ifName);
                setNullable(ps, 3, ifAlias);
                ps.setString(4, sid);
                return ps.executeUpdate();
            }
        });
        if (rows == 0) {
            log.warn("{} update matched no stored event", sid);
        }
    }

    // ===== cache =====

    @Override
    public Optional<String> getCachedHostname(String ipAddress) throws StoreException {
        return inTransaction("get cached hostname", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SELECT_HOSTNAME)) {
                ps.setString(1, ipAddress);
                ps.setTimestamp(2, cutoff(CacheKind.HOSTNAME));
                return first(ps);
            }
        });
    }

    @Override
    public void putCachedHostname(String ipAddress, String hostName) throws StoreException {
        inTransaction("put cached hostname", conn -> {
            try (PreparedStatement del = conn.prepareStatement(DELETE_HOSTNAME);
                 PreparedStatement ins = conn.prepareStatement(INSERT_HOSTNAME)) {
                del.setString(1, ipAddress);
                del.executeUpdate();
                ins.setString(1, ipAddress);
                ins.setString(2, hostName);
                ins.setTimestamp(3, now());
                ins.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Optional<String> getCachedIfName(String ipAddress, int ifIndex) throws StoreException {
        return getPerInterface(SELECT_IFNAME, CacheKind.IF_NAME, ipAddress, ifIndex);
    }

    @Override
    public void putCachedIfName(String ipAddress, int ifIndex, String ifName) throws StoreException {
        putPerInterface(DELETE_IFNAME, INSERT_IFNAME, CacheKind.IF_NAME, ipAddress, ifIndex, ifName);
    }

    @Override
    public Optional<String> getCachedIfAlias(String ipAddress, int ifIndex) throws StoreException {
        return getPerInterface(SELECT_IFALIAS, CacheKind.IF_ALIAS, ipAddress, ifIndex);
    }

    @Override
    public void putCachedIfAlias(String ipAddress, int ifIndex, String ifAlias) throws StoreException {
        putPerInterface(DELETE_IFALIAS, INSERT_IFALIAS, CacheKind.IF_ALIAS, ipAddress, ifIndex, ifAlias);
    }

    @Override
    public void cleanup() throws StoreException {
        int[] deleted = inTransaction("cleanup", conn -> {
            int[] counts = new int[3];
            counts[0] = deleteOlder(conn, CLEANUP_HOSTNAME, CacheKind.HOSTNAME);
            counts[1] = deleteOlder(conn, CLEANUP_IFNAME, CacheKind.IF_NAME);
            counts[2] = deleteOlder(conn, CLEANUP_IFALIAS, CacheKind.IF_ALIAS);
            return counts;
        });
        log.info("Cleanup DB done: removed hostname={} ifName={} ifAlias={}", deleted[0], deleted[1], deleted[2]);
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari) {
            hikari.close();
            log.info("[stop] connection pool closed");
        }
    }

    // ===== helpers =====

    private Optional<String> getPerInterface(String sql, CacheKind kind, String ipAddress, int ifIndex)
            throws StoreException {
        return inTransaction("get cached " + kind.label(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, ipAddress);
                ps.setInt(2, ifIndex);
                ps.setTimestamp(3, cutoff(kind));
                return first(ps);
            }
        });
    }

    private void putPerInterface(String deleteSql, String insertSql, CacheKind kind,
                                 String ipAddress, int ifIndex, String value) throws StoreException {
        inTransaction("put cached " + kind.label(), conn -> {
            try (PreparedStatement del = conn.prepareStatement(deleteSql);
                 PreparedStatement ins = conn.prepareStatement(insertSql)) {
                del.setString(1, ipAddress);
                del.setInt(2, ifIndex);
                del.executeUpdate();
                ins.setString(1, ipAddress);
                ins.setInt(2, ifIndex);
                ins.setString(3, value);
                ins.setTimestamp(4, now());
                ins.executeUpdate();
            }
            return null;
        });
    }

    private int deleteOlder(Connection conn, String sql, CacheKind kind) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setTimestamp(1, cutoff(kind));
            return ps.executeUpdate();
        }
    }

    private static Optional<String> first(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
        }
    }

    private static void setNullable(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) ps.setNull(index, Types.VARCHAR);
        else ps.setString(index, value);
    }

    private Timestamp now() {
        return Timestamp.valueOf(LocalDateTime.now(clock));
    }

    private Timestamp cutoff(CacheKind kind) {
        return Timestamp.valueOf(LocalDateTime.now(clock).minus(ttl.forKind(kind)));
    }

    @FunctionalInterface
    private interface TxWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private <T> T inTransaction(String what, TxWork<T> work) throws StoreException {
        lock.lock();
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, what);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreException(what + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new StoreException(what + " failed: " + e, e);
        } finally {
            lock.unlock();
        }
    }

    private static void rollback(Connection conn, String what) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("rollback of {} failed: {}", what, e.getMessage());
        }
    }

    // ===== SQL =====

    static final String INSERT_EVENT =
            "INSERT INTO ports (ipaddress, hostname, ifIndex, ifName, ifAlias, ifAdminStatus, ifOperStatus, time, sid, timeTicks) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    static final String UPDATE_EVENT =
            "UPDATE ports SET hostname = ?, ifName = ?, ifAlias = ? WHERE sid = ?";

    static final String SELECT_HOSTNAME = "SELECT hostname FROM cache_hostname WHERE ipaddress = ? AND time > ?";
    static final String DELETE_HOSTNAME = "DELETE FROM cache_hostname WHERE ipaddress = ?";
    static final String INSERT_HOSTNAME = "INSERT INTO cache_hostname (ipaddress, hostname, time) VALUES (?, ?, ?)";

    static final String SELECT_IFNAME = "SELECT ifName FROM cache_ifname WHERE ipaddress = ? AND ifIndex = ? AND time > ?";
    static final String DELETE_IFNAME = "DELETE FROM cache_ifname WHERE ipaddress = ? AND ifIndex = ?";
    static final String INSERT_IFNAME = "INSERT INTO cache_ifname (ipaddress, ifIndex, ifName, time) VALUES (?, ?, ?, ?)";

    static final String SELECT_IFALIAS = "SELECT ifAlias FROM cache_ifalias WHERE ipaddress = ? AND ifIndex = ? AND time > ?";
    static final String DELETE_IFALIAS = "DELETE FROM cache_ifalias WHERE ipaddress = ? AND ifIndex = ?";
    static final String INSERT_IFALIAS = "INSERT INTO cache_ifalias (ipaddress, ifIndex, ifAlias, time) VALUES (?, ?, ?, ?)";

    static final String CLEANUP_HOSTNAME = "DELETE FROM cache_hostname WHERE time < ?";
    static final String CLEANUP_IFNAME = "DELETE FROM cache_ifname WHERE time < ?";
    static final String CLEANUP_IFALIAS = "DELETE FROM cache_ifalias WHERE time < ?";
}
