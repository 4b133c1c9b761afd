package com.dcruver.medi.store;

import com.dcruver.medi.error.KeyNotFoundException;
import com.dcruver.medi.error.StorageException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Ordered, durable key-value store on a single SQLite table.
 * <p>
 * Keys compare with SQLite's binary collation, so scans come back in byte order.
 * Each mutating call commits (and fsyncs, see {@code DataSourceConfig}) before it returns.
 */
@Component
@Slf4j
public class KeyValueStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public KeyValueStore(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    @PostConstruct
    public void init() {
        try {
            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS kv (
                    key TEXT PRIMARY KEY NOT NULL,
                    value BLOB NOT NULL
                ) WITHOUT ROWID
                """);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to open primary store: " + e.getMessage(), e);
        }
        log.debug("Initialized primary store");
    }

    /**
     * Insert or replace the value under {@code key}.
     */
    public void put(String key, byte[] value) {
        try {
            jdbcTemplate.update("INSERT OR REPLACE INTO kv (key, value) VALUES (?, ?)", key, value);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to write key '" + key + "': " + e.getMessage(), e);
        }
    }

    public Optional<byte[]> get(String key) {
        try {
            List<byte[]> rows = jdbcTemplate.query(
                "SELECT value FROM kv WHERE key = ?",
                (rs, rowNum) -> rs.getBytes("value"),
                key
            );
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read key '" + key + "': " + e.getMessage(), e);
        }
    }

    public boolean contains(String key) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM kv WHERE key = ?", Integer.class, key);
            return count != null && count > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read key '" + key + "': " + e.getMessage(), e);
        }
    }

    /**
     * Remove {@code key}.
     *
     * @throws KeyNotFoundException if nothing was stored under the key
     */
    public void delete(String key) {
        int removed;
        try {
            removed = jdbcTemplate.update("DELETE FROM kv WHERE key = ?", key);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete key '" + key + "': " + e.getMessage(), e);
        }
        if (removed == 0) {
            throw new KeyNotFoundException(key);
        }
    }

    /**
     * All entries whose key starts with {@code prefix}, in key order. An empty prefix scans everything.
     */
    public List<Entry> scanPrefix(String prefix) {
        RowMapper<Entry> mapper = (rs, rowNum) -> new Entry(rs.getString("key"), rs.getBytes("value"));
        try {
            String upper = prefixUpperBound(prefix);
            if (upper == null) {
                return jdbcTemplate.query(
                    "SELECT key, value FROM kv WHERE key >= ? ORDER BY key", mapper, prefix);
            }
            return jdbcTemplate.query(
                "SELECT key, value FROM kv WHERE key >= ? AND key < ? ORDER BY key", mapper, prefix, upper);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to scan prefix '" + prefix + "': " + e.getMessage(), e);
        }
    }

    /**
     * Remove every key starting with {@code prefix} in a single statement.
     *
     * @return number of removed entries
     */
    public int deletePrefix(String prefix) {
        try {
            String upper = prefixUpperBound(prefix);
            int removed = upper == null
                ? jdbcTemplate.update("DELETE FROM kv WHERE key >= ?", prefix)
                : jdbcTemplate.update("DELETE FROM kv WHERE key >= ? AND key < ?", prefix, upper);
            log.debug("Deleted {} entries with prefix '{}'", removed, prefix);
            return removed;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete prefix '" + prefix + "': " + e.getMessage(), e);
        }
    }

    /**
     * Read-modify-write of a single key inside one IMMEDIATE transaction. Calls on the same
     * store file are serialized by SQLite's write lock, including calls from other processes.
     * <p>
     * {@code update} receives the current value (empty when absent) and returns the new one;
     * returning empty removes the key.
     *
     * @return the value written, or empty if the key was removed
     */
    public Optional<byte[]> atomicUpdate(String key, UnaryOperator<Optional<byte[]>> update) {
        try {
            byte[] written = transactionTemplate.execute(status -> {
                List<byte[]> rows = jdbcTemplate.query(
                    "SELECT value FROM kv WHERE key = ?",
                    (rs, rowNum) -> rs.getBytes("value"),
                    key
                );
                Optional<byte[]> current = rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
                Optional<byte[]> next = update.apply(current);

                if (next.isPresent()) {
                    jdbcTemplate.update("INSERT OR REPLACE INTO kv (key, value) VALUES (?, ?)", key, next.get());
                    return next.get();
                }
                jdbcTemplate.update("DELETE FROM kv WHERE key = ?", key);
                return null;
            });
            return Optional.ofNullable(written);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("Atomic update of key '" + key + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Smallest string greater than every string starting with {@code prefix}, or null if unbounded.
     */
    static String prefixUpperBound(String prefix) {
        StringBuilder sb = new StringBuilder(prefix);
        while (sb.length() > 0) {
            int last = sb.length() - 1;
            char c = sb.charAt(last);
            if (c < Character.MAX_VALUE) {
                sb.setCharAt(last, (char) (c + 1));
                return sb.toString();
            }
            sb.setLength(last);
        }
        return null;
    }

    /**
     * One stored key and its raw value.
     */
    @Data
    public static class Entry {
        private final String key;
        private final byte[] value;
    }
}
