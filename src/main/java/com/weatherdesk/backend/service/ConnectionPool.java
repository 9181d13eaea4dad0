package com.weatherdesk.backend.service;

import com.weatherdesk.backend.exception.PoolTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-size pool of JDBC connections.
 * <p>
 * The pool owns {@code capacity} slots for its whole life. A slot is either
 * free (queued) or checked out. A connection that broke while checked out is
 * closed and reopened on a background thread; its slot counts as in use until
 * the replacement is queued. In-use is derived as {@code capacity - free}
 * from a single read of the free list, so {@link #stats()} always adds up.
 */
@Slf4j
public class ConnectionPool implements AutoCloseable {

    private static final long REPLACE_RETRY_MILLIS = 500;

    /** Opens a raw connection to the backing store. */
    @FunctionalInterface
    public interface ConnectionFactory {
        Connection open() throws SQLException;
    }

    /** Free and in-use slot counts taken from one read of the free list. */
    public record PoolStats(int capacity, int free, int inUse) {}

    /** Work done with a checked-out connection. */
    @FunctionalInterface
    public interface SqlFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    private final ConnectionFactory factory;
    private final int capacity;
    private final BlockingQueue<PooledConnection> free;
    private final ScheduledExecutorService replacer;
    private volatile boolean closed;

    public ConnectionPool(ConnectionFactory factory, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.factory = factory;
        this.capacity = capacity;
        this.free = new ArrayBlockingQueue<>(capacity);
        this.replacer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "connection-pool-replacer");
            t.setDaemon(true);
            return t;
        });
        for (int id = 1; id <= capacity; id++) {
            try {
                free.add(new PooledConnection(id, factory.open(), this));
            } catch (SQLException e) {
                close();
                throw new IllegalStateException("Failed to open pooled connection " + id, e);
            }
        }
        log.info("Connection pool ready with {} connection(s)", capacity);
    }

    /**
     * Waits up to {@code timeout} for a free connection.
     *
     * @throws PoolTimeoutException if none frees up in time, or the wait is interrupted
     */
    public PooledConnection acquire(Duration timeout) {
        if (closed) {
            throw new IllegalStateException("Connection pool is closed");
        }
        PooledConnection pc;
        try {
            pc = free.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolTimeoutException("Interrupted while waiting for a database connection");
        }
        if (pc == null) {
            throw new PoolTimeoutException(timeout);
        }
        pc.checkOut();
        return pc;
    }

    /**
     * Returns a connection to the pool, or schedules its replacement if it is
     * broken. Releasing a handle that is not checked out is ignored.
     */
    public void release(PooledConnection pc) {
        if (pc == null || !pc.checkIn()) {
            return;
        }
        if (closed) {
            closeQuietly(pc);
            return;
        }
        if (pc.isBroken()) {
            log.warn("Pooled connection {} is broken, replacing it", pc.id());
            closeQuietly(pc);
            replacer.execute(() -> replace(pc.id()));
            return;
        }
        free.offer(pc);
    }

    /**
     * Runs {@code work} on a pooled connection and always gives it back. An
     * {@link SQLException} marks the connection broken before it is rethrown.
     */
    public <T> T withConnection(Duration timeout, SqlFunction<T> work) throws SQLException {
        try (PooledConnection pc = acquire(timeout)) {
            try {
                return work.apply(pc.connection());
            } catch (SQLException e) {
                pc.markBroken();
                throw e;
            }
        }
    }

    public int capacity() {
        return capacity;
    }

    public int freeCount() {
        return free.size();
    }

    /** Slots checked out or waiting for a replacement connection. */
    public int inUseCount() {
        return capacity - free.size();
    }

    public PoolStats stats() {
        int f = free.size();
        return new PoolStats(capacity, f, capacity - f);
    }

    @Override
    public void close() {
        closed = true;
        replacer.shutdownNow();
        PooledConnection pc;
        while ((pc = free.poll()) != null) {
            closeQuietly(pc);
        }
        log.info("Connection pool closed");
    }

    /** Creates the directory of a file-backed SQLite URL if it does not exist. */
    public static void ensureParentDirectory(String jdbcUrl) {
        String prefix = "jdbc:sqlite:";
        if (!jdbcUrl.startsWith(prefix)) {
            return;
        }
        String file = jdbcUrl.substring(prefix.length());
        if (file.isBlank() || file.startsWith(":memory:") || file.startsWith("file:")) {
            return;
        }
        Path parent = Paths.get(file).toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create database directory " + parent, e);
        }
    }

    private void replace(int id) {
        if (closed) {
            return;
        }
        try {
            PooledConnection fresh = new PooledConnection(id, factory.open(), this);
            free.offer(fresh);
            log.info("Pooled connection {} replaced", id);
        } catch (SQLException e) {
            log.warn("Reopening pooled connection {} failed, retrying in {} ms: {}",
                    id, REPLACE_RETRY_MILLIS, e.getMessage());
            replacer.schedule(() -> replace(id), REPLACE_RETRY_MILLIS, TimeUnit.MILLISECONDS);
        }
    }

    private static void closeQuietly(PooledConnection pc) {
        try {
            pc.rawConnection().close();
        } catch (SQLException e) {
            log.debug("Ignoring error while closing connection {}: {}", pc.id(), e.getMessage());
        }
    }
}
