package com.weatherdesk.backend.service;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A connection checked out of a {@link ConnectionPool}. Closing it hands it
 * back to the pool, so callers acquire it in a try-with-resources block.
 * A handle returned once is inert; closing it again does nothing.
 */
public final class PooledConnection implements AutoCloseable {

    private final int id;
    private final Connection connection;
    private final ConnectionPool pool;
    private final AtomicBoolean inUse = new AtomicBoolean();
    private volatile boolean broken;

    PooledConnection(int id, Connection connection, ConnectionPool pool) {
        this.id = id;
        this.connection = connection;
        this.pool = pool;
    }

    public int id() {
        return id;
    }

    public boolean inUse() {
        return inUse.get();
    }

    public Connection connection() {
        if (!inUse.get()) {
            throw new IllegalStateException("Connection " + id + " is not checked out");
        }
        return connection;
    }

    /** Flags the handle so the pool replaces it instead of reusing it. */
    public void markBroken() {
        broken = true;
    }

    boolean isBroken() {
        if (broken) {
            return true;
        }
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }

    boolean checkOut() {
        return inUse.compareAndSet(false, true);
    }

    boolean checkIn() {
        return inUse.compareAndSet(true, false);
    }

    Connection rawConnection() {
        return connection;
    }

    @Override
    public void close() {
        pool.release(this);
    }
}
