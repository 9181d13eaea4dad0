package com.weatherdesk.backend.service;

import com.weatherdesk.backend.config.BackendSettings;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/** Creates the users table at startup and optionally seeds demo accounts. */
@Component
@Slf4j
public class DatabaseInitializer {

    private static final List<String> DEMO_USERS =
            List.of("admin", "alice", "bob", "carol", "dave", "erin", "frank", "grace");

    private final ConnectionPool pool;
    private final PasswordHasher hasher;
    private final BackendSettings settings;

    @Value("${backend.db.seed-demo-users:true}")
    private boolean seedDemoUsers;

    @Value("${backend.db.demo-password:changeme}")
    private String demoPassword;

    public DatabaseInitializer(ConnectionPool pool, PasswordHasher hasher, BackendSettings settings) {
        this.pool = pool;
        this.hasher = hasher;
        this.settings = settings;
    }

    @PostConstruct
    public void init() throws SQLException {
        initialize(seedDemoUsers, demoPassword);
    }

    void initialize(boolean seed, String password) throws SQLException {
        pool.withConnection(settings.acquireTimeout(), conn -> {
            createSchema(conn);
            if (seed && countUsers(conn) == 0) {
                seed(conn, password);
            }
            return null;
        });
    }

    static void createSchema(Connection conn) throws SQLException {
        final String ddlUsers = """
            CREATE TABLE IF NOT EXISTS users (
              id            INTEGER PRIMARY KEY AUTOINCREMENT,
              username      TEXT    NOT NULL UNIQUE,
              email         TEXT    NOT NULL,
              password_hash TEXT    NOT NULL
            );
            """;
        final String ddlIdx = "CREATE INDEX IF NOT EXISTS idx_users_username ON users(username);";
        try (Statement s = conn.createStatement()) {
            s.execute(ddlUsers);
            s.execute(ddlIdx);
        }
    }

    private static long countUsers(Connection conn) throws SQLException {
        try (Statement s = conn.createStatement();
             ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM users")) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    private void seed(Connection conn, String password) throws SQLException {
        final String sql = "INSERT INTO users (username, email, password_hash) VALUES (?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (String name : DEMO_USERS) {
                ps.setString(1, name);
                ps.setString(2, name + "@example.com");
                ps.setString(3, hasher.hash(password));
                ps.addBatch();
            }
            ps.executeBatch();
        }
        log.warn("Seeded {} demo users sharing the configured demo password", DEMO_USERS.size());
    }
}
