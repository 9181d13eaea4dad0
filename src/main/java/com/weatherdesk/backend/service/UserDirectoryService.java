package com.weatherdesk.backend.service;

import com.weatherdesk.backend.config.BackendSettings;
import com.weatherdesk.backend.dto.UserSummary;
import com.weatherdesk.backend.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** Paginated username-prefix search over the users table. */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserDirectoryService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private final ConnectionPool pool;
    private final BackendSettings settings;

    public List<UserSummary> search(String prefix, int page, int limit) {
        int p = Math.max(page, 1);
        int lim = Math.min(Math.max(limit, 1), MAX_LIMIT);
        long offset = (long) (p - 1) * lim;
        boolean filtered = prefix != null && !prefix.isBlank();

        final String sql = filtered
                ? "SELECT id, username, email FROM users WHERE username LIKE ? ESCAPE '\\' ORDER BY id LIMIT ? OFFSET ?"
                : "SELECT id, username, email FROM users ORDER BY id LIMIT ? OFFSET ?";
        try {
            return pool.withConnection(settings.acquireTimeout(), conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    int i = 1;
                    if (filtered) {
                        ps.setString(i++, escapeLike(prefix.trim()) + "%");
                    }
                    ps.setInt(i++, lim);
                    ps.setLong(i, offset);
                    List<UserSummary> out = new ArrayList<>();
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            out.add(new UserSummary(rs.getLong("id"), rs.getString("username"), rs.getString("email")));
                        }
                    }
                    return out;
                }
            });
        } catch (SQLException e) {
            log.error("User search failed", e);
            throw new StoreUnavailableException("Database operation failed", e);
        }
    }

    static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
