package com.weatherdesk.backend.dto;

/** Public view of a directory entry. */
public record UserSummary(long id, String username, String email) {
}
