package com.weatherdesk.backend.dto;

public record LoginRequest(String username, String password) {
}
