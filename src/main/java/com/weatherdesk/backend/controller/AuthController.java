package com.weatherdesk.backend.controller;

import com.weatherdesk.backend.dto.LoginRequest;
import com.weatherdesk.backend.service.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    public static final String SESSION_HEADER = "X-Session-ID";
    static final String INVALID_CREDENTIALS = "Invalid username or password";

    private final AuthService auth;

    /** Exchanges a username/password pair for a session token. */
    @PostMapping("/login")
    public Mono<ResponseEntity<Map<String, Object>>> login(@RequestBody(required = false) LoginRequest req) {
        if (req == null || isBlank(req.username()) || isBlank(req.password())) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(error("Username and password are required")));
        }
        return Mono.fromCallable(() -> auth.login(req.username(), req.password()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(session -> session
                        .map(s -> {
                            Map<String, Object> m = new LinkedHashMap<>();
                            m.put("status", "ok");
                            m.put("username", s.username());
                            m.put("userId", s.userId());
                            m.put("token", s.token());
                            m.put("expiresAt", s.expiresAt().toString());
                            return ResponseEntity.ok(m);
                        })
                        .orElseGet(() -> ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                                .body(error(INVALID_CREDENTIALS))));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@RequestHeader(value = SESSION_HEADER, required = false) String token) {
        auth.logout(token);
        return ResponseEntity.noContent().build();
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "error");
        m.put("message", message);
        return m;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
