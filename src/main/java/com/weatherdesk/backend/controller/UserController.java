package com.weatherdesk.backend.controller;

import com.weatherdesk.backend.dto.UserSummary;
import com.weatherdesk.backend.service.UserDirectoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class UserController {

    private final UserDirectoryService directory;

    @GetMapping("/users")
    public Mono<List<UserSummary>> users(@RequestParam(value = "username", required = false) String username,
                                         @RequestParam(value = "page", defaultValue = "1") int page,
                                         @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return Mono.fromCallable(() -> directory.search(username, page, limit))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
