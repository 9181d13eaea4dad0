package com.weatherdesk.backend.controller;

import com.weatherdesk.backend.dto.CityWeather;
import com.weatherdesk.backend.dto.WeatherReport;
import com.weatherdesk.backend.service.WeatherService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class WeatherController {

    private final WeatherService weatherService;

    @GetMapping("/weather")
    public Mono<Map<String, Object>> weather(@RequestParam(value = "city", required = false) String city) {
        if (city == null || city.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "City parameter is required");
        }
        return Mono.fromCallable(() -> weatherService.report(city))
                .subscribeOn(Schedulers.boundedElastic())
                .map(WeatherController::toBody);
    }

    private static Map<String, Object> toBody(WeatherReport report) {
        CityWeather w = report.weather();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("city", w.city());
        m.put("avgTemp", round2(w.avgTemp()));
        m.put("reqCount", w.reqCount());
        m.put("cached", w.cached());
        if (report.timezone() != null) {
            m.put("humidity", round2(report.humidity()));
            m.put("heatIndex", round2(report.heatIndex()));
            m.put("comfortScore", round2(report.comfortScore()));
            m.put("timezone", report.timezone());
        }
        return m;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
