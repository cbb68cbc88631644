package com.airlinesim.flight.controller.v1;

import com.airlinesim.flight.dto.WeatherInfo;
import com.airlinesim.flight.service.WeatherService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/weather")
public class WeatherController {

    private final WeatherService weatherService;

    @GetMapping("/{airportCode}")
    public ResponseEntity<WeatherInfo> getWeather(@PathVariable String airportCode) {
        log.debug("GET /v1/weather/{}", airportCode);
        return ResponseEntity.ok(weatherService.getWeather(airportCode));
    }
}
