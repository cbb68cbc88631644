package com.airlinesim.flight.service.weather;

import com.airlinesim.flight.dto.WeatherInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Generates plausible weather for a fixed set of airports. Disabled via {@code weather.enabled=false}
 * to exercise the unavailable path.
 */
@Component
@Slf4j
public class SimulatedWeatherProvider implements WeatherProvider {

    private static final Map<String, String> AIRPORT_CITIES = Map.ofEntries(
            Map.entry("ATL", "Atlanta"), Map.entry("BOS", "Boston"), Map.entry("DEN", "Denver"),
            Map.entry("DFW", "Dallas"), Map.entry("JFK", "New York"), Map.entry("LAX", "Los Angeles"),
            Map.entry("LAS", "Las Vegas"), Map.entry("MIA", "Miami"), Map.entry("ORD", "Chicago"),
            Map.entry("SEA", "Seattle"), Map.entry("SFO", "San Francisco"), Map.entry("LHR", "London"));

    private static final List<String[]> CONDITIONS = List.of(
            new String[]{"Clear", "clear sky"},
            new String[]{"Clouds", "scattered clouds"},
            new String[]{"Rain", "light rain"},
            new String[]{"Fog", "patchy fog"},
            new String[]{"Snow", "light snow"});

    private static final String[] WIND_DIRECTIONS = {"N", "NE", "E", "SE", "S", "SW", "W", "NW"};

    private final Random random;
    private final Clock clock;
    private final boolean enabled;

    public SimulatedWeatherProvider(Random weatherRandom,
                                    Clock clock,
                                    @Value("${weather.enabled:true}") boolean enabled) {
        this.random = weatherRandom;
        this.clock = clock;
        this.enabled = enabled;
    }

    @Override
    public Optional<WeatherInfo> currentWeather(String airportCode) {
        if (!enabled) {
            throw new WeatherProviderException("Weather provider disabled");
        }

        String city = AIRPORT_CITIES.get(airportCode);
        if (city == null) {
            log.warn("Airport code {} not found in city mapping", airportCode);
            return Optional.empty();
        }

        String[] condition = CONDITIONS.get(random.nextInt(CONDITIONS.size()));
        return Optional.of(WeatherInfo.builder()
                .airportCode(airportCode)
                .location(city)
                .temperatureCelsius(Math.round((random.nextDouble() * 40 - 5) * 10) / 10.0)
                .conditions(condition[0])
                .description(condition[1])
                .humidity(30 + random.nextInt(65))
                .pressureHpa(990 + random.nextInt(40))
                .visibilityKm("Fog".equals(condition[0]) ? 0.5 + random.nextInt(3) : 10.0)
                .windSpeedMps(Math.round(random.nextDouble() * 150) / 10.0)
                .windDirection(WIND_DIRECTIONS[random.nextInt(WIND_DIRECTIONS.length)])
                .observedAt(LocalDateTime.now(clock))
                .build());
    }
}
