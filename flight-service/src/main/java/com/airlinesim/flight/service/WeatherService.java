package com.airlinesim.flight.service;

import com.airlinesim.flight.dto.WeatherInfo;
import com.airlinesim.flight.exception.FlightOperationException;
import com.airlinesim.flight.service.weather.WeatherProvider;
import com.airlinesim.flight.util.StringUtils;
import com.airlinesim.flight.validator.FlightValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class WeatherService {

    private final WeatherProvider weatherProvider;

    public WeatherInfo getWeather(String airportCode) {
        FlightValidator.validateAirportCode(airportCode);
        String code = StringUtils.normalizeCode(airportCode);

        try {
            return weatherProvider.currentWeather(code)
                    .orElseThrow(() -> FlightOperationException.airportNotFound(code));
        } catch (WeatherProvider.WeatherProviderException e) {
            log.error("Weather provider failed for {}: {}", code, e.getMessage());
            throw FlightOperationException.weatherUnavailable(code, e);
        }
    }
}
