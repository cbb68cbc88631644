package com.airlinesim.flight.service.weather;

import com.airlinesim.flight.dto.WeatherInfo;

import java.util.Optional;

/**
 * Source of current airport weather. Empty means the airport is unknown to the provider;
 * provider outages are signalled by {@link WeatherProviderException}.
 */
public interface WeatherProvider {

    Optional<WeatherInfo> currentWeather(String airportCode);

    class WeatherProviderException extends RuntimeException {
        public WeatherProviderException(String message) {
            super(message);
        }
    }
}
