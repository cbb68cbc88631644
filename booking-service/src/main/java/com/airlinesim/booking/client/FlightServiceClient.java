package com.airlinesim.booking.client;

import com.airlinesim.booking.dto.FlightEntry;
import com.airlinesim.booking.exception.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.Optional;

@Component
@Slf4j
public class FlightServiceClient {

    private final RestTemplate restTemplate;
    private final String flightServiceUrl;

    public FlightServiceClient(RestTemplate restTemplate,
                               @Value("${flight-service.url:http://localhost:8081}") String flightServiceUrl) {
        this.restTemplate = restTemplate;
        this.flightServiceUrl = flightServiceUrl;
    }

    /**
     * Looks up one flight instance. Empty when the flight does not operate on that date.
     */
    public Optional<FlightEntry> getFlight(String flightNumber, LocalDate flightDate) {
        String url = flightServiceUrl + "/v1/flights/{flightNumber}?date={date}";
        log.info("Calling flight service: GET /v1/flights/{}?date={}", flightNumber, flightDate);

        try {
            ResponseEntity<FlightEntry> response = restTemplate.getForEntity(url, FlightEntry.class, flightNumber, flightDate);
            log.debug("Flight service response: status={}", response.getStatusCode());
            return Optional.ofNullable(response.getBody());
        } catch (HttpClientErrorException.NotFound e) {
            log.warn("Flight not found: number={}, date={}", flightNumber, flightDate);
            return Optional.empty();
        } catch (ResourceAccessException e) {
            log.error("Flight service unavailable: {}", e.getMessage());
            throw new ServiceUnavailableException("Flight service unavailable", e);
        } catch (RestClientException e) {
            log.error("Error calling flight service: type={}, message={}", e.getClass().getName(), e.getMessage());
            throw new ServiceUnavailableException("Error communicating with flight service", e);
        }
    }
}
