package com.example.fuel.service;

import com.example.fuel.model.CityState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GoogleGeocodingClientTest {

    private static final String URL = "https://maps.example.test/geocode/json";

    private MockRestServiceServer server;
    private GoogleGeocodingClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new GoogleGeocodingClient(restTemplate, new ObjectMapper());
        ReflectionTestUtils.setField(client, "googleApiKey", "test-key");
        ReflectionTestUtils.setField(client, "geocodeApiUrl", URL);
    }

    @Test
    void testReverse() {
        String body = "{\"status\":\"OK\",\"results\":[{\"address_components\":["
                + "{\"long_name\":\"Amarillo\",\"short_name\":\"Amarillo\",\"types\":[\"locality\",\"political\"]},"
                + "{\"long_name\":\"Potter County\",\"short_name\":\"Potter County\",\"types\":[\"administrative_area_level_2\"]},"
                + "{\"long_name\":\"Texas\",\"short_name\":\"TX\",\"types\":[\"administrative_area_level_1\",\"political\"]}"
                + "]}]}";
        server.expect(requestTo(startsWith(URL)))
                .andExpect(queryParam("latlng", "35.222,-101.8313"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        Optional<CityState> result = client.reverse(35.222, -101.8313);

        assertEquals(Optional.of(CityState.of("amarillo", "TX")), result);
        server.verify();
    }

    @Test
    void testReverse_noLocality() {
        String body = "{\"status\":\"OK\",\"results\":[{\"address_components\":["
                + "{\"long_name\":\"Texas\",\"short_name\":\"TX\",\"types\":[\"administrative_area_level_1\"]}]}]}";
        server.expect(requestTo(startsWith(URL))).andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        assertTrue(client.reverse(33.0, -101.0).isEmpty());
    }

    @Test
    void testReverse_apiError() {
        server.expect(requestTo(startsWith(URL)))
                .andRespond(withSuccess("{\"status\":\"REQUEST_DENIED\",\"error_message\":\"bad key\"}", MediaType.APPLICATION_JSON));

        assertTrue(client.reverse(33.0, -101.0).isEmpty());
    }

    @Test
    void testReverse_transportErrorPropagates() {
        server.expect(requestTo(startsWith(URL))).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThrows(RestClientException.class, () -> client.reverse(33.0, -101.0));
    }
}
