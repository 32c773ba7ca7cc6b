package com.spreadpool.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadpool.config.PoolSettings;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

public class EspnSummaryClient implements GameSummaryClient {

    private final ProviderHttp http;
    private final GameSummaryParser parser;
    private final PoolSettings settings;

    public EspnSummaryClient(RestTemplate restTemplate,
                             ObjectMapper objectMapper,
                             RetryTemplate retryTemplate,
                             GameSummaryParser parser,
                             PoolSettings settings) {
        this.http = new ProviderHttp(restTemplate, objectMapper, retryTemplate, settings);
        this.parser = parser;
        this.settings = settings;
    }

    @Override
    public GameSummary fetchSummary(String eventId) {
        if (eventId == null || eventId.isBlank()) throw new IllegalArgumentException("event id is required");
        String url = UriComponentsBuilder.fromHttpUrl(settings.getProviderSummaryUrl())
                .queryParam("event", eventId.trim())
                .toUriString();
        return parser.parse(eventId.trim(), http.getJson(url, "summary " + eventId));
    }
}
