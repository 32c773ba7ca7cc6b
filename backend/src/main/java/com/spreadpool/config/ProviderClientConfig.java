package com.spreadpool.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadpool.provider.EspnScoreboardClient;
import com.spreadpool.provider.EspnSummaryClient;
import com.spreadpool.provider.GameSummaryClient;
import com.spreadpool.provider.GameSummaryParser;
import com.spreadpool.provider.ProviderRetry;
import com.spreadpool.provider.ScoreboardClient;
import com.spreadpool.provider.ScoreboardPayloadParser;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ProviderClientConfig {

    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder, PoolSettings settings) {
        return builder
                .setConnectTimeout(settings.getProviderTimeout())
                .setReadTimeout(settings.getProviderTimeout())
                .build();
    }

    @Bean
    public ScoreboardClient scoreboardClient(RestTemplate providerRestTemplate,
                                             ObjectMapper objectMapper,
                                             ScoreboardPayloadParser parser,
                                             PoolSettings settings) {
        return new EspnScoreboardClient(providerRestTemplate, objectMapper,
                ProviderRetry.template(settings), parser, settings);
    }

    @Bean
    public GameSummaryClient gameSummaryClient(RestTemplate providerRestTemplate,
                                               ObjectMapper objectMapper,
                                               GameSummaryParser parser,
                                               PoolSettings settings) {
        return new EspnSummaryClient(providerRestTemplate, objectMapper,
                ProviderRetry.template(settings), parser, settings);
    }
}
