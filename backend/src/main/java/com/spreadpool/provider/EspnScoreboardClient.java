package com.spreadpool.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadpool.config.PoolSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.*;
import java.util.stream.Collectors;

public class EspnScoreboardClient implements ScoreboardClient {
    private static final Logger log = LoggerFactory.getLogger(EspnScoreboardClient.class);

    private final ProviderHttp http;
    private final ScoreboardPayloadParser parser;
    private final PoolSettings settings;

    public EspnScoreboardClient(RestTemplate restTemplate,
                                ObjectMapper objectMapper,
                                RetryTemplate retryTemplate,
                                ScoreboardPayloadParser parser,
                                PoolSettings settings) {
        this.http = new ProviderHttp(restTemplate, objectMapper, retryTemplate, settings);
        this.parser = parser;
        this.settings = settings;
    }

    @Override
    public List<ScheduleRecord> fetchSchedule(WeekSelector week) {
        List<ScoreboardEvent> events = fetchEvents(week);
        List<ScheduleRecord> out = new ArrayList<>(events.size());
        for (ScoreboardEvent ev : events) {
            ScheduleRecord rec = parser.toSchedule(ev);
            if (rec.unresolvedTeam()) {
                log.warn("Unresolved team in {} event {}: {} @ {}", week, rec.externalId(), rec.awayTeam(), rec.homeTeam());
            }
            out.add(rec);
        }
        return out;
    }

    @Override
    public List<ScoreRecord> fetchScores(WeekSelector week, Collection<String> externalIds) {
        Set<String> wanted = new HashSet<>(externalIds);
        return fetchEvents(week).stream()
                .filter(ev -> wanted.contains(ev.id()))
                .map(parser::toScore)
                .collect(Collectors.toList());
    }

    @Override
    public List<OddsRecord> fetchOdds(WeekSelector week) {
        List<OddsRecord> out = new ArrayList<>();
        for (ScoreboardEvent ev : fetchEvents(week)) {
            parser.toOdds(ev).ifPresent(out::add);
        }
        return out;
    }

    private List<ScoreboardEvent> fetchEvents(WeekSelector week) {
        String url = UriComponentsBuilder.fromHttpUrl(settings.getProviderBaseUrl())
                .queryParam("seasontype", week.providerSeasonType())
                .queryParam("week", week.providerWeek())
                .queryParam("dates", week.seasonYear())
                .toUriString();
        JsonNode root = http.getJson(url, week.toString());
        return parser.parseEvents(root);
    }
}
