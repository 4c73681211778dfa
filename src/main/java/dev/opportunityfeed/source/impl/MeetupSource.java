package dev.opportunityfeed.source.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.opportunityfeed.config.SourcesConfig;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.normalize.OpportunityNormalizer;
import dev.opportunityfeed.source.SourceHttpClient;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Arrays;
import java.util.List;

/**
 * Upcoming Meetup events. The group is the organizer, the event date the deadline.
 */
@Slf4j
@Component
public class MeetupSource extends AbstractOpportunitySource<MeetupSource.MeetupEvent> {

    public static final String NAME = "meetup";

    public MeetupSource(SourceHttpClient http, SourcesConfig sourcesConfig) {
        super(http, sourcesConfig);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        String apiKey = sourcesConfig.getMeetup().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    protected URI getApiUrl() {
        SourcesConfig.Meetup meetup = sourcesConfig.getMeetup();
        return UriComponentsBuilder.fromUriString(meetup.getBaseUrl())
                .path("/find/events")
                .queryParam("key", meetup.getApiKey())
                .queryParam("text", meetup.getText())
                .queryParam("radius", "global")
                .queryParam("order", "time")
                .queryParam("status", "upcoming")
                .queryParam("page", 100)
                .encode()
                .build()
                .toUri();
    }

    @Override
    protected Mono<List<MeetupEvent>> fetchItems() {
        return http.get(NAME, getApiUrl(), MeetupEvent[].class)
                .map(events -> Arrays.asList(events));
    }

    @Override
    protected CandidateOpportunity toCandidate(MeetupEvent event) {
        String group = event.getGroup() != null ? event.getGroup().getName() : null;

        return CandidateOpportunity.builder()
                .title(event.getName())
                .company(OpportunityNormalizer.firstNonBlank(group, "Unknown Group"))
                .location(location(event.getVenue()))
                .description(event.getDescription())
                .deadline(OpportunityNormalizer.parseDate(event.getLocalDate()).orElse(null))
                .applicationUrl(event.getLink())
                .sourceId(event.getId())
                .sourceUrl(event.getLink())
                .build();
    }

    private static String location(MeetupVenue venue) {
        if (venue == null || venue.getCity() == null || venue.getCity().isBlank()) {
            return OpportunityNormalizer.DEFAULT_LOCATION;
        }
        if (venue.getState() == null || venue.getState().isBlank()) {
            return venue.getCity().trim();
        }
        return venue.getCity().trim() + ", " + venue.getState().trim();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class MeetupEvent {
        private String id;
        private String name;
        private String description;
        private String link;
        @JsonProperty("local_date")
        private String localDate;
        private MeetupGroup group;
        private MeetupVenue venue;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class MeetupGroup {
        private String name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class MeetupVenue {
        private String city;
        private String state;
    }
}
