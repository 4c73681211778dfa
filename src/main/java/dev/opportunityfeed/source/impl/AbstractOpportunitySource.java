package dev.opportunityfeed.source.impl;

import dev.opportunityfeed.config.SourcesConfig;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.model.SourceFetchResult;
import dev.opportunityfeed.normalize.OpportunityNormalizer;
import dev.opportunityfeed.source.OpportunitySource;
import dev.opportunityfeed.source.SourceHttpClient;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetch boundary shared by all sources. Subclasses retrieve raw items and map each one;
 * this class drops untitled items, counts per-item failures, shapes descriptions and
 * turns any transport failure into an error count.
 *
 * @param <R> raw item type of the source
 */
@Slf4j
public abstract class AbstractOpportunitySource<R> implements OpportunitySource {

    protected final SourceHttpClient http;
    protected final SourcesConfig sourcesConfig;

    protected AbstractOpportunitySource(SourceHttpClient http, SourcesConfig sourcesConfig) {
        this.http = http;
        this.sourcesConfig = sourcesConfig;
    }

    /**
     * Retrieve raw items from the source.
     */
    protected abstract Mono<List<R>> fetchItems();

    /**
     * Map one raw item. Returning null, or a candidate without title, discards the item.
     */
    protected abstract CandidateOpportunity toCandidate(R item);

    @Override
    public Mono<SourceFetchResult> fetch() {
        if (!isEnabled()) {
            log.info("{} is not configured, skipping", getName());
            return Mono.just(SourceFetchResult.empty(getName()));
        }
        log.info("Fetching opportunities from {}", getName());

        return Mono.defer(this::fetchItems)
                .defaultIfEmpty(List.of())
                .map(this::mapItems)
                .onErrorResume(e -> {
                    log.warn("{} fetch failed: {}", getName(), e.getMessage());
                    return Mono.just(SourceFetchResult.failed(getName(), 1, describe(e)));
                });
    }

    private SourceFetchResult mapItems(List<R> items) {
        List<CandidateOpportunity> candidates = new ArrayList<>();
        int errors = 0;
        String firstError = null;

        for (R item : items) {
            try {
                CandidateOpportunity candidate = toCandidate(item);
                if (candidate == null || !candidate.hasTitle()) {
                    continue;
                }
                candidates.add(finish(candidate));
            } catch (RuntimeException e) {
                errors++;
                if (firstError == null) {
                    firstError = "Unparseable item: " + describe(e);
                }
                log.warn("{} - skipping unparseable item: {}", getName(), e.getMessage());
            }
        }

        log.info("{} returned {} candidates ({} unparseable)", getName(), candidates.size(), errors);
        return new SourceFetchResult(getName(), candidates, errors, firstError);
    }

    /**
     * Common shaping: HTML-free description capped to the configured budget, type and
     * category filled in from keywords where the source did not set them.
     */
    protected CandidateOpportunity finish(CandidateOpportunity candidate) {
        String title = candidate.getTitle().trim();
        String description = OpportunityNormalizer.stripHtml(candidate.getDescription());
        if (description.isBlank()) {
            description = title;
        }

        CandidateOpportunity.CandidateOpportunityBuilder builder = candidate.toBuilder()
                .title(title)
                .source(getName())
                .description(OpportunityNormalizer.truncate(description, sourcesConfig.getDescriptionMaxLength()));

        if (candidate.getType() == null) {
            builder.type(OpportunityNormalizer.classifyType(title, description, getName()));
        }
        if (candidate.getCategory() == null || candidate.getCategory().isBlank()) {
            builder.category(OpportunityNormalizer.categorize(title, description));
        }
        if (candidate.getCompany() == null || candidate.getCompany().isBlank()) {
            builder.company(OpportunityNormalizer.UNKNOWN_COMPANY);
        }
        if (candidate.getLocation() == null || candidate.getLocation().isBlank()) {
            builder.location(OpportunityNormalizer.DEFAULT_LOCATION);
        }
        if (candidate.getSourceUrl() == null) {
            builder.sourceUrl(candidate.getApplicationUrl());
        }
        return builder.build();
    }

    protected static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
