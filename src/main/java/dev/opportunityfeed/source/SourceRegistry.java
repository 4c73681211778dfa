package dev.opportunityfeed.source;

import dev.opportunityfeed.config.SourcesConfig;
import dev.opportunityfeed.source.impl.FeedFlavor;
import dev.opportunityfeed.source.impl.FeedSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * All known sources keyed by name: API sources registered as beans plus one
 * {@link FeedSource} per configured feed URL.
 */
@Slf4j
@Component
public class SourceRegistry {

    private static final Pattern SUBREDDIT = Pattern.compile("/r/([A-Za-z0-9_]+)");

    private final Map<String, OpportunitySource> sources = new LinkedHashMap<>();
    private final SourcesConfig sourcesConfig;

    public SourceRegistry(List<OpportunitySource> apiSources, SourceHttpClient http, SourcesConfig sourcesConfig) {
        this.sourcesConfig = sourcesConfig;

        for (SourcesConfig.Feed feed : sourcesConfig.getFeeds()) {
            if (feed.getUrl() == null || feed.getUrl().isBlank()) {
                log.warn("Feed '{}' has no URL, ignoring", feed.getName());
                continue;
            }
            String name = feed.getName() != null && !feed.getName().isBlank()
                    ? feed.getName()
                    : nameForFeedUrl(feed.getUrl());
            FeedFlavor flavor = FeedFlavor.fromValue(feed.getFlavor()).orElseGet(() -> {
                log.warn("Feed '{}' has unknown flavor '{}', using generic", name, feed.getFlavor());
                return FeedFlavor.GENERIC;
            });
            register(new FeedSource(name, feed.getUrl(), flavor, http, sourcesConfig));
        }

        for (String url : sourcesConfig.getExtraFeedUrls()) {
            if (url == null || url.isBlank()) {
                continue;
            }
            String name = nameForFeedUrl(url);
            FeedFlavor flavor = name.startsWith("reddit_") ? FeedFlavor.REDDIT : FeedFlavor.GENERIC;
            register(new FeedSource(name, url, flavor, http, sourcesConfig));
        }

        apiSources.forEach(this::register);
        log.info("Registered {} sources: {}", sources.size(), sources.keySet());
    }

    private void register(OpportunitySource source) {
        OpportunitySource previous = sources.putIfAbsent(source.getName(), source);
        if (previous != null) {
            log.warn("Duplicate source name '{}', keeping the first registration", source.getName());
        }
    }

    /**
     * Sources selected by {@code sources.enabled}; all of them when that list is empty.
     */
    public List<OpportunitySource> getEnabledSources() {
        List<OpportunitySource> enabled = new ArrayList<>();
        for (OpportunitySource source : sources.values()) {
            if (sourcesConfig.isEnabled(source.getName())) {
                enabled.add(source);
            }
        }
        return enabled;
    }

    public Optional<OpportunitySource> get(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    public Collection<OpportunitySource> getAll() {
        return List.copyOf(sources.values());
    }

    /**
     * "reddit_<subreddit>" for reddit URLs, otherwise "feed_<host>".
     */
    static String nameForFeedUrl(String url) {
        Matcher matcher = SUBREDDIT.matcher(url);
        if (url.contains("reddit.com") && matcher.find()) {
            return "reddit_" + matcher.group(1).toLowerCase(Locale.ROOT);
        }
        String host = url.replaceFirst("^[a-z]+://", "").replaceFirst("[/:?].*$", "");
        return "feed_" + host.replaceFirst("^www\\.", "").replaceAll("[^A-Za-z0-9]+", "_").toLowerCase(Locale.ROOT);
    }
}
