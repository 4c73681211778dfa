package dev.opportunityfeed.source.impl;

import dev.opportunityfeed.config.SourcesConfig;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.normalize.OpportunityNormalizer;
import dev.opportunityfeed.source.SourceHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * RSS 2.0 / Atom feed source. Not a bean: one instance per configured feed, built by
 * {@link dev.opportunityfeed.source.SourceRegistry}.
 */
@Slf4j
public class FeedSource extends AbstractOpportunitySource<Element> {

    private final String name;
    private final String feedUrl;
    private final FeedFlavor flavor;

    public FeedSource(String name, String feedUrl, FeedFlavor flavor,
                      SourceHttpClient http, SourcesConfig sourcesConfig) {
        super(http, sourcesConfig);
        this.name = name;
        this.feedUrl = feedUrl;
        this.flavor = flavor;
    }

    @Override
    public String getName() {
        return name;
    }

    public FeedFlavor getFlavor() {
        return flavor;
    }

    @Override
    protected Mono<List<Element>> fetchItems() {
        return http.get(name, URI.create(feedUrl), String.class)
                .map(this::parseEntries);
    }

    List<Element> parseEntries(String xmlPayload) {
        Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
        List<Element> entries = xml.select("item, entry");
        if (entries.isEmpty() && xml.selectFirst("rss, feed, rdf|RDF") == null) {
            log.warn("{} - payload from {} is not a feed", name, feedUrl);
        }
        return entries;
    }

    @Override
    protected CandidateOpportunity toCandidate(Element entry) {
        String title = text(entry, "title");
        if (title == null) {
            return null;
        }
        String description = OpportunityNormalizer.stripHtml(
                OpportunityNormalizer.firstNonBlank(
                        text(entry, "summary"), text(entry, "description"), text(entry, "content"),
                        text(entry, "content|encoded")));
        String link = link(entry);

        String location = OpportunityNormalizer.firstNonBlank(text(entry, "location"));
        if (location == null) {
            location = OpportunityNormalizer.locationFromText(description)
                    .orElse(OpportunityNormalizer.DEFAULT_LOCATION);
        }

        String sourceId = OpportunityNormalizer.firstNonBlank(text(entry, "guid"), text(entry, "id"));
        if (sourceId == null || sourceId.equals(link)) {
            sourceId = OpportunityNormalizer.sourceIdFrom(link, title);
        }

        return CandidateOpportunity.builder()
                .title(title)
                .company(flavor.company(author(entry), title))
                .location(location)
                .type(flavor.type(title, description, name))
                .description(description)
                .applicationUrl(link)
                .sourceId(sourceId)
                .sourceUrl(link)
                .build();
    }

    private String author(Element entry) {
        return OpportunityNormalizer.firstNonBlank(
                text(entry, "author > name"),
                text(entry, "author"),
                text(entry, "dc|creator"),
                text(entry, "company"),
                text(entry, "dc|publisher"),
                text(entry, "publisher"));
    }

    private String link(Element entry) {
        Element link = entry.selectFirst("link[rel=alternate], link[href]");
        if (link != null && !link.attr("href").isBlank()) {
            return link.attr("href").trim();
        }
        return text(entry, "link");
    }

    private static String text(Element entry, String selector) {
        Element element = entry.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String value = element.text().trim();
        return value.isEmpty() ? null : value;
    }
}
