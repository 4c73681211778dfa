package dev.opportunityfeed.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for opportunity sources: which are enabled, feed URLs and API credentials.
 * Loaded from application.yml under 'sources' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sources")
public class SourcesConfig {

    /**
     * Source names to run. Empty means every registered source.
     */
    private List<String> enabled = new ArrayList<>();

    private int fetchTimeoutSeconds = 30;
    private int descriptionMaxLength = 500;

    private List<Feed> feeds = new ArrayList<>();

    /**
     * Additional feed URLs; reddit URLs become "reddit_<subreddit>" sources.
     */
    private List<String> extraFeedUrls = new ArrayList<>();

    private Jooble jooble = new Jooble();
    private AuthenticJobs authenticJobs = new AuthenticJobs();
    private Meetup meetup = new Meetup();
    private GraphqlJobs graphqlJobs = new GraphqlJobs();

    public boolean isEnabled(String sourceName) {
        List<String> names = enabled.stream().filter(name -> name != null && !name.isBlank()).toList();
        return names.isEmpty() || names.stream().anyMatch(name -> name.trim().equalsIgnoreCase(sourceName));
    }

    @Data
    public static class Feed {
        private String name;
        private String url;
        private String flavor = "generic";
    }

    @Data
    public static class Jooble {
        private String apiKey = "";
        private String baseUrl = "https://jooble.org/api/";
        private String keywords = "internship OR job OR opportunity";
        private String location = "United States";
    }

    @Data
    public static class AuthenticJobs {
        private String apiKey = "";
        private String baseUrl = "https://authenticjobs.com/api/";
    }

    @Data
    public static class Meetup {
        private String apiKey = "";
        private String baseUrl = "https://api.meetup.com";
        private String text = "workshop OR conference OR tech OR career";
    }

    @Data
    public static class GraphqlJobs {
        private String url = "https://api.graphql.jobs";
    }
}
