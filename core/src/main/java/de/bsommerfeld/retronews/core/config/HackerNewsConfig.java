package de.bsommerfeld.retronews.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Endpoints and limits of the Hacker News client.
 */
public class HackerNewsConfig {

    /** Base URL of the site whose listings are scraped for story ids. */
    @JsonProperty("site-url")
    private String siteUrl = "https://news.ycombinator.com";

    /** Base URL of the Algolia search API. */
    @JsonProperty("api-url")
    private String apiUrl = "https://hn.algolia.com/api/v1";

    @JsonProperty("request-timeout-seconds")
    private long requestTimeoutSeconds = 10;

    @JsonProperty("page-size")
    private int pageSize = 30;

    public String getSiteUrl() {
        return siteUrl;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public long getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public int getPageSize() {
        return pageSize;
    }
}
