package de.bsommerfeld.retronews.hn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.retronews.core.config.HackerNewsConfig;
import de.bsommerfeld.retronews.core.domain.Message;
import jakarta.inject.Inject;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fetches Hacker News stories and comment trees.
 *
 * <h3>Sources</h3>
 * <ul>
 * <li>Listing pages ({@code news}, {@code ask}, {@code show}) are scraped from
 * the site itself for their story ids, since the search API has no notion of
 * the front page ranking</li>
 * <li>Story headers and whole comment trees come from the Algolia search API
 * as JSON</li>
 * </ul>
 *
 * <h3>Data flow</h3>
 *
 * <pre>
 * fetchThreads(listing, page) → listing HTML → story ids
 *   └ fetchThreadsById(ids)   → search_by_date JSON → unloaded thread headers
 * fetchNewThreads(page)       → search_by_date JSON → unloaded thread headers
 * fetchThread(id)             → items/{id} JSON     → loaded message tree
 * </pre>
 *
 * Every message id carries the {@value #PROVIDER} suffix. Failures surface as
 * {@link HackerNewsException}; nothing is retried.
 *
 * @see TestHackerNewsClient
 */
@Singleton
public class HackerNewsClient {

    private static final Logger LOG = LoggerFactory.getLogger(HackerNewsClient.class);

    public static final String PROVIDER = "hn";
    static final String USER_AGENT = "retronews";

    private static final Pattern ITEM_LINK = Pattern.compile("href=\"item\\?id=(\\d+)\"");

    private final HackerNewsConfig config;
    private final HttpClient httpClient;

    /**
     * Single shared mapper instance. Jackson's {@link ObjectMapper} is
     * thread-safe for reading.
     */
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public HackerNewsClient(HackerNewsConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    HackerNewsClient(HackerNewsConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    // =====================================================================
    // Listings
    // =====================================================================

    /**
     * Loads the stories of a site listing page.
     *
     * @param listing listing path, e.g. {@code news}, {@code ask} or {@code show}
     * @param page    1-based page number
     * @return thread headers in the order the search API returns them
     */
    public List<Message> fetchThreads(String listing, int page) {
        String html = get(config.getSiteUrl() + "/" + listing + "?p=" + page);
        List<String> ids = extractStoryIds(html);
        LOG.debug("Listing '{}' page {} links {} stories", listing, page, ids.size());
        return fetchThreadsById(ids);
    }

    /** Loads one page of the newest stories. */
    public List<Message> fetchNewThreads(int page) {
        String url = config.getApiUrl() + "/search_by_date?tags=story&hitsPerPage=" + config.getPageSize()
                + "&page=" + page;
        return parseSearchHits(get(url));
    }

    /**
     * Loads the headers of specific stories.
     *
     * @param sourceIds numeric story ids without provider suffix
     * @return headers of the stories the API knows, newest first; empty
     *         without a request if no ids are given
     */
    public List<Message> fetchThreadsById(List<String> sourceIds) {
        if (sourceIds.isEmpty())
            return new ArrayList<>();

        String storyTags = sourceIds.stream().map(id -> "story_" + id).collect(Collectors.joining(","));
        String url = config.getApiUrl() + "/search_by_date?hitsPerPage=" + sourceIds.size()
                + "&tags=story,(" + storyTags + ")";
        return parseSearchHits(get(url));
    }

    /**
     * Loads a story together with its entire comment tree.
     *
     * @param sourceId numeric story id without provider suffix
     */
    public Message fetchThread(String sourceId) {
        String json = get(config.getApiUrl() + "/items/" + sourceId);
        try {
            return parseItem(mapper.readTree(json), "", "");
        } catch (JsonProcessingException e) {
            throw new HackerNewsException("Malformed item " + sourceId, e);
        }
    }

    // =====================================================================
    // Parsing
    // =====================================================================

    /** Distinct story ids linked from a listing page, in order of appearance. */
    static List<String> extractStoryIds(String html) {
        Set<String> ids = new LinkedHashSet<>();
        Matcher matcher = ITEM_LINK.matcher(html);
        while (matcher.find()) {
            ids.add(matcher.group(1));
        }
        return new ArrayList<>(ids);
    }

    private List<Message> parseSearchHits(String json) {
        try {
            List<Message> threads = new ArrayList<>();
            for (JsonNode hit : mapper.readTree(json).path("hits")) {
                threads.add(parseSearchHit(hit));
            }
            return threads;
        } catch (JsonProcessingException e) {
            throw new HackerNewsException("Malformed search response", e);
        }
    }

    /**
     * Maps a search hit to an unloaded thread header. The comment total counts
     * the story itself, so it matches the number of messages in the opened
     * thread.
     */
    Message parseSearchHit(JsonNode hit) {
        String id = hit.path("objectID").asText();
        Message thread = new Message(id + "@" + PROVIDER, id + "@" + PROVIDER, itemUrl(id),
                Instant.ofEpochSecond(hit.path("created_at_i").asLong()),
                hit.path("author").asText("unknown"),
                Parser.unescapeEntities(hit.path("title").asText(""), false));
        thread.setTotalComments(hit.path("num_comments").asInt(0) + 1);
        return thread;
    }

    /**
     * Maps an item and its descendants to a loaded message tree.
     *
     * <p>
     * The body of a story with a link starts with that link as its own
     * paragraph. Comments carry no title of their own and are titled
     * {@code Re: <story title>}.
     *
     * @param threadId    source id of the story, empty when {@code item} is
     *                    the story itself
     * @param parentTitle title inherited from the nearest titled ancestor
     */
    Message parseItem(JsonNode item, String threadId, String parentTitle) {
        String id = item.path("id").asText();
        String rootId = threadId.isEmpty() ? id : threadId;

        String ownTitle = textOrNull(item, "title");
        if (ownTitle != null)
            ownTitle = Parser.unescapeEntities(ownTitle, false);

        String url = textOrNull(item, "url");
        String text = textOrNull(item, "text");
        String body = (url != null ? "<p>" + url + "</p>" : "") + (text != null ? text : "");

        String author = textOrNull(item, "author");
        Message message = new Message(id + "@" + PROVIDER, rootId + "@" + PROVIDER, itemUrl(id),
                Instant.ofEpochSecond(item.path("created_at_i").asLong()),
                author != null ? author : "unknown",
                ownTitle != null ? ownTitle : "Re: " + parentTitle);
        message.setBody(body);

        String childTitle = ownTitle != null ? ownTitle : parentTitle;
        for (JsonNode child : item.path("children")) {
            message.getChildren().add(parseItem(child, rootId, childTitle));
        }
        return message;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull())
            return null;
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    private String itemUrl(String id) {
        return config.getSiteUrl() + "/item?id=" + id;
    }

    // =====================================================================
    // HTTP
    // =====================================================================

    private String get(String url) {
        LOG.debug("GET {}", url);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200)
                throw new HackerNewsException("HTTP " + response.statusCode() + " for " + url);
            return response.body();
        } catch (IOException e) {
            throw new HackerNewsException("Request failed: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HackerNewsException("Interrupted while fetching " + url, e);
        }
    }
}
