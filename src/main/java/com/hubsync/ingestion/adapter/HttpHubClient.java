package com.hubsync.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.hubsync.common.RetryPolicy;
import com.hubsync.domain.HubEvent;
import com.hubsync.domain.Message;
import com.hubsync.domain.UserNameProof;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link HubClient} over the Hub HTTP API. Each call waits for a local rate limiter permit and is bounded by the
 * configured timeout. Calls go round-robin over the configured Hub URLs; a failed call is retried on the next URL
 * after the retry policy's delay, up to its max attempts.
 * <p>
 * Feed events this client cannot parse (a username type or message type added to the Hub later) are skipped with a
 * warning. Their ids still count toward {@link HubEventPage#lastEventId()} so the subscriber moves past them.
 */
@Slf4j
public class HttpHubClient implements HubClient {

    private final HubHttpClient httpClient;
    private final List<String> endpoints;
    private final AtomicInteger nextEndpoint = new AtomicInteger(0);
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final HubJsonCodec codec;
    private final Duration timeout;

    public HttpHubClient(HubHttpClient httpClient, List<String> endpoints, RetryPolicy retryPolicy,
                         RateLimiter rateLimiter, HubJsonCodec codec, Duration timeout) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one Hub endpoint required");
        }
        this.httpClient = httpClient;
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
        this.codec = codec;
        this.timeout = timeout;
    }

    @Override
    public HubInfo getInfo() {
        JsonNode root = call("/v1/info", Map.of("dbstats", 1));
        JsonNode stats = root.path("dbStats");
        return new HubInfo(
                root.path("version").asText(null),
                root.path("isSyncing").asBoolean(false),
                stats.path("numMessages").asLong(0),
                stats.path("numFidEvents").asLong(0),
                stats.path("numFnameEvents").asLong(0));
    }

    @Override
    public HubEventPage getEvents(long fromEventId) {
        JsonNode root = call("/v1/events", Map.of("from_event_id", fromEventId));
        List<HubEvent> events = new ArrayList<>();
        long lastEventId = 0;
        for (JsonNode node : root.path("events")) {
            lastEventId = Math.max(lastEventId, node.path("id").asLong());
            parseFeedEvent(node).ifPresent(events::add);
        }
        return new HubEventPage(events, lastEventId, root.path("nextPageEventId").asLong(0));
    }

    @Override
    public MessagePage getMessagesByFid(HubMessageQuery query, long fid, String pageToken, int pageSize) {
        Map<String, Object> params = new HashMap<>(query.getExtraParams());
        params.put("fid", fid);
        params.put("pageSize", pageSize);
        if (pageToken != null) {
            params.put("pageToken", pageToken);
        }
        JsonNode root = call(query.getPath(), params);
        List<Message> messages = new ArrayList<>();
        for (JsonNode node : root.path("messages")) {
            messages.add(codec.parseMessage(node));
        }
        JsonNode next = root.get("nextPageToken");
        return new MessagePage(messages, next == null || next.isNull() ? null : next.asText());
    }

    @Override
    public List<UserNameProof> getUserNameProofsByFid(long fid) {
        JsonNode root = call("/v1/userNameProofsByFid", Map.of("fid", fid));
        List<UserNameProof> proofs = new ArrayList<>();
        for (JsonNode node : root.path("proofs")) {
            proofs.add(codec.parseUserNameProof(node));
        }
        return proofs;
    }

    private Optional<HubEvent> parseFeedEvent(JsonNode node) {
        try {
            return codec.parseEvent(node);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping hub event {} ({}): {}", node.path("id").asLong(), node.path("type").asText(), e.getMessage());
            return Optional.empty();
        }
    }

    private String nextEndpoint() {
        return endpoints.get(Math.floorMod(nextEndpoint.getAndIncrement(), endpoints.size()));
    }

    private JsonNode call(String path, Map<String, Object> params) {
        int maxAttempts = Math.max(1, retryPolicy.getMaxAttempts());
        RuntimeException lastException = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(retryPolicy.delayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new HubConnectionException("Interrupted during retry of " + path, e);
                }
            }
            String endpoint = nextEndpoint();
            try {
                return codec.readTree(callOnce(endpoint, path, params));
            } catch (HubConnectionException e) {
                lastException = e;
                log.warn("Hub call {} on {} failed (attempt {}/{}): {}",
                        path, endpoint, attempt + 1, maxAttempts, e.getMessage());
            }
        }
        throw new HubConnectionException("Hub call " + path + " failed after " + maxAttempts + " attempt(s)",
                lastException);
    }

    private String callOnce(String endpoint, String path, Map<String, Object> params) {
        if (!rateLimiter.acquirePermission()) {
            throw new HubConnectionException("Local limiter timeout before " + path + " on " + endpoint);
        }
        String body = httpClient.get(endpoint, path, params)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class,
                        e -> new HubConnectionException("Hub call " + path + " timed out after " + timeout.toMillis() + " ms", e))
                .onErrorMap(e -> !(e instanceof HubConnectionException),
                        e -> new HubConnectionException("Hub call " + path + " failed: " + e.getMessage(), e))
                .block();
        if (body == null) {
            throw new HubConnectionException("Empty response from " + path + " on " + endpoint);
        }
        return body;
    }
}
