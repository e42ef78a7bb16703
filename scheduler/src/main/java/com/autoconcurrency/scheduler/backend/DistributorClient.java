package com.autoconcurrency.scheduler.backend;

import com.autoconcurrency.scheduler.backend.dto.DistributorItem;
import com.autoconcurrency.scheduler.backend.dto.DistributorOutcome;
import com.autoconcurrency.scheduler.backend.dto.DistributorRunRequest;
import com.autoconcurrency.scheduler.backend.dto.DistributorRunResponse;
import com.autoconcurrency.scheduler.executor.ResultAggregator;
import com.autoconcurrency.scheduler.model.ItemStatus;
import com.autoconcurrency.scheduler.model.Outcome;
import com.autoconcurrency.scheduler.model.RunReport;
import com.autoconcurrency.scheduler.model.Strategy;
import com.autoconcurrency.scheduler.model.WorkItem;
import com.autoconcurrency.scheduler.translate.DistributorParameters;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP client for the isolated-process distributor.
 *
 * GET  /health: availability check before a run is handed over
 * POST /runs  : run items with {workers, distribution_mode}; blocks until done
 *
 * Uses java.net.http.HttpClient with Jackson for the bodies. The distributor's
 * outcomes are put back into submission order and checked so that every
 * submitted item is accounted for exactly once.
 */
@Component
public class DistributorClient implements IsolatedProcessBackend {

    private static final Logger log = LoggerFactory.getLogger(DistributorClient.class);

    static final String NAME = "distributor";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     runTimeout;

    public DistributorClient(
            @Value("${autoconcurrency.distributor.base-url:}") String baseUrl,
            @Value("${autoconcurrency.distributor.timeout-sec:600}") int timeoutSec,
            ObjectMapper objectMapper) {
        this.baseUrl    = baseUrl == null ? "": baseUrl.strip();
        this.runTimeout = Duration.ofSeconds(timeoutSec);
        this.json       = objectMapper;
        this.http       = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RunReport run(List<WorkItem> items, DistributorParameters params) {
        if (baseUrl.isEmpty()) {
            throw new BackendUnavailableException(NAME,
                    "autoconcurrency.distributor.base-url is not configured");
        }
        if (items.isEmpty()) {
            return RunReport.empty(Strategy.ISOLATED_PROCESS);
        }
        checkHealth();

        log.info("Handing {} items to {} with {} workers (dist={})",
                items.size(), NAME, params.workers(), params.distributionMode().optionValue());

        List<DistributorItem> wireItems = items.stream()
                .map(i -> new DistributorItem(i.id(), i.groupKey()))
                .toList();
        String body = toJson(new DistributorRunRequest(
                params.workers(), params.distributionMode().optionValue(), wireItems));

        String respBody = send(HttpRequest.newBuilder()
                .uri(uri("/runs"))
                .timeout(runTimeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build(), "run");

        DistributorRunResponse response;
        try {
            response = json.readValue(respBody, DistributorRunResponse.class);
        } catch (JsonProcessingException e) {
            throw new DistributorException("Failed to parse distributor run response", e);
        }
        return toReport(items, response);
    }

    // ------------------------------------------------------------------
    // Report assembly
    // ------------------------------------------------------------------

    /**
     * Place the distributor's outcomes into submission order.
     *
     * @throws DistributorException on unknown, duplicated or missing item ids
     */
    static RunReport toReport(List<WorkItem> items, DistributorRunResponse response) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < items.size(); i++) {
            if (positions.put(items.get(i).id(), i) != null) {
                throw new DistributorException(
                        "Duplicate item id '" + items.get(i).id() + "' cannot be tracked across processes");
            }
        }

        List<DistributorOutcome> reported = response.outcomes() == null ? List.of(): response.outcomes();
        ResultAggregator results = new ResultAggregator(items);
        for (DistributorOutcome o: reported) {
            Integer position = positions.get(o.item_id());
            if (position == null) {
                throw new DistributorException("Distributor reported unknown item '" + o.item_id() + "'");
            }
            try {
                results.record(position, new Outcome(o.item_id(), parseStatus(o), o.detail()));
            } catch (IllegalStateException e) {
                throw new DistributorException(e.getMessage(), e);
            }
        }
        if (results.completed() != items.size()) {
            throw new DistributorException("Distributor reported " + results.completed()
                    + " outcomes for " + items.size() + " submitted items");
        }
        return results.toReport(Strategy.ISOLATED_PROCESS, false);
    }

    private static ItemStatus parseStatus(DistributorOutcome o) {
        String status = o.status() == null ? "": o.status().trim().toUpperCase(Locale.ROOT);
        return switch (status) {
            case "PASSED"           -> ItemStatus.PASSED;
            case "FAILED"           -> ItemStatus.FAILED;
            case "ERROR", "ERRORED" -> ItemStatus.ERRORED;
            default -> throw new DistributorException(
                    "Unknown status '" + o.status() + "' for item '" + o.item_id() + "'");
        };
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void checkHealth() {
        send(HttpRequest.newBuilder()
                .uri(uri("/health"))
                .timeout(Duration.ofSeconds(10))
                .header("Accept", "application/json")
                .GET()
                .build(), "health check");
    }

    /** Sends the request; connection failures become BackendUnavailableException. */
    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() == 503) {
                throw new BackendUnavailableException(NAME, opName + " returned HTTP 503");
            }
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new DistributorException(
                        opName + " failed with HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (ConnectException | HttpConnectTimeoutException e) {
            throw new BackendUnavailableException(NAME, "cannot connect to " + baseUrl, e);
        } catch (IOException e) {
            throw new DistributorException(opName + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DistributorException(opName + " interrupted", e);
        }
    }

    private URI uri(String path) {
        try {
            return URI.create(baseUrl + path);
        } catch (IllegalArgumentException e) {
            throw new BackendUnavailableException(NAME, "invalid base URL " + baseUrl, e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new DistributorException("JSON serialization failed", e);
        }
    }
}
