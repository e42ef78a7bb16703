package com.autoconcurrency.scheduler.backend;

import com.autoconcurrency.scheduler.backend.dto.DistributorOutcome;
import com.autoconcurrency.scheduler.backend.dto.DistributorRunResponse;
import com.autoconcurrency.scheduler.model.ItemStatus;
import com.autoconcurrency.scheduler.model.Outcome;
import com.autoconcurrency.scheduler.model.RunReport;
import com.autoconcurrency.scheduler.model.Strategy;
import com.autoconcurrency.scheduler.model.WorkItem;
import com.autoconcurrency.scheduler.translate.DistributionMode;
import com.autoconcurrency.scheduler.translate.DistributorParameters;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the distributor client. Report assembly is tested directly;
 * availability is tested against an unset URL and a closed port.
 */
class DistributorClientTest {

    final List<WorkItem> items = List.of(
            WorkItem.grouped("tests/a.py::t1", "tests/a.py", () -> {}),
            WorkItem.of("tests/b.py::t2", () -> {}),
            WorkItem.grouped("tests/a.py::t3", "tests/a.py", () -> {}));

    final DistributorParameters params = new DistributorParameters(4, DistributionMode.PER_GROUP_FILE);

    // ------------------------------------------------------------------
    // Availability
    // ------------------------------------------------------------------

    @Test
    void run_noBaseUrl_backendUnavailable() {
        DistributorClient client = new DistributorClient("", 60, new ObjectMapper());

        assertThatThrownBy(() -> client.run(items, params))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("distributor")
                .satisfies(e -> assertThat(((BackendUnavailableException) e).getBackend())
                        .isEqualTo("distributor"));
    }

    @Test
    void run_unreachableBackend_backendUnavailable() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        DistributorClient client = new DistributorClient("http://127.0.0.1:" + closedPort, 60, new ObjectMapper());

        assertThatThrownBy(() -> client.run(items, params))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("cannot connect");
    }

    @Test
    void run_emptyItems_configuredBackend_emptyReport() {
        DistributorClient client = new DistributorClient("http://127.0.0.1:1", 60, new ObjectMapper());

        RunReport report = client.run(List.of(), params);

        assertThat(report.outcomes()).isEmpty();
        assertThat(report.strategy()).isEqualTo(Strategy.ISOLATED_PROCESS);
    }

    // ------------------------------------------------------------------
    // Report assembly
    // ------------------------------------------------------------------

    @Test
    void toReport_outOfOrderOutcomes_submissionOrder() {
        DistributorRunResponse response = new DistributorRunResponse(List.of(
                new DistributorOutcome("tests/b.py::t2", "failed", "assert 1 == 2"),
                new DistributorOutcome("tests/a.py::t3", "error", "fixture 'db' not found"),
                new DistributorOutcome("tests/a.py::t1", "passed", null)));

        RunReport report = DistributorClient.toReport(items, response);

        assertThat(report.itemIds()).containsExactly("tests/a.py::t1", "tests/b.py::t2", "tests/a.py::t3");
        assertThat(report.outcomes()).extracting(Outcome::status).containsExactly(
                ItemStatus.PASSED, ItemStatus.FAILED, ItemStatus.ERRORED);
        assertThat(report.get(1).detail()).isEqualTo("assert 1 == 2");
    }

    @Test
    void toReport_missingOutcome_rejected() {
        DistributorRunResponse response = new DistributorRunResponse(List.of(
                new DistributorOutcome("tests/a.py::t1", "passed", null)));

        assertThatThrownBy(() -> DistributorClient.toReport(items, response))
                .isInstanceOf(DistributorException.class)
                .hasMessageContaining("1 outcomes for 3");
    }

    @Test
    void toReport_duplicateOutcome_rejected() {
        DistributorRunResponse response = new DistributorRunResponse(List.of(
                new DistributorOutcome("tests/a.py::t1", "passed", null),
                new DistributorOutcome("tests/a.py::t1", "failed", null)));

        assertThatThrownBy(() -> DistributorClient.toReport(items, response))
                .isInstanceOf(DistributorException.class)
                .hasMessageContaining("twice");
    }

    @Test
    void toReport_unknownItem_rejected() {
        DistributorRunResponse response = new DistributorRunResponse(List.of(
                new DistributorOutcome("tests/zzz.py::ghost", "passed", null)));

        assertThatThrownBy(() -> DistributorClient.toReport(items, response))
                .isInstanceOf(DistributorException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void toReport_unknownStatus_rejected() {
        DistributorRunResponse response = new DistributorRunResponse(List.of(
                new DistributorOutcome("tests/a.py::t1", "xpassed", null),
                new DistributorOutcome("tests/b.py::t2", "passed", null),
                new DistributorOutcome("tests/a.py::t3", "passed", null)));

        assertThatThrownBy(() -> DistributorClient.toReport(items, response))
                .isInstanceOf(DistributorException.class)
                .hasMessageContaining("xpassed");
    }

    @Test
    void responseBody_parsesWithSnakeCaseFields() throws Exception {
        String body = """
                {"outcomes":[{"item_id":"tests/b.py::t2","status":"passed","detail":null,"duration":0.3}],
                 "worker_count":4}
                """;

        DistributorRunResponse response = new ObjectMapper().readValue(body, DistributorRunResponse.class);

        assertThat(response.outcomes()).singleElement()
                .satisfies(o -> assertThat(o.item_id()).isEqualTo("tests/b.py::t2"));
    }
}
