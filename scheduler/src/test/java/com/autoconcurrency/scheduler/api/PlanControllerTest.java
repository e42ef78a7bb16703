package com.autoconcurrency.scheduler.api;

import com.autoconcurrency.scheduler.cli.ArgumentRewriter;
import com.autoconcurrency.scheduler.cli.RewrittenArguments;
import com.autoconcurrency.scheduler.decision.InvalidConfigurationException;
import com.autoconcurrency.scheduler.decision.StrategyDecision;
import com.autoconcurrency.scheduler.model.GroupingScope;
import com.autoconcurrency.scheduler.model.Strategy;
import com.autoconcurrency.scheduler.translate.DistributionMode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for PlanController.
 *
 * @WebMvcTest starts only the web layer; the rewriter is a mock.
 */
@WebMvcTest(PlanController.class)
class PlanControllerTest {

    @Autowired   MockMvc          mockMvc;
    @MockitoBean ArgumentRewriter rewriter;

    @Test
    void plan_isolatedDecision_returnsDecisionAndArgs() throws Exception {
        StrategyDecision decision = new StrategyDecision(
                Strategy.ISOLATED_PROCESS, 8, true, GroupingScope.FILE);
        when(rewriter.rewrite(any())).thenReturn(new RewrittenArguments(
                Optional.of(decision), Optional.of(DistributionMode.PER_GROUP_FILE),
                List.of("tests/", "-n", "8", "--dist", "loadfile")));

        mockMvc.perform(post("/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"args":["--concurrency","auto","--task-grouping","tests/"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("ISOLATED_PROCESS"))
                .andExpect(jsonPath("$.workers").value(8))
                .andExpect(jsonPath("$.grouping").value(true))
                .andExpect(jsonPath("$.groupingScope").value("FILE"))
                .andExpect(jsonPath("$.distributionMode").value("PER_GROUP_FILE"))
                .andExpect(jsonPath("$.args[2]").value("8"));
    }

    @Test
    void plan_threadedDecision_noDistributionMode() throws Exception {
        StrategyDecision decision = new StrategyDecision(Strategy.THREADED, 2, false, null);
        when(rewriter.rewrite(any())).thenReturn(new RewrittenArguments(
                Optional.of(decision), Optional.empty(), List.of("--workers", "2")));

        mockMvc.perform(post("/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"args\":[\"--concurrency\",\"2\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("THREADED"))
                .andExpect(jsonPath("$.distributionMode").isEmpty())
                .andExpect(jsonPath("$.args[0]").value("--workers"));
    }

    @Test
    void plan_invalidConfiguration_returns400() throws Exception {
        when(rewriter.rewrite(any())).thenThrow(
                new InvalidConfigurationException("--multithreading and --multiprocessing are mutually exclusive"));

        mockMvc.perform(post("/plans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"args\":[\"--concurrency\",\"2\",\"--multithreading\",\"--multiprocessing\"]}"))
                .andExpect(status().isBadRequest());
    }
}
