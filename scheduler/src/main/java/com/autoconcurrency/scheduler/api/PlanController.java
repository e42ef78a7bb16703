package com.autoconcurrency.scheduler.api;

import com.autoconcurrency.scheduler.api.dto.PlanRequest;
import com.autoconcurrency.scheduler.api.dto.PlanResponse;
import com.autoconcurrency.scheduler.cli.ArgumentRewriter;
import com.autoconcurrency.scheduler.decision.InvalidConfigurationException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for dry-running a strategy decision.
 *
 * POST /plans: rewrite a runner argument list and report the decision
 *
 * Example:
 *   curl -X POST http://localhost:8080/plans \
 *     -H "Content-Type: application/json" \
 *     -d '{"args":["--concurrency","auto","--task-grouping","file","tests/"]}'
 */
@RestController
@RequestMapping("/plans")
public class PlanController {

    private final ArgumentRewriter rewriter;

    public PlanController(ArgumentRewriter rewriter) {
        this.rewriter = rewriter;
    }

    /** Returns 400 when the options are contradictory or malformed. */
    @PostMapping
    public PlanResponse plan(@RequestBody PlanRequest req) {
        List<String> args = req.args() == null ? List.of(): req.args();
        try {
            return PlanResponse.from(rewriter.rewrite(args));
        } catch (InvalidConfigurationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
