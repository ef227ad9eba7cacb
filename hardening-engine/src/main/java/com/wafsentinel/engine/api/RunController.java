package com.wafsentinel.engine.api;

import com.wafsentinel.engine.hardening.RuleSetRepository;
import com.wafsentinel.engine.hardening.RuleSetState;
import com.wafsentinel.engine.orchestration.ClassificationRun;
import com.wafsentinel.engine.orchestration.HardeningCycle;
import com.wafsentinel.engine.orchestration.RunHistory;
import com.wafsentinel.engine.orchestration.RunStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Manual trigger surface next to the schedules. Runs execute on the bounded
 * elastic scheduler and the response carries their final status.
 *
 * @author WAF Sentinel Team
 */
@RestController
@RequestMapping("/api")
public class RunController {

    private final ClassificationRun classificationRun;
    private final HardeningCycle hardeningCycle;
    private final RunHistory runHistory;
    private final RuleSetRepository ruleSetRepository;

    public RunController(ClassificationRun classificationRun, HardeningCycle hardeningCycle, RunHistory runHistory,
            RuleSetRepository ruleSetRepository) {
        this.classificationRun = classificationRun;
        this.hardeningCycle = hardeningCycle;
        this.runHistory = runHistory;
        this.ruleSetRepository = ruleSetRepository;
    }

    @PostMapping("/runs/classification")
    public Mono<ResponseEntity<RunStatus>> runClassification() {
        return Mono.fromCallable(classificationRun::run)
                .subscribeOn(Schedulers.boundedElastic())
                .map(RunController::toResponse);
    }

    @PostMapping("/runs/classification/cancel")
    public ResponseEntity<Void> cancelClassification() {
        return classificationRun.cancel()
                ? ResponseEntity.accepted().build()
                : ResponseEntity.status(HttpStatus.CONFLICT).build();
    }

    @PostMapping("/runs/hardening")
    public Mono<ResponseEntity<RunStatus>> runHardening() {
        return Mono.fromCallable(hardeningCycle::run)
                .subscribeOn(Schedulers.boundedElastic())
                .map(RunController::toResponse);
    }

    @PostMapping("/rules/rollback/{cycleId}")
    public Mono<ResponseEntity<RunStatus>> rollback(@PathVariable String cycleId) {
        return Mono.fromCallable(() -> hardeningCycle.rollback(cycleId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(RunController::toResponse);
    }

    @GetMapping("/runs")
    public List<RunStatus> runs() {
        return runHistory.recent();
    }

    @GetMapping("/rules")
    public Mono<RuleSetState> rules() {
        return Mono.fromCallable(ruleSetRepository::load).subscribeOn(Schedulers.boundedElastic());
    }

    static ResponseEntity<RunStatus> toResponse(RunStatus status) {
        return switch (status.outcome()) {
            case SUCCEEDED, CANCELLED -> ResponseEntity.ok(status);
            case SKIPPED, ABORTED -> ResponseEntity.status(HttpStatus.CONFLICT).body(status);
            case FAILED -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(status);
        };
    }
}
