package com.eainde.compliance.orchestration;

import com.eainde.compliance.dispatch.TieredDispatcher;
import com.eainde.compliance.jurisdiction.JurisdictionReferenceStore;
import com.eainde.compliance.model.Feature;
import com.eainde.compliance.model.JurisdictionProfile;
import com.eainde.compliance.model.RiskTier;
import com.eainde.compliance.model.RollupStats;
import com.eainde.compliance.model.StateCentricReport;
import com.eainde.compliance.model.StateCentricResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the tiered dispatcher across a set of jurisdictions on a bounded worker pool.
 *
 * <h3>Flow:</h3>
 * <pre>
 * start(features, targets)
 *   │
 *   ├── resolve targets (empty → every known code), unknown codes → skipped + WARN
 *   ├── order by tier: high → medium → low
 *   ├── submit one task per jurisdiction (MDC: runId, jurisdiction)
 *   └── BatchRun
 *         ├── cancel()  → tasks not yet started are skipped, started ones finish and are kept
 *         └── await()   → StateCentricReport with rollup
 * </pre>
 *
 * A jurisdiction is either present with a verdict for every feature or absent.
 */
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    static final String MDC_RUN_ID = "runId";
    static final String MDC_JURISDICTION = "jurisdiction";

    private static final List<RiskTier> TIER_PRIORITY = List.of(RiskTier.HIGH, RiskTier.MEDIUM, RiskTier.LOW);

    private final JurisdictionReferenceStore referenceStore;
    private final TieredDispatcher dispatcher;
    private final Executor executor;
    private final RollupCalculator rollupCalculator;
    private final List<String> defaultTargets;

    public BatchOrchestrator(JurisdictionReferenceStore referenceStore,
                             TieredDispatcher dispatcher,
                             Executor executor,
                             RollupCalculator rollupCalculator,
                             List<String> defaultTargets) {
        this.referenceStore = referenceStore;
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.rollupCalculator = rollupCalculator;
        this.defaultTargets = defaultTargets == null ? List.of() : defaultTargets.stream()
                .filter(code -> code != null && !code.isBlank())
                .toList();
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /** Runs the configured default targets to completion. */
    public StateCentricReport analyze(List<Feature> features) {
        return analyze(features, defaultTargets);
    }

    /** Runs the given targets to completion; an empty collection means every jurisdiction. */
    public StateCentricReport analyze(List<Feature> features, Collection<String> targetCodes) {
        return start(features, targetCodes).await();
    }

    public List<String> getDefaultTargets() {
        return defaultTargets;
    }

    public BatchRun start(List<Feature> features, Collection<String> targetCodes) {
        return start(UUID.randomUUID().toString(), features, targetCodes);
    }

    /**
     * Submits every resolved jurisdiction and returns immediately.
     */
    public BatchRun start(String runId, List<Feature> features, Collection<String> targetCodes) {
        if (features == null) {
            throw new IllegalArgumentException("features must not be null");
        }
        List<Feature> snapshot = List.copyOf(features);
        long startedAt = System.currentTimeMillis();

        List<String> skipped = new ArrayList<>();
        List<JurisdictionProfile> resolved = resolve(targetCodes, skipped);
        List<JurisdictionProfile> ordered = orderByTier(resolved);

        String previousRunId = MDC.get(MDC_RUN_ID);
        MDC.put(MDC_RUN_ID, runId);
        try {
            log.info("Run {}: {} features x {} jurisdictions ({} skipped), llm={}",
                    runId, snapshot.size(), ordered.size(), skipped.size(), dispatcher.isLlmAvailable());
            BatchRun run = new BatchRun(runId, snapshot.size(), skipped, startedAt);
            for (JurisdictionProfile jurisdiction : ordered) {
                run.submit(jurisdiction, snapshot);
            }
            return run;
        } finally {
            if (previousRunId != null) {
                MDC.put(MDC_RUN_ID, previousRunId);
            } else {
                MDC.remove(MDC_RUN_ID);
            }
        }
    }

    // =========================================================================
    //  Target resolution
    // =========================================================================

    private List<JurisdictionProfile> resolve(Collection<String> targetCodes, List<String> skipped) {
        Collection<String> requested = targetCodes == null || targetCodes.isEmpty()
                ? referenceStore.allCodes()
                : targetCodes;

        Set<String> seen = new LinkedHashSet<>();
        List<JurisdictionProfile> resolved = new ArrayList<>();
        for (String code : requested) {
            String normalized = code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
            if (!seen.add(normalized)) {
                continue;
            }
            Optional<JurisdictionProfile> profile = referenceStore.get(normalized);
            if (profile.isPresent()) {
                resolved.add(profile.get());
            } else {
                log.warn("Unknown jurisdiction code '{}', skipped", code);
                skipped.add(normalized);
            }
        }
        return resolved;
    }

    private static List<JurisdictionProfile> orderByTier(List<JurisdictionProfile> jurisdictions) {
        List<JurisdictionProfile> ordered = new ArrayList<>(jurisdictions.size());
        for (RiskTier tier : TIER_PRIORITY) {
            List<String> codes = new ArrayList<>();
            for (JurisdictionProfile jurisdiction : jurisdictions) {
                if (jurisdiction.riskTier() == tier) {
                    ordered.add(jurisdiction);
                    codes.add(jurisdiction.code());
                }
            }
            if (!codes.isEmpty()) {
                log.info("{} tier: {}", tier.wireValue(), codes);
            }
        }
        return ordered;
    }

    // =========================================================================
    //  Run handle
    // =========================================================================

    /**
     * Handle on a submitted run. Jurisdictions are reported in submission order.
     */
    public final class BatchRun {

        private final String runId;
        private final int featureCount;
        private final List<String> skipped;
        private final long startedAt;
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final Map<String, CompletableFuture<Optional<StateCentricResult>>> tasks = new LinkedHashMap<>();
        private StateCentricReport report;

        private BatchRun(String runId, int featureCount, List<String> skipped, long startedAt) {
            this.runId = runId;
            this.featureCount = featureCount;
            this.skipped = List.copyOf(skipped);
            this.startedAt = startedAt;
        }

        private void submit(JurisdictionProfile jurisdiction, List<Feature> features) {
            CompletableFuture<Optional<StateCentricResult>> task = CompletableFuture.supplyAsync(
                    () -> runJurisdiction(jurisdiction, features), executor);
            tasks.put(jurisdiction.code(), task);
        }

        private Optional<StateCentricResult> runJurisdiction(JurisdictionProfile jurisdiction,
                                                             List<Feature> features) {
            if (cancelled.get()) {
                return Optional.empty();
            }
            MDC.put(MDC_JURISDICTION, jurisdiction.code());
            try {
                StateCentricResult result = dispatcher.dispatch(features, jurisdiction);
                log.debug("{} done via {}: mean risk {}", jurisdiction.code(), result.path(),
                        result.meanRiskScore());
                return Optional.of(result);
            } finally {
                MDC.remove(MDC_JURISDICTION);
            }
        }

        public String getRunId() {
            return runId;
        }

        public boolean isCancelled() {
            return cancelled.get();
        }

        /**
         * Stops jurisdictions that have not started. Jurisdictions already being
         * processed run to completion and stay in the report.
         */
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                long pending = tasks.values().stream().filter(task -> !task.isDone()).count();
                log.warn("Run {} cancelled with {} jurisdictions outstanding", runId, pending);
            }
        }

        /**
         * Blocks until every submitted jurisdiction has finished or been cancelled.
         */
        public synchronized StateCentricReport await() {
            if (report != null) {
                return report;
            }
            Map<String, StateCentricResult> results = new LinkedHashMap<>();
            List<String> cancelledCodes = new ArrayList<>();
            for (Map.Entry<String, CompletableFuture<Optional<StateCentricResult>>> entry : tasks.entrySet()) {
                Optional<StateCentricResult> result;
                try {
                    result = entry.getValue().join();
                } catch (CompletionException e) {
                    throw new IllegalStateException("Jurisdiction " + entry.getKey() + " failed", e.getCause());
                }
                if (result.isPresent()) {
                    results.put(entry.getKey(), result.get());
                } else {
                    cancelledCodes.add(entry.getKey());
                }
            }

            long elapsed = System.currentTimeMillis() - startedAt;
            RollupStats rollup = rollupCalculator.compute(results.values(), featureCount, elapsed);
            if (!cancelledCodes.isEmpty()) {
                log.warn("Run {}: {} jurisdictions not processed: {}", runId, cancelledCodes.size(), cancelledCodes);
            }
            log.info("Run {} finished in {} ms: {} jurisdictions, {} verdicts, compliance rate {}",
                    runId, elapsed, results.size(), rollup.totalVerdicts(),
                    String.format(Locale.ROOT, "%.2f", rollup.complianceRate()));
            report = new StateCentricReport(results, rollup, skipped, cancelledCodes);
            return report;
        }
    }
}
