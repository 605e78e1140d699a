package com.eainde.compliance.service;

import com.eainde.compliance.model.ComplianceMatrix;
import com.eainde.compliance.model.FeatureCentricResult;
import com.eainde.compliance.model.Feature;
import com.eainde.compliance.model.NonCompliantSummary;
import com.eainde.compliance.model.StateCentricReport;
import com.eainde.compliance.orchestration.BatchOrchestrator;
import com.eainde.compliance.reconcile.DualViewReconciler;
import com.eainde.compliance.reconcile.NonCompliantJurisdictionSummarizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for downstream consumers: runs the batch and builds the three views.
 */
@Slf4j
@Service
public class ComplianceMatrixService {

    private final BatchOrchestrator orchestrator;
    private final DualViewReconciler reconciler;
    private final NonCompliantJurisdictionSummarizer summarizer;

    public ComplianceMatrixService(BatchOrchestrator orchestrator,
                                   DualViewReconciler reconciler,
                                   NonCompliantJurisdictionSummarizer summarizer) {
        this.orchestrator = orchestrator;
        this.reconciler = reconciler;
        this.summarizer = summarizer;
    }

    /** Analyzes the configured default jurisdictions. */
    public ComplianceMatrix analyze(List<Feature> features) {
        return analyze(features, List.of());
    }

    /**
     * Analyzes the given jurisdictions; an empty collection falls back to the configured
     * defaults, and when none are configured to every jurisdiction.
     */
    public ComplianceMatrix analyze(List<Feature> features, Collection<String> targetCodes) {
        if (features == null) {
            throw new IllegalArgumentException("features must not be null");
        }
        String runId = UUID.randomUUID().toString();
        StateCentricReport stateCentric = targetCodes == null || targetCodes.isEmpty()
                ? orchestrator.start(runId, features, orchestrator.getDefaultTargets()).await()
                : orchestrator.start(runId, features, targetCodes).await();
        return assemble(runId, features, stateCentric);
    }

    /** Builds the feature-centric and summary views for an already completed run. */
    public ComplianceMatrix assemble(String runId, List<Feature> features, StateCentricReport stateCentric) {
        List<FeatureCentricResult> featureCentric = reconciler.toFeatureCentric(features, stateCentric.results());
        NonCompliantSummary summary = summarizer.summarize(featureCentric);
        log.info("Run {}: {} verdicts, {} features, {} non-compliant jurisdictions",
                runId, stateCentric.verdictCount(), featureCentric.size(), summary.jurisdictions().size());
        return new ComplianceMatrix(runId, stateCentric, featureCentric, summary);
    }
}
