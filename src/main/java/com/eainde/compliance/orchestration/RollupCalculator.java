package com.eainde.compliance.orchestration;

import com.eainde.compliance.model.ComplianceVerdict;
import com.eainde.compliance.model.HighRiskJurisdiction;
import com.eainde.compliance.model.RiskLevel;
import com.eainde.compliance.model.RollupStats;
import com.eainde.compliance.model.StateCentricResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch-wide statistics over the completed jurisdictions of a run.
 */
public class RollupCalculator {

    public RollupStats compute(Collection<StateCentricResult> results, int featureCount, long elapsedMillis) {
        Map<RiskLevel, Integer> distribution = new LinkedHashMap<>();
        distribution.put(RiskLevel.LOW, 0);
        distribution.put(RiskLevel.HIGH, 0);

        int total = 0;
        int compliant = 0;
        double riskSum = 0.0;
        List<HighRiskJurisdiction> highRisk = new ArrayList<>();

        for (StateCentricResult result : results) {
            for (ComplianceVerdict verdict : result.verdicts()) {
                total++;
                if (verdict.compliant()) compliant++;
                riskSum += verdict.riskScore();
                distribution.merge(verdict.riskLevel(), 1, Integer::sum);
            }
            long highRiskFeatures = result.highRiskFeatureCount();
            if (highRiskFeatures > 0) {
                highRisk.add(new HighRiskJurisdiction(result.jurisdictionCode(), result.jurisdictionName(),
                        (int) highRiskFeatures, result.totalFeatures()));
            }
        }

        return new RollupStats(
                total,
                results.size(),
                featureCount,
                total > 0 ? (double) compliant / total : 0.0,
                distribution,
                highRisk,
                total > 0 ? riskSum / total : 0.0,
                elapsedMillis);
    }
}
