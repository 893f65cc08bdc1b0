package com.cgi.piiscan.dbscanner.intelligent;

import com.cgi.piiscan.dbscanner.model.RiskLevel;
import com.cgi.piiscan.dbscanner.model.SchemaAnalysis;
import com.cgi.piiscan.dbscanner.model.TableDescriptor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Aggregates table priorities into a database-wide risk classification.
 */
@Component
public class SchemaRiskAnalyzer {
    static final double HIGH_PRIORITY_THRESHOLD = 2.5;
    static final double MEDIUM_PRIORITY_THRESHOLD = 1.5;

    /**
     * Analyzes scored tables.
     *
     * @param tables Tables with priority scores attached
     * @return Schema analysis
     */
    public SchemaAnalysis analyze(List<TableDescriptor> tables) {
        int high = 0;
        int medium = 0;
        int low = 0;
        long estimatedRows = 0;

        for (TableDescriptor table : tables) {
            double score = table.getPriorityScore();
            if (score >= HIGH_PRIORITY_THRESHOLD) {
                high++;
            } else if (score >= MEDIUM_PRIORITY_THRESHOLD) {
                medium++;
            } else {
                low++;
            }
            estimatedRows += table.getEstimatedRowCount();
        }

        double riskScore = high * 3 + medium * 1.5;

        return SchemaAnalysis.builder()
                .tables(List.copyOf(tables))
                .totalTables(tables.size())
                .estimatedRows(estimatedRows)
                .highPriorityTables(high)
                .mediumPriorityTables(medium)
                .lowPriorityTables(low)
                .riskScore(riskScore)
                .riskLevel(toRiskLevel(riskScore))
                .build();
    }

    private static RiskLevel toRiskLevel(double riskScore) {
        if (riskScore > 10) {
            return RiskLevel.HIGH;
        }
        if (riskScore > 5) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
