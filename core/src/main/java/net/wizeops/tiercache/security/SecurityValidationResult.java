package net.wizeops.tiercache.security;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a connection security assessment. Scores run from 0 to 100.
 */
@Value
@Builder
public class SecurityValidationResult {
    int score;
    SecurityLevel level;
    boolean secure;
    @Singular
    List<String> vulnerabilities;
    @Singular
    List<SecurityRecommendation> recommendations;

    public List<SecurityRecommendation> recommendationsIn(RecommendationCategory category) {
        return recommendations.stream()
                .filter(r -> r.getCategory() == category)
                .collect(Collectors.toList());
    }

    public boolean hasCriticalFindings() {
        return !recommendationsIn(RecommendationCategory.CRITICAL).isEmpty();
    }

    public String getSummary() {
        StringBuilder summary = new StringBuilder()
                .append("Security Status: ").append(secure ? "SECURE" : "INSECURE")
                .append(" (Score: ").append(score).append("/100, Level: ").append(level).append(")\n");
        if (!vulnerabilities.isEmpty()) {
            summary.append("\nVulnerabilities (").append(vulnerabilities.size()).append("):\n");
            vulnerabilities.forEach(v -> summary.append("  - ").append(v).append('\n'));
        }
        if (!recommendations.isEmpty()) {
            summary.append("\nRecommendations (").append(recommendations.size()).append("):\n");
            recommendations.forEach(r -> summary.append("  - ").append(r).append('\n'));
        }
        return summary.toString();
    }
}
