package net.wizeops.tiercache.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a configuration check. Errors make the configuration unusable, warnings do not.
 */
@Value
@Builder
public class ValidationResult {
    @Singular
    List<String> errors;
    @Singular
    List<String> warnings;

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Errors followed by warnings, each prefixed with its level.
     */
    public List<String> getIssues() {
        List<String> issues = new ArrayList<>(errors.size() + warnings.size());
        errors.forEach(e -> issues.add("ERROR: " + e));
        warnings.forEach(w -> issues.add("WARNING: " + w));
        return issues;
    }

    public ValidationResult merge(ValidationResult other) {
        return ValidationResult.builder()
                .errors(errors).errors(other.errors)
                .warnings(warnings).warnings(other.warnings)
                .build();
    }
}
