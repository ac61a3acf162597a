package net.wizeops.tiercache.monitoring;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A memory warning or an invalidation recommendation.
 */
@Value
@Builder
public class MonitoringAlert {
    Severity severity;
    String issue;
    String message;
    @Singular
    List<String> suggestions;
}
