package net.wizeops.tiercache.config;

import lombok.Value;

@Value
public class EnvironmentRecommendation {
    String presetName;
    double confidence;
    String reasoning;
    String environmentDetected;
}
