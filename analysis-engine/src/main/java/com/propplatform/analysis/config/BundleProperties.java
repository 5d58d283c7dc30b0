package com.propplatform.analysis.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "bundle")
public class BundleProperties {

    private double minConfidence = 58.0;

    /** Leg counts of the bundles built by default, in build order. */
    private List<Integer> plan = new ArrayList<>(List.of(2, 2, 2, 3, 3, 3, 4, 4, 4, 5));

    private int maxEntityUses = 3;
}
