package com.facefinder.main.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds of the staged face search.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "face-finder.search")
public class SearchProperties {

    /**
     * Similarity threshold of the first, high-precision stage.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double primaryThreshold = 0.55;

    /**
     * Result cap of every stage.
     */
    @Min(1)
    private int maxResults = 100;

    /**
     * Primary hit count from which no expansion runs.
     */
    @Min(1)
    private int sufficiencyCount = 8;

    /**
     * How far the expansion stage lowers the primary threshold.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double expandDelta = 0.10;

    /**
     * Lowest threshold the expansion stage may use.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double floorThreshold = 0.42;

    /**
     * Threshold of the fallback stage, run when the primary stage found nothing.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double fallbackThreshold = 0.30;
}
