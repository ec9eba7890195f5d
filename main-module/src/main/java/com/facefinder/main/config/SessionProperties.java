package com.facefinder.main.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Search session lifetime and the search parameters of session queries.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "face-finder.session")
public class SessionProperties {

    /**
     * A session expires this long after it was created.
     */
    @NotNull
    private Duration idleTimeout = Duration.ofMinutes(30);

    /**
     * Remove expired sessions in the background instead of only on access.
     */
    private boolean sweepEnabled = false;

    @NotNull
    private Duration sweepInterval = Duration.ofMinutes(5);

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double searchThreshold = 0.50;

    @Min(1)
    private int searchLimit = 100;

    /**
     * Maximum number of photos returned by a session query.
     */
    @Min(1)
    private int resultLimit = 50;
}
