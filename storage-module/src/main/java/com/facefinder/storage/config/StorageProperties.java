package com.facefinder.storage.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Storage and index tuning for the face embedding engine.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "face-finder.storage")
public class StorageProperties {

    /**
     * Directory holding the RocksDB files and the serialized index snapshots.
     */
    @NotBlank
    private String dataPath = "./data";

    /**
     * Embedding dimension of newly created rooms.
     */
    @Min(1)
    private int dimension = 1024;

    /**
     * Room created at startup when missing. Empty disables it.
     */
    private String defaultRoom = "default";

    /**
     * Vectors whose norm differs from 1 by more than this are re-normalized on write.
     */
    @DecimalMin("0.0")
    private double normalizationTolerance = 1e-3;

    /**
     * Active face count at which a room switches from the exact to the clustered index.
     */
    @Min(1)
    private int approximateThreshold = 1000;

    /**
     * Number of clusters of the approximate index. 0 means ceil(sqrt(n)).
     */
    @Min(0)
    private int clusterCount = 0;

    /**
     * Clusters scanned per approximate query.
     */
    @Min(1)
    private int probeCount = 10;

    @Min(1)
    private int kmeansIterations = 20;

    /**
     * Upper bound on the vectors the quantizer is trained on; larger corpora are sampled.
     */
    @Min(1)
    private int trainingSampleSize = 50_000;

    private long seed = 42L;

    /**
     * The quantizer is retrained once the indexed corpus has grown by this factor since the last training.
     */
    @DecimalMin("1.0")
    private double retrainGrowthFactor = 2.0;

    /**
     * Share of tombstoned entries in an index that triggers a compacting rebuild.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double compactionRatio = 0.2;

    /**
     * Persist the index snapshot after every batch mutation.
     */
    private boolean persistIndex = true;
}
