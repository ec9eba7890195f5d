package com.facefinder.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for photos containing the given face")
public class SearchRequest {

    @NotNull
    @Schema(description = "Query face embedding", example = "[0.12, -0.03, 0.4]")
    private float[] embedding;

    @Min(1)
    @Schema(description = "Maximum faces per search stage, configured default when absent", example = "100")
    private Integer k;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Schema(description = "Primary similarity threshold, configured default when absent", example = "0.55")
    private Double threshold;
}
