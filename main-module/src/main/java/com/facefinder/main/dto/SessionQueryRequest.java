package com.facefinder.main.dto;

import com.facefinder.main.filter.SearchCriteria;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Query against a session's reference face")
public record SessionQueryRequest(
    @NotBlank
    @Schema(description = "Original query text, kept in the session log", example = "photos from Paris in January")
    String query,

    @Schema(description = "Filters extracted from the query text")
    SearchCriteria criteria
) {}
