package com.facefinder.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Schema(description = "Batch of faces added atomically")
public record AddFacesRequest(
    @NotEmpty
    @Valid
    List<AddFaceRequest> faces
) {}
