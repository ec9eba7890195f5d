package com.facefinder.main.dto;

import com.facefinder.common.model.BoundingBox;
import com.facefinder.common.model.FaceMetadata;
import com.facefinder.common.model.NewFace;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Face detected in a photo, with its embedding")
public class AddFaceRequest {

    @NotNull
    @Schema(description = "Face embedding", example = "[0.12, -0.03, 0.4]")
    private float[] embedding;

    @NotBlank
    @Schema(description = "Photo identifier the face belongs to", example = "uploads/wedding/IMG_0042.jpg")
    private String photo;

    @NotNull
    @Schema(description = "Face position inside the photo")
    private BoundingBox bbox;

    @Schema(description = "Detector confidence", example = "0.98")
    private double confidence;

    @Schema(description = "Capture metadata of the photo")
    private FaceMetadata metadata;

    public NewFace toNewFace() {
        return new NewFace(embedding, photo, bbox, confidence, metadata);
    }
}
