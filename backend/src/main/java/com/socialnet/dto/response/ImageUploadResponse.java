package com.socialnet.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of an image upload: the stored path and a confirmation message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageUploadResponse {

    public static final String UPLOADED_MESSAGE = "Image uploaded successfully.";

    private String image;

    private String message;

    public static ImageUploadResponse uploaded(String image) {
        return new ImageUploadResponse(image, UPLOADED_MESSAGE);
    }
}
