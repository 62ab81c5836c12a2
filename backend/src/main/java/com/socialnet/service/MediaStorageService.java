package com.socialnet.service;

import com.socialnet.exception.MediaStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.Normalizer;
import java.util.Locale;
import java.util.UUID;

/**
 * Stores uploaded images on the local file system under {@code app.media.root}.
 *
 * Files are named {@code <slug>-<uuid>.<ext>} inside a per-kind directory, so two
 * uploads never overwrite each other. The returned path is relative to the media
 * root and is what the entities store.
 */
@Service
@Slf4j
public class MediaStorageService {

    public static final String PROFILE_IMAGES = "profile_images";
    public static final String POST_IMAGES = "post_images";

    private static final int MAX_SLUG_LENGTH = 50;

    private final Path root;
    private final long maxSizeBytes;

    public MediaStorageService(
            @Value("${app.media.root:media}") String root,
            @Value("${app.media.max-size-bytes:5242880}") long maxSizeBytes
    ) {
        this.root = Paths.get(root).toAbsolutePath().normalize();
        this.maxSizeBytes = maxSizeBytes;
    }

    /**
     * Validate and store an image.
     *
     * @param directory target directory below the media root
     * @param baseName human-readable name the file name is derived from
     * @param file the uploaded file
     * @return path of the stored file relative to the media root, with '/' separators
     * @throws IllegalArgumentException if the file is empty, too large or not an image
     * @throws MediaStorageException if the file cannot be written
     */
    public String storeImage(String directory, String baseName, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty.");
        }
        if (file.getSize() > maxSizeBytes) {
            throw new IllegalArgumentException(String.format(
                    "Uploaded file exceeds %d bytes.", maxSizeBytes));
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            throw new IllegalArgumentException("Only image files can be uploaded.");
        }

        String fileName = slugify(baseName) + "-" + UUID.randomUUID() + extensionOf(file.getOriginalFilename());
        Path target = root.resolve(directory).resolve(fileName).normalize();
        try {
            Files.createDirectories(target.getParent());
            file.transferTo(target);
        } catch (IOException e) {
            throw new MediaStorageException("Could not store " + directory + "/" + fileName, e);
        }

        log.info("Image stored: path={}/{}, size={}KB", directory, fileName, file.getSize() / 1024);
        return directory + "/" + fileName;
    }

    /**
     * Delete a previously stored file. Missing files and external URLs are ignored.
     *
     * @param relativePath path returned by {@link #storeImage}, or null
     */
    public void delete(String relativePath) {
        if (relativePath == null || relativePath.isBlank() || relativePath.contains("://")) {
            return;
        }
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root)) {
            log.warn("Refusing to delete outside the media root: {}", relativePath);
            return;
        }
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Could not delete stored image {}: {}", relativePath, e.getMessage());
        }
    }

    Path getRoot() {
        return root;
    }

    /**
     * Lower-case ASCII slug: accents stripped, runs of other characters collapsed to '-'.
     * Falls back to "image" when nothing is left.
     */
    static String slugify(String value) {
        if (value == null) {
            return "image";
        }
        String ascii = Normalizer.normalize(value, Normalizer.Form.NFKD).replaceAll("\\p{M}", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? "image" : slug;
    }

    static String extensionOf(String originalFilename) {
        if (originalFilename == null) {
            return "";
        }
        int dot = originalFilename.lastIndexOf('.');
        if (dot < 0 || dot == originalFilename.length() - 1) {
            return "";
        }
        String extension = originalFilename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return extension.matches("[a-z0-9]{1,10}") ? "." + extension : "";
    }
}
