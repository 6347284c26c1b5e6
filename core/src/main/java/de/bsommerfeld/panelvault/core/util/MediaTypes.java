package de.bsommerfeld.panelvault.core.util;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps media types and URLs to file extensions for downloaded images.
 */
public final class MediaTypes {

    /** Extension used when neither the Content-Type nor the URL tell us anything. */
    public static final String DEFAULT_EXTENSION = "png";

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("image/jpeg", "jpeg"),
            Map.entry("image/jpg", "jpg"),
            Map.entry("image/pjpeg", "jpeg"),
            Map.entry("image/png", "png"),
            Map.entry("image/apng", "png"),
            Map.entry("image/gif", "gif"),
            Map.entry("image/webp", "webp"),
            Map.entry("image/svg+xml", "svg"),
            Map.entry("image/bmp", "bmp"),
            Map.entry("image/x-ms-bmp", "bmp"),
            Map.entry("image/tiff", "tiff"),
            Map.entry("image/avif", "avif"),
            Map.entry("image/heic", "heic"),
            Map.entry("image/heif", "heif"),
            Map.entry("image/x-icon", "ico"),
            Map.entry("image/vnd.microsoft.icon", "ico"));

    private static final Pattern SIMPLE_TOKEN = Pattern.compile("[a-z0-9]{1,5}");

    private MediaTypes() {
    }

    /**
     * Returns the extension for a Content-Type header value, ignoring
     * parameters such as {@code charset}. Unknown {@code image/*} subtypes
     * fall back to the subtype itself when it is a plain token.
     *
     * @return the extension, or null if the type gives no usable hint
     */
    public static String extensionForMediaType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return null;
        }
        String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        String known = EXTENSIONS.get(mediaType);
        if (known != null) {
            return known;
        }
        if (mediaType.startsWith("image/")) {
            String subtype = mediaType.substring("image/".length());
            if (SIMPLE_TOKEN.matcher(subtype).matches()) {
                return subtype;
            }
        }
        return null;
    }

    /**
     * Returns the extension of the URL's last path segment, lowercased.
     *
     * @return the extension, or null if the path has none
     */
    public static String extensionFromUrl(String url) {
        if (url == null || url.isBlank() || url.startsWith("data:")) {
            return null;
        }
        String path;
        try {
            path = URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (path == null || path.isEmpty()) {
            return null;
        }
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        if (dot < 0 || dot == lastSegment.length() - 1) {
            return null;
        }
        String ext = lastSegment.substring(dot + 1).toLowerCase(Locale.ROOT);
        return SIMPLE_TOKEN.matcher(ext).matches() ? ext : null;
    }

    /**
     * Content-Type first, then the URL path extension, then
     * {@value #DEFAULT_EXTENSION}.
     */
    public static String resolveExtension(String contentType, String url) {
        String ext = extensionForMediaType(contentType);
        if (ext == null) {
            ext = extensionFromUrl(url);
        }
        return ext != null ? ext : DEFAULT_EXTENSION;
    }
}
