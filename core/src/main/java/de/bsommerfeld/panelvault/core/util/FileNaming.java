package de.bsommerfeld.panelvault.core.util;

import java.util.Locale;

/**
 * Folder and file naming rules for downloaded images.
 *
 * <p>
 * One folder per source, named by {@link #sanitize(String)} of the source
 * name. Files are named
 * {@code {5-digit page index}[-{subIndex}][ {title}].{ext}} where the
 * 1-based sub index only appears when the page holds more than one image.
 * Sorting files by name therefore sorts them in reading order.
 */
public final class FileNaming {

    /** Characters that are illegal or troublesome on at least one target filesystem. */
    private static final String ILLEGAL_CHARS = "/\\?%*|\"<>:";

    private FileNaming() {
    }

    /**
     * Strips every character in {@code /\?%*|"<>:} and trims surrounding
     * whitespace. {@code null} yields an empty string.
     */
    public static String sanitize(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (ILLEGAL_CHARS.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString().trim();
    }

    /**
     * Builds the file name for one image.
     *
     * @param pageIndex      1-based page index
     * @param imageIndex     0-based image index within the page
     * @param pageImageCount number of images on the page
     * @param title          page title, may be null or empty
     * @param extension      file extension without dot
     */
    public static String fileName(int pageIndex, int imageIndex, int pageImageCount, String title,
            String extension) {
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "%05d", pageIndex));
        if (pageImageCount > 1) {
            sb.append('-').append(imageIndex + 1);
        }
        String cleanTitle = sanitize(title);
        if (!cleanTitle.isEmpty()) {
            sb.append(' ').append(cleanTitle);
        }
        sb.append('.').append(extension);
        return sb.toString();
    }
}
