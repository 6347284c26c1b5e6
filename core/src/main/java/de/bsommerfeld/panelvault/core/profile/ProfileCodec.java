package de.bsommerfeld.panelvault.core.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON codec for {@link SourceProfile} files.
 *
 * <h3>Format</h3>
 * A single UTF-8 JSON object, pretty-printed with keys in alphabetical order
 * so exported files diff cleanly:
 *
 * <pre>
 * {
 *   "author" : "...",
 *   "descriptionText" : "...",
 *   "firstPageURL" : "https://example.com/comic/1",
 *   "name" : "...",
 *   "selectorImage" : "#comic img",
 *   "selectorNext" : "a[rel=next]",
 *   "selectorTitle" : "h1",
 *   "url" : "https://example.com",
 *   "version" : 1
 * }
 * </pre>
 *
 * <h3>Validation</h3>
 * Every key above is required on import. A non-object root fails with
 * {@link ProfileValidationException.Reason#INVALID_FORMAT}; the first absent
 * key (in the order listed in {@link #REQUIRED_KEYS}) fails with
 * {@link ProfileValidationException.Reason#MISSING_KEY}. JSON {@code null}
 * values import as empty strings.
 */
public final class ProfileCodec {

    private static final Logger LOG = LoggerFactory.getLogger(ProfileCodec.class);

    public static final String KEY_VERSION = "version";
    public static final String KEY_NAME = "name";
    public static final String KEY_AUTHOR = "author";
    public static final String KEY_DESCRIPTION = "descriptionText";
    public static final String KEY_URL = "url";
    public static final String KEY_FIRST_PAGE = "firstPageURL";
    public static final String KEY_SELECTOR_IMAGE = "selectorImage";
    public static final String KEY_SELECTOR_TITLE = "selectorTitle";
    public static final String KEY_SELECTOR_NEXT = "selectorNext";

    public static final List<String> REQUIRED_KEYS = List.of(KEY_VERSION, KEY_NAME, KEY_AUTHOR, KEY_DESCRIPTION,
            KEY_URL, KEY_FIRST_PAGE, KEY_SELECTOR_IMAGE, KEY_SELECTOR_TITLE, KEY_SELECTOR_NEXT);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private ProfileCodec() {
    }

    public static String toJson(SourceProfile profile) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put(KEY_VERSION, profile.version());
        root.put(KEY_NAME, nullToEmpty(profile.name()));
        root.put(KEY_AUTHOR, nullToEmpty(profile.author()));
        root.put(KEY_DESCRIPTION, nullToEmpty(profile.descriptionText()));
        root.put(KEY_URL, nullToEmpty(profile.url()));
        root.put(KEY_FIRST_PAGE, nullToEmpty(profile.firstPageUrl()));
        root.put(KEY_SELECTOR_IMAGE, nullToEmpty(profile.selectorImage()));
        root.put(KEY_SELECTOR_TITLE, nullToEmpty(profile.selectorTitle()));
        root.put(KEY_SELECTOR_NEXT, nullToEmpty(profile.selectorNext()));
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            // A map of strings and one int always serializes
            throw new IllegalStateException("Failed to serialize profile", e);
        }
    }

    public static SourceProfile fromJson(String json) throws ProfileValidationException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw ProfileValidationException.invalidFormat(e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw ProfileValidationException.invalidFormat("root is not a JSON object", null);
        }
        for (String key : REQUIRED_KEYS) {
            if (!root.has(key)) {
                throw ProfileValidationException.missingKey(key);
            }
        }

        int version = root.get(KEY_VERSION).asInt(SourceProfile.CURRENT_VERSION);
        if (version != SourceProfile.CURRENT_VERSION) {
            LOG.warn("Importing profile with version {} (current is {})", version, SourceProfile.CURRENT_VERSION);
        }
        return new SourceProfile(
                version,
                text(root, KEY_NAME),
                text(root, KEY_AUTHOR),
                text(root, KEY_DESCRIPTION),
                text(root, KEY_URL),
                text(root, KEY_FIRST_PAGE),
                text(root, KEY_SELECTOR_IMAGE),
                text(root, KEY_SELECTOR_TITLE),
                text(root, KEY_SELECTOR_NEXT));
    }

    public static void write(Path file, SourceProfile profile) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(profile), StandardCharsets.UTF_8);
    }

    public static SourceProfile read(Path file) throws IOException, ProfileValidationException {
        return fromJson(Files.readString(file, StandardCharsets.UTF_8));
    }

    private static String text(JsonNode root, String key) {
        JsonNode node = root.get(key);
        return node == null || node.isNull() ? "" : node.asText();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
