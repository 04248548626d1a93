package fr.lapetina.resilienthttp.domain.body;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Extension to MIME type lookup, loaded once from {@code mime-types.yaml} on the classpath.
 */
public final class MimeTypes {

    private static final Logger log = LoggerFactory.getLogger(MimeTypes.class);

    public static final String DEFAULT_TYPE = "application/octet-stream";
    static final String RESOURCE = "mime-types.yaml";

    private static final Map<String, String> TYPES = load();

    private MimeTypes() {
        // Utility class
    }

    /**
     * Returns the MIME type registered for a file extension (without the dot).
     */
    public static Optional<String> fromExtension(String extension) {
        if (extension == null || extension.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(TYPES.get(extension.toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns the MIME type for a file name or path, based on the text after the last dot.
     */
    public static Optional<String> fromFilename(String filename) {
        return fromExtension(extensionOf(filename));
    }

    /**
     * Returns the extension after the last dot of the final path segment,
     * or an empty string if there is none.
     */
    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String segment = filename.substring(slash + 1);
        int dot = segment.lastIndexOf('.');
        return dot < 0 ? "" : segment.substring(dot + 1);
    }

    private static Map<String, String> load() {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        try (InputStream is = MimeTypes.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is == null) {
                log.warn("MIME type table not found on classpath: {}", RESOURCE);
                return Collections.emptyMap();
            }
            Map<Object, Object> raw = yaml.load(is);
            Map<String, String> types = new HashMap<>();
            if (raw != null) {
                raw.forEach((ext, type) -> types.put(String.valueOf(ext).toLowerCase(Locale.ROOT), String.valueOf(type)));
            }
            log.debug("Loaded {} MIME type mappings", types.size());
            return Collections.unmodifiableMap(types);
        } catch (IOException e) {
            log.warn("Failed to read MIME type table: {}", RESOURCE, e);
            return Collections.emptyMap();
        }
    }
}
