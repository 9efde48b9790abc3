package fr.lapetina.watchman.infrastructure.http;

import java.util.Map;

/**
 * Dotted-path lookup into a parsed JSON metadata document.
 *
 * {@code lookup(doc, "metadata.user-defined.machine-name")} walks nested
 * objects one segment at a time. Returns null when any segment is missing
 * or is not an object.
 */
public final class MetadataPaths {

    private MetadataPaths() {
    }

    public static Object lookup(Map<String, Object> document, String path) {
        if (document == null || path == null || path.isEmpty()) {
            return null;
        }
        Object current = document;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }
}
