package com.purchasingpower.forksync.artifact;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Every document carries its top-level marker (e.g. {@code <!DOCTYPE}) exactly once.
 * Two markers mean two documents were concatenated by a textual merge.
 */
public class SingleMarkerInvariant extends DocumentInvariant {

    private final Pattern marker;

    public SingleMarkerInvariant(String documentGlob, String markerRegex) {
        super(documentGlob);
        this.marker = Pattern.compile(markerRegex);
    }

    @Override
    public String name() {
        return "single-marker";
    }

    @Override
    protected Optional<String> checkDocument(String path, String content) {
        int count = 0;
        Matcher m = marker.matcher(content);
        while (m.find()) {
            count++;
        }
        if (count != 1) {
            return Optional.of("%s: %d top-level markers, expected exactly 1".formatted(path, count));
        }
        return Optional.empty();
    }
}
