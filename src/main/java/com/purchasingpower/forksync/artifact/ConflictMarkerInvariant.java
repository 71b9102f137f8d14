package com.purchasingpower.forksync.artifact;

import java.util.Optional;
import java.util.regex.Pattern;

public class ConflictMarkerInvariant extends DocumentInvariant {

    private static final Pattern CONFLICT_MARKER = Pattern.compile("(?m)^(<{7} |>{7} |={7}$)");

    public ConflictMarkerInvariant(String documentGlob) {
        super(documentGlob);
    }

    @Override
    public String name() {
        return "no-conflict-markers";
    }

    @Override
    protected Optional<String> checkDocument(String path, String content) {
        if (CONFLICT_MARKER.matcher(content).find()) {
            return Optional.of(path + ": contains merge conflict markers");
        }
        return Optional.empty();
    }
}
