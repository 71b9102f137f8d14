package com.purchasingpower.forksync.model;

import org.springframework.util.AntPathMatcher;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ordered, immutable list of {@link FileClassification} entries.
 * Patterns are evaluated in declaration order; the first match wins.
 */
public final class ClassificationPolicy {

    private final List<FileClassification> entries;
    private final AntPathMatcher matcher = new AntPathMatcher();

    public ClassificationPolicy(List<FileClassification> entries) {
        this.entries = List.copyOf(entries);
    }

    public static ClassificationPolicy empty() {
        return new ClassificationPolicy(List.of());
    }

    public List<FileClassification> entries() {
        return entries;
    }

    public FileClassification classify(String path) {
        for (FileClassification entry : entries) {
            if (matches(entry.pattern(), path)) {
                return entry;
            }
        }
        return FileClassification.UNMATCHED;
    }

    public ResolutionStrategy strategyFor(String path) {
        return classify(path).strategy();
    }

    /**
     * Paths from {@code paths} whose classification is {@code category}, sorted.
     */
    public Set<String> filter(Iterable<String> paths, FileCategory category) {
        Set<String> result = new TreeSet<>();
        for (String path : paths) {
            if (classify(path).category() == category) {
                result.add(path);
            }
        }
        return result;
    }

    private boolean matches(String pattern, String path) {
        // a bare directory pattern also covers everything below it
        return matcher.match(pattern, path)
                || (!matcher.isPattern(pattern) && path.startsWith(stripSlash(pattern) + "/"));
    }

    private static String stripSlash(String pattern) {
        return pattern.endsWith("/") ? pattern.substring(0, pattern.length() - 1) : pattern;
    }
}
