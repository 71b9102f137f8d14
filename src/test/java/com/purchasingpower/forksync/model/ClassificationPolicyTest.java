package com.purchasingpower.forksync.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Classification Policy Tests")
class ClassificationPolicyTest {

    private final ClassificationPolicy policy = new ClassificationPolicy(List.of(
            new FileClassification("litellm/proxy/auth/litellm_license.py", FileCategory.PROTECTED, ResolutionStrategy.FORCE_LOCAL),
            new FileClassification("litellm/proxy/_experimental/out/**", FileCategory.GENERATED, ResolutionStrategy.REGENERATE),
            new FileClassification("docs", FileCategory.PROTECTED, ResolutionStrategy.FORCE_LOCAL),
            new FileClassification("**/*.md", FileCategory.ORDINARY, ResolutionStrategy.MANUAL),
            new FileClassification("README.md", FileCategory.PROTECTED, ResolutionStrategy.FORCE_LOCAL)));

    @Test
    @DisplayName("Exact path matches its entry")
    void exactPath() {
        FileClassification result = policy.classify("litellm/proxy/auth/litellm_license.py");

        assertEquals(FileCategory.PROTECTED, result.category());
        assertEquals(ResolutionStrategy.FORCE_LOCAL, result.strategy());
    }

    @Test
    @DisplayName("Ant glob covers nested generated files")
    void globPattern() {
        assertEquals(ResolutionStrategy.REGENERATE,
                policy.strategyFor("litellm/proxy/_experimental/out/_next/static/chunks/app.js"));
    }

    @Test
    @DisplayName("Bare directory pattern covers everything below it")
    void bareDirectory() {
        assertEquals(FileCategory.PROTECTED, policy.classify("docs/guide/setup.txt").category());
        assertEquals(FileCategory.ORDINARY, policy.classify("docsite/index.txt").category());
    }

    @Test
    @DisplayName("First matching entry wins over a later, more specific one")
    void firstMatchWins() {
        // Given: **/*.md is declared before README.md
        // When
        FileClassification result = policy.classify("README.md");

        // Then
        assertEquals("**/*.md", result.pattern());
        assertEquals(ResolutionStrategy.MANUAL, result.strategy());
    }

    @Test
    @DisplayName("Unmatched paths are ordinary and need manual resolution")
    void unmatched() {
        assertSame(FileClassification.UNMATCHED, policy.classify("litellm/router.py"));
        assertSame(FileClassification.UNMATCHED, ClassificationPolicy.empty().classify("anything"));
    }

    @Test
    @DisplayName("filter() keeps only paths of the requested category")
    void filterByCategory() {
        Set<String> result = policy.filter(List.of(
                "litellm/proxy/auth/litellm_license.py",
                "litellm/main.py",
                "docs/a.txt"), FileCategory.PROTECTED);

        assertEquals(Set.of("litellm/proxy/auth/litellm_license.py", "docs/a.txt"), result);
    }

    @Test
    @DisplayName("Entries are immutable")
    void immutable() {
        assertThrows(UnsupportedOperationException.class,
                () -> policy.entries().add(FileClassification.UNMATCHED));
    }
}
