package com.purchasingpower.forksync.configuration;

import com.purchasingpower.forksync.model.FileCategory;
import com.purchasingpower.forksync.model.ResolutionStrategy;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PolicyRuleProperties {

    /**
     * Ant-style path pattern relative to the repository root (e.g. {@code ui/out/**}).
     */
    @NotBlank
    private String pattern;

    @NotNull
    private FileCategory category = FileCategory.PROTECTED;

    @NotNull
    private ResolutionStrategy strategy = ResolutionStrategy.FORCE_LOCAL;
}
