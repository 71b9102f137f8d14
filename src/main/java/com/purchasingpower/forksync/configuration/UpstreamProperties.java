package com.purchasingpower.forksync.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class UpstreamProperties {

    @NotBlank
    private String remote = "upstream";

    /**
     * Remote URL, used to add the remote when the repository does not have it yet.
     */
    private String url;

    @NotBlank
    private String branch = "main";

    public String trackingRef(String branchOverride) {
        String effective = (branchOverride == null || branchOverride.isBlank()) ? branch : branchOverride;
        return "refs/remotes/" + remote + "/" + effective;
    }
}
