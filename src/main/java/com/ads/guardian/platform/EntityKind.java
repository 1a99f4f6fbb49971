package com.ads.guardian.platform;

/**
 * Kind of entity under guardianship.
 * Rollup priority orders kinds from coarsest (campaign) to finest (keyword) so that
 * campaign-level loss accounting only sums one layer of the hierarchy.
 */
public enum EntityKind {

    CAMPAIGN("Campaign", "campaigns", 0),

    AD_GROUP("Ad group", "adGroups", 1),

    KEYWORD("Keyword", "keywords", 2);

    private final String displayName;
    private final String resourcePath;
    private final int rollupPriority;

    EntityKind(String displayName, String resourcePath, int rollupPriority) {
        this.displayName = displayName;
        this.resourcePath = resourcePath;
        this.rollupPriority = rollupPriority;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Path segment of this kind on the ads platform API.
     */
    public String getResourcePath() {
        return resourcePath;
    }

    /**
     * Lower value = coarser entity. CAMPAIGN = 0, AD_GROUP = 1, KEYWORD = 2
     */
    public int getRollupPriority() {
        return rollupPriority;
    }

    public boolean isCoarserThan(EntityKind other) {
        return rollupPriority < other.rollupPriority;
    }
}
