package org.carball.mcda.model.criterion;

public enum CriterionDirection {
    BENEFIT("benefit"),
    COST("cost");

    private final String displayName;

    CriterionDirection(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Higher raw values are preferred for benefit criteria, lower for cost criteria.
     */
    public boolean prefersHigher() {
        return this == BENEFIT;
    }

    public static CriterionDirection fromName(String name) {
        for (CriterionDirection direction : values()) {
            if (direction.displayName.equalsIgnoreCase(name)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown criterion direction: " + name + ". Use: benefit or cost");
    }
}
