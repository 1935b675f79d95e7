package org.carball.mcda.model.criterion;

public enum CriterionSource {
    SURVEY("Facility survey"),
    TECHNO_ECONOMIC("Techno-economic analysis"),
    FACILITY("Facility record");

    private final String displayName;

    CriterionSource(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
