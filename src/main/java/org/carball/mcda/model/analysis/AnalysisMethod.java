package org.carball.mcda.model.analysis;

import java.util.Locale;

public enum AnalysisMethod {
    DIRECT("Weighted TOPSIS", "direct", "topsis_w"),
    AHP("AHP + TOPSIS", "ahp", "topsis_ahp");

    private final String displayName;
    private final String[] aliases;

    AnalysisMethod(String displayName, String... aliases) {
        this.displayName = displayName;
        this.aliases = aliases;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Accepts the enum name or one of the legacy request names ("direct", "TOPSIS_W", "ahp", "TOPSIS_AHP").
     */
    public static AnalysisMethod fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (AnalysisMethod method : values()) {
                if (method.name().equalsIgnoreCase(normalized)) {
                    return method;
                }
                for (String alias : method.aliases) {
                    if (alias.equals(normalized)) {
                        return method;
                    }
                }
            }
        }
        throw new IllegalArgumentException("Unknown analysis method: " + name + ". Use: direct or ahp");
    }
}
