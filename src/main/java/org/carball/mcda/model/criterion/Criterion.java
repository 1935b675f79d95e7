package org.carball.mcda.model.criterion;

import java.util.Objects;

/**
 * A criterion selected for one analysis, carrying its resolved weight.
 */
public record Criterion(
    String id,
    String name,
    CriterionDirection direction,
    double weight
) {
    public Criterion {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(direction, "direction for criterion " + id);
        if (name == null) {
            name = id;
        }
        if (!Double.isFinite(weight) || weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("Weight for criterion '" + id + "' must be between 0 and 1, got " + weight);
        }
    }

    public static Criterion of(CriterionDefinition definition, double weight) {
        return new Criterion(definition.getId(), definition.getName(), definition.getDirection(), weight);
    }
}
