package org.carball.mcda.model.alternative;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A candidate site with one numeric value per criterion id.
 */
public record Alternative(
    String id,
    String name,
    Map<String, Double> values
) {
    public Alternative {
        Objects.requireNonNull(id, "id");
        if (name == null) {
            name = id;
        }
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
