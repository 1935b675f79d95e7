package org.carball.mcda.model.criterion;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Catalog entry describing a criterion that sites can be ranked on.
 */
@Value
@Builder
public class CriterionDefinition {
    @NonNull
    String id;
    @NonNull
    String name;
    String description;
    @NonNull
    CriterionDirection direction;
    @NonNull
    CriterionSource source;
    String unit;
}
