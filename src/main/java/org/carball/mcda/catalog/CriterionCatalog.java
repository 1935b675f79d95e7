package org.carball.mcda.catalog;

import org.carball.mcda.model.criterion.CriterionDefinition;
import org.carball.mcda.model.criterion.CriterionDirection;
import org.carball.mcda.model.criterion.CriterionSource;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.carball.mcda.model.criterion.CriterionDirection.BENEFIT;
import static org.carball.mcda.model.criterion.CriterionDirection.COST;
import static org.carball.mcda.model.criterion.CriterionSource.FACILITY;
import static org.carball.mcda.model.criterion.CriterionSource.SURVEY;
import static org.carball.mcda.model.criterion.CriterionSource.TECHNO_ECONOMIC;

/**
 * Registry of the criteria sites can be ranked on. Immutable once built.
 */
public class CriterionCatalog {

    private static final CriterionCatalog DEFAULT = new CriterionCatalog(List.of(
            // Survey-based criteria
            criterion("operational_hours_day", "Daily Operational Hours",
                    "Average operational hours during day", BENEFIT, SURVEY, "hours"),
            criterion("operational_hours_night", "Night Operational Hours",
                    "Average operational hours during night", BENEFIT, SURVEY, "hours"),
            criterion("staff_total", "Total Staff Count",
                    "Total number of support and technical staff", BENEFIT, SURVEY, "people"),
            criterion("equipment_count", "Equipment Count",
                    "Number of electrical equipment items", BENEFIT, SURVEY, "items"),
            criterion("catchment_population", "Catchment Population",
                    "Population served by the facility", BENEFIT, SURVEY, "people"),
            criterion("monthly_diesel_cost", "Monthly Diesel Cost",
                    "Monthly cost of diesel fuel", COST, SURVEY, "USD"),
            criterion("electricity_reliability_score", "Electricity Reliability Score",
                    "Reliability of current electricity source (1-5 scale)", BENEFIT, SURVEY, "score"),

            // Techno-economic criteria
            criterion("pv_initial_cost", "PV Initial Cost",
                    "Initial investment cost for PV system", COST, TECHNO_ECONOMIC, "USD"),
            criterion("pv_lifecycle_cost", "PV Lifecycle Cost",
                    "Total lifecycle cost of PV system", COST, TECHNO_ECONOMIC, "USD"),
            criterion("pv_npv", "PV Net Present Value",
                    "Net present value of PV investment", BENEFIT, TECHNO_ECONOMIC, "USD"),
            criterion("pv_irr", "PV Internal Rate of Return",
                    "Internal rate of return for PV investment", BENEFIT, TECHNO_ECONOMIC, "%"),
            criterion("daily_usage", "Daily Energy Usage",
                    "Estimated daily energy consumption", BENEFIT, TECHNO_ECONOMIC, "kWh"),
            criterion("peak_hours", "Peak Hours",
                    "Peak power demand hours", BENEFIT, TECHNO_ECONOMIC, "hours"),
            criterion("cost_usd", "System Cost",
                    "Total installed cost of the proposed system", COST, TECHNO_ECONOMIC, "USD"),
            criterion("capacity_kw", "System Capacity",
                    "Rated capacity of the proposed PV system", BENEFIT, TECHNO_ECONOMIC, "kW"),

            // Location-based criteria
            criterion("latitude", "Latitude",
                    "Geographic latitude (solar resource indicator)", BENEFIT, FACILITY, "degrees")
    ));

    private final Map<String, CriterionDefinition> definitions;

    public CriterionCatalog(Collection<CriterionDefinition> definitions) {
        Map<String, CriterionDefinition> byId = new LinkedHashMap<>();
        for (CriterionDefinition definition : definitions) {
            if (byId.putIfAbsent(definition.getId(), definition) != null) {
                throw new IllegalArgumentException("Duplicate criterion id in catalog: " + definition.getId());
            }
        }
        this.definitions = Collections.unmodifiableMap(byId);
    }

    /**
     * Catalog of the criteria derived from facility surveys, techno-economic analyses and facility records.
     */
    public static CriterionCatalog defaults() {
        return DEFAULT;
    }

    public Optional<CriterionDefinition> lookup(String id) {
        return Optional.ofNullable(id == null ? null : definitions.get(id));
    }

    public boolean contains(String id) {
        return lookup(id).isPresent();
    }

    public Collection<CriterionDefinition> all() {
        return definitions.values();
    }

    public int size() {
        return definitions.size();
    }

    private static CriterionDefinition criterion(String id, String name, String description,
                                                 CriterionDirection direction, CriterionSource source, String unit) {
        return CriterionDefinition.builder()
                .id(id)
                .name(name)
                .description(description)
                .direction(direction)
                .source(source)
                .unit(unit)
                .build();
    }
}
