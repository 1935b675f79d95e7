package org.carball.mcda.builder;

/**
 * Resolves the raw value of one criterion for one site. Implementations may return any
 * object and may throw; {@link AlternativeBuilder} treats anything but a finite number as 0.
 */
@FunctionalInterface
public interface CriterionValueExtractor<S extends SiteRecord> {

    Object extract(S site, String criterionId) throws Exception;
}
