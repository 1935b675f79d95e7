package org.carball.mcda.builder;

/**
 * Minimal identity of a site record supplied by the host application. Everything else
 * about the record is only read by a {@link CriterionValueExtractor}.
 */
public interface SiteRecord {

    String getId();

    String getName();
}
