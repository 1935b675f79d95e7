package org.carball.mcda.model.ahp;

/**
 * One pair of criteria an analyst has to judge, in upper-triangle order.
 */
public record ComparisonPair(String criterionA, String criterionB) {
}
