package com.switchboard.core.model;

/**
 * A unit's own account of whether it does real work.
 *
 * @param hasRealLogic     true when the unit performs its function rather than a placeholder
 * @param functionalWeight relative amount of real logic, 0..100
 */
public record SelfAssessment(boolean hasRealLogic, int functionalWeight) {

    public static SelfAssessment none() {
        return new SelfAssessment(false, 0);
    }
}
