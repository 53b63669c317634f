/* (C)2026 */
package com.ammann.cihealth.enumeration;

/**
 * Health classification of a variant bucket based on its job run pass percentage.
 *
 * <p>Each level defines a minimum pass percentage. A bucket is classified into the highest
 * level whose threshold it meets or exceeds.
 */
public enum VariantHealthStatus
{
    /** Pass percentage of 80 or above. */
    SUCCESS(80.0),
    /** Pass percentage of 60 or above. */
    UNSTABLE(60.0),
    /** Pass percentage below 60. */
    FAILED(0.0);

    private final double threshold;

    VariantHealthStatus(double threshold) {
        this.threshold = threshold;
    }

    /**
     * Returns the health status corresponding to the given pass percentage.
     *
     * @param passPercentage job run pass percentage in the range [0, 100]
     * @return the highest status whose threshold the percentage meets
     */
    public static VariantHealthStatus fromPassPercentage(double passPercentage) {
        if (passPercentage >= SUCCESS.threshold) return SUCCESS;
        if (passPercentage >= UNSTABLE.threshold) return UNSTABLE;
        return FAILED;
    }

    public double getThreshold() { return threshold; }
}
