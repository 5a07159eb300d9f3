package de.anton.mkid.pipeline.model;

/**
 * Why a pixel could not be calibrated. Recorded on the pixel, never thrown.
 */
public enum FitFailure {
    NO_DATA("No photons for any reference line"),
    INSUFFICIENT_REFERENCE_POINTS("Fewer than two reference lines with a usable peak"),
    PEAK_NOT_CONVERGED("Peak search did not converge for enough reference lines"),
    SINGULAR_MODEL("Phase to energy model could not be solved"),
    NON_MONOTONIC("Phase to energy model is not monotonic over the usable phase range"),
    POOR_FIT("Reduced chi-squared above the configured limit"),
    NO_COUNTS("No photons in the flat exposure"),
    RATE_ABOVE_CUTOFF("Count rate above the configured cutoff (hot pixel)"),
    NO_VALID_CHUNKS("No time chunk left after trimming"),
    NUMERICAL_ERROR("Unexpected numerical error");

    private final String description;

    FitFailure(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
