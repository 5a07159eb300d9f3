package de.anton.mkid.pipeline.model;

/**
 * The calibration steps a solution can belong to.
 * The step name is used in artifact file names and photon-table headers.
 */
public enum CalibrationKind {
    WAVECAL("wavecal"),   // phase -> energy/wavelength per pixel
    FLATCAL("flatcal");   // relative spectral response per pixel and wavelength bin

    private final String stepName;

    CalibrationKind(String stepName) {
        this.stepName = stepName;
    }

    public String stepName() {
        return stepName;
    }

    /**
     * Finds a kind by its step name (case-insensitive).
     *
     * @return the matching kind, or null if nothing matches.
     */
    public static CalibrationKind fromStepName(String stepName) {
        if (stepName == null) {
            return null;
        }
        for (CalibrationKind kind : values()) {
            if (kind.stepName.equalsIgnoreCase(stepName.trim())) {
                return kind;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return stepName;
    }
}
