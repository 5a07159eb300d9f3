package de.anton.mkid.pipeline.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Flag bits the calibration steps OR onto photon records.
 */
public final class PhotonFlags {

    /** Pixel has no usable wavelength model; the wavelength column still holds the raw phase. */
    public static final int WAVECAL_UNCALIBRATED = 1;
    /** No flat weight was applied to the record. */
    public static final int FLATCAL_UNCALIBRATED = 1 << 1;
    /** Record wavelength below the first flat bin. */
    public static final int FLAT_BELOW_RANGE = 1 << 2;
    /** Record wavelength above the last flat bin. */
    public static final int FLAT_ABOVE_RANGE = 1 << 3;

    private PhotonFlags() {
        throw new IllegalStateException("Constants class should not be instantiated.");
    }

    public static boolean isSet(int flags, int bit) {
        return (flags & bit) != 0;
    }

    public static String describe(int flags) {
        List<String> names = new ArrayList<>();
        if (isSet(flags, WAVECAL_UNCALIBRATED)) names.add("wavecal.uncalibrated");
        if (isSet(flags, FLATCAL_UNCALIBRATED)) names.add("flatcal.uncalibrated");
        if (isSet(flags, FLAT_BELOW_RANGE)) names.add("flatcal.below_range");
        if (isSet(flags, FLAT_ABOVE_RANGE)) names.add("flatcal.above_range");
        return names.isEmpty() ? "none" : String.join("|", names);
    }
}
