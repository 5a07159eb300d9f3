package de.anton.mkid.pipeline.model;

/**
 * One detected photon. The wavelength column holds the raw phase height until
 * a wavelength solution is applied, afterwards the wavelength in nm.
 * Calibration mutates wavelength, weight and flags in place.
 */
public class PhotonRecord {

    private final long timeMicros; // relative to the start of the table
    private final int pixel;
    private double wavelength;
    private double weight;
    private int flags;

    public PhotonRecord(long timeMicros, int pixel, double wavelength) {
        this(timeMicros, pixel, wavelength, 1.0, 0);
    }

    public PhotonRecord(long timeMicros, int pixel, double wavelength, double weight, int flags) {
        this.timeMicros = timeMicros;
        this.pixel = pixel;
        this.wavelength = wavelength;
        this.weight = weight;
        this.flags = flags;
    }

    public long getTimeMicros() { return timeMicros; }
    public int getPixel() { return pixel; }
    public double getWavelength() { return wavelength; }
    public double getWeight() { return weight; }
    public int getFlags() { return flags; }

    public void setWavelength(double wavelength) { this.wavelength = wavelength; }
    public void setWeight(double weight) { this.weight = weight; }

    /** ORs the given bits onto the record; bits are never cleared. */
    public void addFlags(int bits) { this.flags |= bits; }

    public boolean hasFlag(int bit) { return PhotonFlags.isSet(flags, bit); }

    @Override
    public String toString() {
        return String.format("PhotonRecord[t=%d us, pixel=%d, wvl=%.4f, w=%.4f, flags=%s]",
            timeMicros, pixel, wavelength, weight, PhotonFlags.describe(flags));
    }
}
