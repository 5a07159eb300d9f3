package de.anton.mkid.pipeline.model;

/** Contiguous pixel ids {@code first..endExclusive-1}. */
public record PixelRange(int first, int endExclusive) {

    public PixelRange {
        if (first < 0 || endExclusive < first) {
            throw new IllegalArgumentException(String.format("Invalid pixel range [%d, %d)", first, endExclusive));
        }
    }

    public static PixelRange all(int pixelCount) {
        return new PixelRange(0, pixelCount);
    }

    public boolean contains(int pixel) {
        return pixel >= first && pixel < endExclusive;
    }

    public int size() {
        return endExclusive - first;
    }
}
