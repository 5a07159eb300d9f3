package de.anton.mkid.pipeline.model;

/** Discriminator of a per-pixel calibration result. */
public enum PixelStatus {
    FIT,
    BAD
}
