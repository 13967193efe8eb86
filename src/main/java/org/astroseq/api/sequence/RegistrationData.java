package org.astroseq.api.sequence;

/**
 * Per-frame quality measurements produced by a previous registration pass.
 *
 * @param fwhm      Full width at half maximum of the stars, in pixels (lower is sharper).
 * @param quality   Registration quality score (higher is better).
 * @param roundness Star roundness in [0, 1] (1 is perfectly round).
 */
public record RegistrationData(double fwhm, double quality, double roundness) {
}
