package com.promptvector.search.quantization;

/**
 * Affine transform {@code code = round((value - offset) / scale)} shared by the whole corpus.
 */
public record QuantizationParameters(double scale, double offset) {

    public static final int LEVELS = 255;

    /**
     * Derives parameters from the global component range; a zero range maps everything to code 0.
     */
    public static QuantizationParameters fromRange(double min, double max) {
        double range = max - min;
        return new QuantizationParameters(range == 0.0 ? 1.0 : range / LEVELS, min);
    }
}
