package org.carball.compadvisor.engine;

/**
 * Result of asking the engine to estimate one encoding on a sample of an object's rows.
 */
public record RatioSample(double ratio, long compressedSizeEstimate) {}
