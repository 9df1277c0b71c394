package com.flowmable.enhancer;

/**
 * Mean and population standard deviation of one colour channel (0–255 scale).
 */
public record ChannelStatistics(double mean, double stdDev) {}
