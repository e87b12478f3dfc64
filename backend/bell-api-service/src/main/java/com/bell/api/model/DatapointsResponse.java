package com.bell.api.model;

import java.util.List;

// vals are the stored multiples, aligned with times; trend is null before the first analysis
public record DatapointsResponse(String name, List<Long> times, List<Double> vals, Double trend) {}
