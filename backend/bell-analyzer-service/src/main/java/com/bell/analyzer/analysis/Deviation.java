package com.bell.analyzer.analysis;

public record Deviation(double multiple, double mean) {}
