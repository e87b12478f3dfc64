package com.bell.api.model;

public record MetricTrend(String name, double trend) {}
