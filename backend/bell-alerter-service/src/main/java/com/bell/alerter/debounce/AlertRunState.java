package com.bell.alerter.debounce;

/** Time of the latest anomaly of a metric and the length of its current run. */
public record AlertRunState(long lastTime, int count) {}
