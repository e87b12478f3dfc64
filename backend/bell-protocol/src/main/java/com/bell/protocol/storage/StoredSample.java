package com.bell.protocol.storage;

/** One member of a metric's sorted set, decoded from {@code value:multiple:time}. */
public record StoredSample(double value, double multiple, long time) {}
