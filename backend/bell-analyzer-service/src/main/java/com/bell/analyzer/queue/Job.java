package com.bell.analyzer.queue;

/** A reserved unit of work: the broker's id for it and the raw payload. */
public record Job(String id, byte[] body) {}
