package com.bell.analyzer.worker;

/**
 * @param key member key of the stored sample, {@code null} if saving failed
 */
public record AnalysisResult(String name, String key, double multiple, boolean anomalous) {}
