package com.bell.alerter.debounce;

public record Notification(String name, int count, double trend) {}
