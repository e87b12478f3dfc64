package com.bell.alerter.hipchat;

public record HipchatSettings(int threshold, String roomId, String token, String weburl, boolean notifyRoom,
                              String apiUrl) {}
