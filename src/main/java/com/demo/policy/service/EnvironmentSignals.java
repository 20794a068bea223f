package com.demo.policy.service;

import java.util.List;

/**
 * Browser/environment signals a fingerprint is derived from, in the order the client joins them.
 *
 * @param userAgent           navigator user agent
 * @param language            navigator locale, e.g. {@code zh-CN}
 * @param screenWidth         screen width in CSS pixels
 * @param screenHeight        screen height in CSS pixels
 * @param timezoneOffset      minutes from UTC as reported by {@code Date#getTimezoneOffset}
 * @param canvasData          data URL (or hash) of the reference canvas drawing
 * @param hardwareConcurrency logical processor count, 0 when unknown
 * @param maxTouchPoints      touch points supported, 0 when none
 */
public record EnvironmentSignals(
        String userAgent, String language, int screenWidth, int screenHeight,
        int timezoneOffset, String canvasData, int hardwareConcurrency, int maxTouchPoints
) {

    List<String> ordered() {
        return List.of(
                nullToEmpty(userAgent),
                nullToEmpty(language),
                screenWidth + "x" + screenHeight,
                Integer.toString(timezoneOffset),
                nullToEmpty(canvasData),
                Integer.toString(hardwareConcurrency),
                Integer.toString(maxTouchPoints)
        );
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
