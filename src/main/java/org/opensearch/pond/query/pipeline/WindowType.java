/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.pipeline;

/**
 * Time bucketing strategies.
 */
public enum WindowType {
    GLOBAL("global"),
    FIXED("fixed"),
    DAILY("daily"),
    MONTHLY("monthly"),
    YEARLY("yearly");

    private final String name;

    WindowType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the calendar window with that name, or null if {@code window} is not a calendar window
     */
    public static WindowType calendarWindow(String window) {
        return switch (window) {
            case "daily" -> DAILY;
            case "monthly" -> MONTHLY;
            case "yearly" -> YEARLY;
            default -> null;
        };
    }
}
