/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond;

import org.opensearch.common.settings.Setting;

import java.util.List;

/**
 * Defaults used by pipelines and processors when an option is not given explicitly.
 */
public final class PondSettings {

    /**
     * Emit policy of new pipelines: {@code eachEvent}, {@code discard} or {@code flush}.
     */
    public static final Setting<String> EMIT_ON = Setting.simpleString("pond.pipeline.emit_on", "eachEvent", Setting.Property.NodeScope);

    /**
     * Whether calendar windows of new pipelines are computed in UTC.
     */
    public static final Setting<Boolean> UTC = Setting.boolSetting("pond.pipeline.utc", true, Setting.Property.NodeScope);

    /**
     * Boundary window used by align when none is given.
     */
    public static final Setting<String> ALIGN_WINDOW = Setting.simpleString("pond.align.window", "5m", Setting.Property.NodeScope);

    /**
     * Interpolation used by align when none is given: {@code linear} or {@code hold}.
     */
    public static final Setting<String> ALIGN_METHOD = Setting.simpleString("pond.align.method", "linear", Setting.Property.NodeScope);

    /**
     * Whether rate keeps negative rates when not told otherwise.
     */
    public static final Setting<Boolean> RATE_ALLOW_NEGATIVE = Setting.boolSetting(
        "pond.rate.allow_negative",
        true,
        Setting.Property.NodeScope
    );

    private PondSettings() {}

    public static List<Setting<?>> getSettings() {
        return List.of(EMIT_ON, UTC, ALIGN_WINDOW, ALIGN_METHOD, RATE_ALLOW_NEGATIVE);
    }
}
