/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.processor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.pond.PondSettings;
import org.opensearch.pond.core.exception.ProcessorException;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.model.EventType;
import org.opensearch.pond.core.model.TimeRangeEvent;
import org.opensearch.pond.core.utils.FieldPaths;
import org.opensearch.pond.query.pipeline.Pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives per-second rates between consecutive point events.
 *
 * <p>Each event after the first yields a range event spanning the two timestamps, holding
 * {@code <field>_rate} for every tracked field. Rates that cannot be computed are null, as are
 * negative rates when they are not allowed.</p>
 */
public class Rate extends Processor {

    private static final Logger logger = LogManager.getLogger(Rate.class);

    public static final String NAME = "rate";

    static final String RATE_SUFFIX = "_rate";

    private final List<String> fieldSpec;
    private final boolean allowNegative;

    private Event previous;

    /**
     * @param fieldSpec field path or list of paths, null for {@code "value"}
     * @param allowNegative keep negative rates; null uses {@link PondSettings#RATE_ALLOW_NEGATIVE}
     */
    public Rate(Pipeline pipeline, Object fieldSpec, Boolean allowNegative) {
        super(pipeline);
        this.fieldSpec = FieldPaths.toFieldSpec(fieldSpec);
        this.allowNegative = allowNegative != null ? allowNegative : PondSettings.RATE_ALLOW_NEGATIVE.get(pipeline.getSettings());
    }

    private Rate(Rate other) {
        super(other);
        this.fieldSpec = other.fieldSpec;
        this.allowNegative = other.allowNegative;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Rate copy() {
        return new Rate(this);
    }

    @Override
    protected void optionsToXContent(XContentBuilder builder) throws IOException {
        builder.field("field_spec", fieldSpec);
        builder.field("allow_negative", allowNegative);
    }

    @Override
    public void addEvent(Event event) {
        if (event.getType() != EventType.TIME) {
            throw new ProcessorException("Rate requires point events, got " + event.getType().getKeyName());
        }
        if (!hasObservers()) {
            return;
        }
        if (previous == null) {
            previous = event;
            return;
        }
        if (event.getTimestamp() < previous.getTimestamp()) {
            throw new ProcessorException(
                String.format(Locale.ROOT, "Rate requires events in time order, got %d after %d", event.getTimestamp(), previous.getTimestamp())
            );
        }
        emit(rateEvent(event));
        previous = event;
    }

    private Event rateEvent(Event current) {
        long previousTimestamp = previous.getTimestamp();
        long currentTimestamp = current.getTimestamp();
        double seconds = (currentTimestamp - previousTimestamp) / 1000.0;

        Map<String, Object> data = new LinkedHashMap<>();
        for (String fieldPath : fieldSpec) {
            List<String> ratePath = new ArrayList<>(FieldPaths.split(fieldPath));
            ratePath.set(ratePath.size() - 1, ratePath.get(ratePath.size() - 1) + RATE_SUFFIX);

            Object previousValue = previous.get(fieldPath);
            Object currentValue = current.get(fieldPath);
            Double rate = null;
            if (!FieldPaths.isNumeric(previousValue) || !FieldPaths.isNumeric(currentValue)) {
                logger.warn("Path [{}] holds non-numeric values or does not exist, rate set to null", fieldPath);
            } else if (seconds == 0) {
                logger.warn("Events for [{}] share the timestamp {}, rate set to null", fieldPath, currentTimestamp);
            } else {
                rate = (((Number) currentValue).doubleValue() - ((Number) previousValue).doubleValue()) / seconds;
                if (!allowNegative && rate < 0) {
                    rate = null;
                }
            }
            FieldPaths.setIn(data, ratePath, rate);
        }
        return new TimeRangeEvent(previousTimestamp, currentTimestamp, data);
    }
}
