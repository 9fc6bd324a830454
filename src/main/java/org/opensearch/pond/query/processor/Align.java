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
import org.opensearch.pond.core.exception.IndexException;
import org.opensearch.pond.core.exception.ProcessorException;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.model.EventType;
import org.opensearch.pond.core.model.Index;
import org.opensearch.pond.core.model.TimeEvent;
import org.opensearch.pond.core.model.TimeRange;
import org.opensearch.pond.core.utils.FieldPaths;
import org.opensearch.pond.query.pipeline.Pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rewrites irregular point events onto the boundaries of a fixed window.
 *
 * <p>For every window boundary crossed between two consecutive events one event is emitted at
 * the boundary, carrying only the tracked fields. With {@link AlignMethod#LINEAR} each value is
 * interpolated between the two events; with {@link AlignMethod#HOLD} the earlier value is carried
 * forward. When more boundaries are crossed than {@code limit} allows, the boundary events carry
 * null values instead.</p>
 *
 * <p>The first event is only emitted if it already sits on a boundary.</p>
 */
public class Align extends Processor {

    private static final Logger logger = LogManager.getLogger(Align.class);

    public static final String NAME = "align";

    private final List<String> fieldSpec;
    private final String window;
    private final AlignMethod method;
    private final Integer limit;

    private Event previous;

    /**
     * @param fieldSpec field path or list of paths to align, null for {@code "value"}
     * @param window boundary window; null uses {@link PondSettings#ALIGN_WINDOW}
     * @param method interpolation method; null uses {@link PondSettings#ALIGN_METHOD}
     * @param limit maximum number of boundaries to fill between two events, null for no limit
     */
    public Align(Pipeline pipeline, Object fieldSpec, String window, AlignMethod method, Integer limit) {
        super(pipeline);
        this.fieldSpec = FieldPaths.toFieldSpec(fieldSpec);
        this.window = window != null ? window : PondSettings.ALIGN_WINDOW.get(pipeline.getSettings());
        this.method = method != null ? method : AlignMethod.fromString(PondSettings.ALIGN_METHOD.get(pipeline.getSettings()));
        try {
            Index.windowDuration(this.window);
        } catch (IndexException e) {
            throw new ProcessorException("Align window is invalid: " + e.getMessage(), e);
        }
        if (limit != null && limit < 0) {
            throw new ProcessorException("Align limit must not be negative, got " + limit);
        }
        this.limit = limit;
    }

    private Align(Align other) {
        super(other);
        this.fieldSpec = other.fieldSpec;
        this.window = other.window;
        this.method = other.method;
        this.limit = other.limit;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Align copy() {
        return new Align(this);
    }

    @Override
    protected void optionsToXContent(XContentBuilder builder) throws IOException {
        builder.field("field_spec", fieldSpec);
        builder.field("window", window);
        builder.field("method", method.getName());
        if (limit != null) {
            builder.field("limit", limit);
        }
    }

    @Override
    public void addEvent(Event event) {
        if (event.getType() != EventType.TIME) {
            throw new ProcessorException("Align requires point events, got " + event.getType().getKeyName());
        }
        if (!hasObservers()) {
            return;
        }
        if (previous == null) {
            previous = event;
            if (isAligned(event)) {
                emit(event);
            }
            return;
        }
        if (event.getTimestamp() < previous.getTimestamp()) {
            throw new ProcessorException(
                String.format(
                    Locale.ROOT,
                    "Align requires events in time order, got %d after %d",
                    event.getTimestamp(),
                    previous.getTimestamp()
                )
            );
        }

        List<Long> boundaries = boundariesBetween(previous.getTimestamp(), event.getTimestamp());
        boolean overLimit = limit != null && boundaries.size() > limit;
        for (long boundary : boundaries) {
            if (overLimit) {
                emit(new TimeEvent(boundary, nullFields()));
            } else if (method == AlignMethod.HOLD) {
                emit(new TimeEvent(boundary, heldFields()));
            } else {
                emit(new TimeEvent(boundary, interpolatedFields(boundary, event)));
            }
        }
        previous = event;
    }

    private boolean isAligned(Event event) {
        return new Index(Index.getIndexString(window, event.getTimestamp())).begin() == event.getTimestamp();
    }

    /**
     * Boundaries after {@code from}, up to and including the one at or before {@code to}.
     */
    private List<Long> boundariesBetween(long from, long to) {
        List<String> indexes = Index.getIndexStringList(window, new TimeRange(from, to));
        List<Long> boundaries = new ArrayList<>(Math.max(0, indexes.size() - 1));
        for (String index : indexes.subList(1, indexes.size())) {
            boundaries.add(new Index(index).begin());
        }
        return boundaries;
    }

    private Map<String, Object> nullFields() {
        Map<String, Object> data = new LinkedHashMap<>();
        for (String fieldPath : fieldSpec) {
            FieldPaths.setIn(data, FieldPaths.split(fieldPath), null);
        }
        return data;
    }

    private Map<String, Object> heldFields() {
        Map<String, Object> data = new LinkedHashMap<>();
        for (String fieldPath : fieldSpec) {
            FieldPaths.setIn(data, FieldPaths.split(fieldPath), previous.get(fieldPath));
        }
        return data;
    }

    private Map<String, Object> interpolatedFields(long boundary, Event current) {
        double fraction = (double) (boundary - previous.getTimestamp()) / (current.getTimestamp() - previous.getTimestamp());
        Map<String, Object> data = new LinkedHashMap<>();
        for (String fieldPath : fieldSpec) {
            Object previousValue = previous.get(fieldPath);
            Object currentValue = current.get(fieldPath);
            Object value = null;
            if (FieldPaths.isNumeric(previousValue) && FieldPaths.isNumeric(currentValue)) {
                double p = ((Number) previousValue).doubleValue();
                double c = ((Number) currentValue).doubleValue();
                value = p + (c - p) * fraction;
            } else {
                logger.warn("Linear alignment of [{}] needs numeric values, got [{}] and [{}], setting null", fieldPath, previousValue, currentValue);
            }
            FieldPaths.setIn(data, FieldPaths.split(fieldPath), value);
        }
        return data;
    }
}
