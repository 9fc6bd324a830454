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
import org.opensearch.pond.core.exception.ProcessorException;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.utils.FieldPaths;
import org.opensearch.pond.query.pipeline.Pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces missing values (null, empty string or NaN) in the tracked fields.
 *
 * <h2>Methods</h2>
 * <ul>
 *   <li><strong>zero</strong>: a missing value becomes {@code 0}</li>
 *   <li><strong>pad</strong>: a missing value takes the value of the previous event</li>
 *   <li><strong>linear</strong>: a run of missing values between two valid ones is interpolated.
 *   Events of a run are held back until the run closes, so output lags input. Only one field
 *   can be tracked per filler.</li>
 * </ul>
 *
 * <p>Missing elements of list values are filled too. With a {@code fillLimit}, zero and pad stop
 * filling a field after that many consecutive fills, and linear gives up on a run once it holds
 * that many events, passing them on unfilled.</p>
 *
 * <p>Without a field spec, zero and pad fill every leaf field of each event and linear fills
 * {@code "value"}.</p>
 */
public class Filler extends Processor {

    private static final Logger logger = LogManager.getLogger(Filler.class);

    public static final String NAME = "fill";

    /** Null for zero and pad without a field spec: every leaf path of each event is filled. */
    private final List<String> fieldSpec;
    private final FillMethod method;
    private final Integer fillLimit;

    private Event previousEvent;
    private final Map<String, Integer> keyCount = new HashMap<>();

    private Event lastGoodLinear;
    private final List<Event> linearFillCache = new ArrayList<>();

    /**
     * @param fieldSpec field path or list of paths; null means every leaf field for zero and pad,
     *        {@code "value"} for linear
     * @param fillLimit maximum consecutive fills, null for no limit
     */
    public Filler(Pipeline pipeline, Object fieldSpec, FillMethod method, Integer fillLimit) {
        super(pipeline);
        if (method == null) {
            throw new ProcessorException("Filler needs a fill method");
        }
        if (fillLimit != null && fillLimit < 0) {
            throw new ProcessorException("Filler limit must not be negative, got " + fillLimit);
        }
        this.fieldSpec = fieldSpec == null && method != FillMethod.LINEAR ? null : FieldPaths.toFieldSpec(fieldSpec);
        if (method == FillMethod.LINEAR && this.fieldSpec.size() != 1) {
            throw new ProcessorException("Linear fill takes exactly one field path, chain several fills for more fields");
        }
        this.method = method;
        this.fillLimit = fillLimit;
    }

    private Filler(Filler other) {
        super(other);
        this.fieldSpec = other.fieldSpec;
        this.method = other.method;
        this.fillLimit = other.fillLimit;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Filler copy() {
        return new Filler(this);
    }

    @Override
    protected void optionsToXContent(XContentBuilder builder) throws IOException {
        if (fieldSpec != null) {
            builder.field("field_spec", fieldSpec);
        }
        builder.field("method", method.getName());
        if (fillLimit != null) {
            builder.field("fill_limit", fillLimit);
        }
    }

    @Override
    public void addEvent(Event event) {
        if (!hasObservers()) {
            return;
        }
        if (method == FillMethod.LINEAR) {
            for (Event filled : linearFill(event)) {
                emit(filled);
            }
        } else {
            Event filled = padAndZero(event);
            previousEvent = filled;
            emit(filled);
        }
    }

    @Override
    public void flush() {
        if (hasObservers() && method == FillMethod.LINEAR) {
            for (Event cached : linearFillCache) {
                emit(cached);
            }
            linearFillCache.clear();
        }
        super.flush();
    }

    private boolean limitReached(int count) {
        return fillLimit != null && count >= fillLimit;
    }

    // -- zero and pad

    private Event padAndZero(Event event) {
        Map<String, Object> data = FieldPaths.thaw(event.getData());
        List<String> paths = fieldSpec != null ? fieldSpec : FieldPaths.leafPaths(data);
        for (String fieldPath : paths) {
            List<String> path = FieldPaths.split(fieldPath);
            if (!FieldPaths.hasPath(data, path)) {
                logger.warn("Path [{}] does not exist in event at {}, skipping fill", fieldPath, event.getKey());
                continue;
            }
            Object value = FieldPaths.get(data, path);
            if (value instanceof List<?>) {
                @SuppressWarnings("unchecked")
                List<Object> list = (List<Object>) value;
                fillList(list);
            }
            if (FieldPaths.isValid(value)) {
                keyCount.put(fieldPath, 0);
                continue;
            }
            int count = keyCount.getOrDefault(fieldPath, 0);
            if (limitReached(count)) {
                continue;
            }
            if (method == FillMethod.ZERO) {
                FieldPaths.setIn(data, path, 0L);
                keyCount.put(fieldPath, count + 1);
            } else if (previousEvent != null && FieldPaths.isValid(previousEvent.get(path))) {
                FieldPaths.setIn(data, path, previousEvent.get(path));
                keyCount.put(fieldPath, count + 1);
            }
        }
        return event.setData(data);
    }

    /**
     * Fills missing elements of a list value in place.
     */
    private void fillList(List<Object> values) {
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (method == FillMethod.LINEAR && FieldPaths.isValid(value) && !FieldPaths.isNumeric(value)) {
                logger.warn("Linear fill needs numeric values, skipping list {}", values);
                return;
            }
            if (FieldPaths.isValid(value)) {
                continue;
            }
            Object before = i > 0 && FieldPaths.isValid(values.get(i - 1)) ? values.get(i - 1) : null;
            switch (method) {
                case ZERO -> values.set(i, 0L);
                case PAD -> {
                    if (before != null) {
                        values.set(i, before);
                    }
                }
                case LINEAR -> {
                    Object after = null;
                    for (int j = i + 1; j < values.size() && after == null; j++) {
                        if (FieldPaths.isValid(values.get(j))) {
                            after = values.get(j);
                        }
                    }
                    if (after == null) {
                        return;
                    }
                    if (FieldPaths.isNumeric(before) && FieldPaths.isNumeric(after)) {
                        values.set(i, (((Number) before).doubleValue() + ((Number) after).doubleValue()) / 2);
                    }
                }
            }
        }
    }

    // -- linear

    private List<Event> linearFill(Event event) {
        String fieldPath = fieldSpec.get(0);
        List<String> path = FieldPaths.split(fieldPath);

        boolean valid = true;
        if (!FieldPaths.hasPath(event.getData(), path)) {
            logger.warn("Path [{}] does not exist in event at {}, skipping fill", fieldPath, event.getKey());
        } else {
            Object value = event.get(path);
            if (value instanceof List<?>) {
                Map<String, Object> data = FieldPaths.thaw(event.getData());
                @SuppressWarnings("unchecked")
                List<Object> list = (List<Object>) FieldPaths.get(data, path);
                fillList(list);
                event = event.setData(data);
            } else {
                valid = FieldPaths.isValid(value);
            }
        }

        List<Event> result = new ArrayList<>();
        if (valid && linearFillCache.isEmpty()) {
            lastGoodLinear = event;
            result.add(event);
        } else if (!valid && lastGoodLinear != null) {
            linearFillCache.add(event);
            if (limitReached(linearFillCache.size())) {
                result.addAll(linearFillCache);
                linearFillCache.clear();
                lastGoodLinear = null;
            }
        } else if (!valid) {
            result.add(event);
        } else {
            List<Event> run = new ArrayList<>(linearFillCache.size() + 2);
            run.add(lastGoodLinear);
            run.addAll(linearFillCache);
            run.add(event);
            List<Event> interpolated = interpolate(run, path);
            result.addAll(interpolated.subList(1, interpolated.size()));
            linearFillCache.clear();
            lastGoodLinear = event;
        }
        return result;
    }

    /**
     * Fills each missing value of a run with the mean of the value before it, which may itself
     * have been filled, and the next valid value. The first and last events are never changed.
     */
    private List<Event> interpolate(List<Event> run, List<String> path) {
        for (Event event : run) {
            Object value = event.get(path);
            if (FieldPaths.isValid(value) && !FieldPaths.isNumeric(value)) {
                logger.warn("Linear fill needs numeric values, leaving [{}] unfilled", FieldPaths.join(path));
                return run;
            }
        }
        List<Event> filled = new ArrayList<>(run.size());
        for (int i = 0; i < run.size(); i++) {
            Event event = run.get(i);
            if (i == 0 || i == run.size() - 1 || FieldPaths.isValid(event.get(path))) {
                filled.add(event);
                continue;
            }
            Object before = filled.get(i - 1).get(path);
            Object after = null;
            for (int j = i + 1; j < run.size() && after == null; j++) {
                Object candidate = run.get(j).get(path);
                if (FieldPaths.isValid(candidate)) {
                    after = candidate;
                }
            }
            if (FieldPaths.isNumeric(before) && FieldPaths.isNumeric(after)) {
                double mean = (((Number) before).doubleValue() + ((Number) after).doubleValue()) / 2;
                filled.add(event.setData(FieldPaths.with(event.getData(), path, mean)));
            } else {
                filled.add(event);
            }
        }
        return filled;
    }
}
