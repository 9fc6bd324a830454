/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.pipeline;

import org.opensearch.common.settings.Settings;
import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.pond.PondSettings;
import org.opensearch.pond.core.exception.IndexException;
import org.opensearch.pond.core.exception.PipelineException;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.model.EventCollection;
import org.opensearch.pond.core.model.EventType;
import org.opensearch.pond.core.model.Index;
import org.opensearch.pond.core.model.TimeSeries;
import org.opensearch.pond.core.utils.XContentUtils;
import org.opensearch.pond.query.function.Reducer;
import org.opensearch.pond.query.processor.Aggregator;
import org.opensearch.pond.query.processor.Align;
import org.opensearch.pond.query.processor.AlignMethod;
import org.opensearch.pond.query.processor.Collapser;
import org.opensearch.pond.query.processor.ConversionAlignment;
import org.opensearch.pond.query.processor.Converter;
import org.opensearch.pond.query.processor.FillMethod;
import org.opensearch.pond.query.processor.Filler;
import org.opensearch.pond.query.processor.Filter;
import org.opensearch.pond.query.processor.Mapper;
import org.opensearch.pond.query.processor.Offset;
import org.opensearch.pond.query.processor.Processor;
import org.opensearch.pond.query.processor.Rate;
import org.opensearch.pond.query.processor.Selector;
import org.opensearch.pond.query.processor.Taker;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An immutable description of how to process a stream of events.
 *
 * <p>A pipeline holds a source, windowing, grouping and emission settings, and a chain of
 * processors. Every chain method returns a new pipeline; the processors of the original are
 * shared, never changed.</p>
 *
 * <pre>{@code
 * Map<String, EventCollection> result = new Pipeline()
 *     .from(series)
 *     .windowBy("1h")
 *     .emitOn("discard")
 *     .aggregate(Map.of("in_avg", Aggregation.of("in", Reducers.avg())))
 *     .clearWindow()
 *     .toKeyedCollections();
 * }</pre>
 *
 * <h2>Evaluation</h2>
 * <ul>
 *   <li><strong>Batch</strong> (source is an {@link EventCollection} or {@link TimeSeries}): the
 *   {@code to...} methods run a {@link Runner} that pushes every event through fresh copies of the
 *   processors and flushes them at the end.</li>
 *   <li><strong>Stream</strong> (source is an {@link EventStream}): {@link #to(Consumer)} and
 *   {@link #toCollections(CollectionCallback)} subscribe fresh copies of the processors to the
 *   stream; events flow as the caller adds them and {@link EventStream#stop()} flushes.</li>
 * </ul>
 */
public final class Pipeline implements ToXContentObject {

    private final Settings settings;

    private EventCollection boundedInput;
    private EventStream streamInput;
    private PipelineMode mode;
    private List<Processor> processors = Collections.emptyList();
    private Function<Event, Object> groupBy;
    private WindowType windowType = WindowType.GLOBAL;
    private String windowDuration;
    private EmitPolicy emitOn;
    private boolean utc;

    /**
     * Reports the size of each emitted collection.
     */
    @FunctionalInterface
    public interface CountCallback {
        void onCount(long count, String windowKey, String groupByKey);
    }

    public Pipeline() {
        this(Settings.EMPTY);
    }

    /**
     * @param settings defaults for emit policy, UTC windowing and processor options, see {@link PondSettings}
     */
    public Pipeline(Settings settings) {
        this.settings = settings;
        this.emitOn = EmitPolicy.fromString(PondSettings.EMIT_ON.get(settings));
        this.utc = PondSettings.UTC.get(settings);
    }

    private Pipeline copy() {
        Pipeline copy = new Pipeline(settings);
        copy.boundedInput = boundedInput;
        copy.streamInput = streamInput;
        copy.mode = mode;
        copy.processors = processors;
        copy.groupBy = groupBy;
        copy.windowType = windowType;
        copy.windowDuration = windowDuration;
        copy.emitOn = emitOn;
        copy.utc = utc;
        return copy;
    }

    private Pipeline append(Processor processor) {
        List<Processor> appended = new ArrayList<>(processors.size() + 1);
        appended.addAll(processors);
        appended.add(processor);
        Pipeline copy = copy();
        copy.processors = Collections.unmodifiableList(appended);
        return copy;
    }

    // -- configuration

    public Pipeline windowBy(String window) {
        return windowBy(window, utc);
    }

    /**
     * Sets the windowing: {@code "daily"}, {@code "monthly"}, {@code "yearly"}, a fixed duration
     * such as {@code "5m"}, or null for a single global window.
     *
     * @param utc compute calendar windows in UTC rather than in the local zone
     * @throws PipelineException for a malformed fixed window
     */
    public Pipeline windowBy(String window, boolean utc) {
        Pipeline copy = copy();
        copy.utc = utc;
        if (window == null) {
            copy.windowType = WindowType.GLOBAL;
            copy.windowDuration = null;
        } else if (WindowType.calendarWindow(window) != null) {
            copy.windowType = WindowType.calendarWindow(window);
            copy.windowDuration = null;
        } else {
            try {
                Index.windowDuration(window);
            } catch (IndexException e) {
                throw new PipelineException("invalid window: " + e.getMessage(), e);
            }
            copy.windowType = WindowType.FIXED;
            copy.windowDuration = window;
        }
        return copy;
    }

    public Pipeline clearWindow() {
        return windowBy(null, utc);
    }

    public Pipeline groupBy(Function<Event, Object> groupBy) {
        Pipeline copy = copy();
        copy.groupBy = groupBy;
        return copy;
    }

    /**
     * Groups by the value at a dotted field path.
     */
    public Pipeline groupBy(String fieldPath) {
        return groupBy(event -> event.get(fieldPath));
    }

    public Pipeline groupBy(List<String> fieldPath) {
        List<String> path = List.copyOf(fieldPath);
        return groupBy(event -> event.get(path));
    }

    public Pipeline clearGroupBy() {
        return groupBy((Function<Event, Object>) null);
    }

    /**
     * @param policy {@code "eachEvent"}, {@code "discard"} or {@code "flush"}
     * @throws PipelineException for any other value
     */
    public Pipeline emitOn(String policy) {
        return emitOn(EmitPolicy.fromString(policy));
    }

    public Pipeline emitOn(EmitPolicy policy) {
        if (policy == null) {
            throw new PipelineException("emit policy must not be null");
        }
        Pipeline copy = copy();
        copy.emitOn = policy;
        return copy;
    }

    public Pipeline from(EventCollection collection) {
        if (collection == null) {
            throw new PipelineException("pipeline source must not be null");
        }
        Pipeline copy = copy();
        copy.boundedInput = collection;
        copy.streamInput = null;
        copy.mode = PipelineMode.BATCH;
        return copy;
    }

    public Pipeline from(TimeSeries series) {
        if (series == null) {
            throw new PipelineException("pipeline source must not be null");
        }
        return from(series.getCollection());
    }

    public Pipeline from(EventStream stream) {
        if (stream == null) {
            throw new PipelineException("pipeline source must not be null");
        }
        Pipeline copy = copy();
        copy.boundedInput = null;
        copy.streamInput = stream;
        copy.mode = PipelineMode.STREAM;
        return copy;
    }

    // -- processors

    public Pipeline map(Function<Event, Event> op) {
        return append(new Mapper(this, op));
    }

    public Pipeline filter(Predicate<Event> op) {
        return append(new Filter(this, op));
    }

    /**
     * @param fieldSpec a dotted path or a list of dotted paths
     */
    public Pipeline select(Object fieldSpec) {
        return append(new Selector(this, fieldSpec));
    }

    public Pipeline collapse(List<String> fieldSpecList, String name, Reducer reducer, boolean append) {
        return append(new Collapser(this, fieldSpecList, name, reducer, append));
    }

    /**
     * Aggregates each window (and group) into one event per emission.
     *
     * @param fields output field name to the input field and reducer producing it
     */
    public Pipeline aggregate(Map<String, Aggregation> fields) {
        return append(new Aggregator(this, fields));
    }

    /**
     * @param fieldSpec a dotted path or a list of them; null means {@code "value"}
     * @param method {@code "zero"}, {@code "pad"} or {@code "linear"}
     * @param fillLimit maximum consecutive fills per field, null for no limit
     */
    public Pipeline fill(Object fieldSpec, String method, Integer fillLimit) {
        return fill(fieldSpec, FillMethod.fromString(method), fillLimit);
    }

    public Pipeline fill(Object fieldSpec, FillMethod method, Integer fillLimit) {
        return append(new Filler(this, fieldSpec, method, fillLimit));
    }

    /**
     * @param window boundary window such as {@code "1m"}; null uses {@link PondSettings#ALIGN_WINDOW}
     * @param method {@code "linear"} or {@code "hold"}; null uses {@link PondSettings#ALIGN_METHOD}
     * @param limit maximum boundaries to fill between two events, null for no limit
     */
    public Pipeline align(Object fieldSpec, String window, String method, Integer limit) {
        return append(new Align(this, fieldSpec, window, method == null ? null : AlignMethod.fromString(method), limit));
    }

    /**
     * @param allowNegative keep negative rates; null uses {@link PondSettings#RATE_ALLOW_NEGATIVE}
     */
    public Pipeline rate(Object fieldSpec, Boolean allowNegative) {
        return append(new Rate(this, fieldSpec, allowNegative));
    }

    public Pipeline take(int limit) {
        return append(new Taker(this, limit));
    }

    public Pipeline offsetBy(double by, Object fieldSpec) {
        return append(new Offset(this, by, fieldSpec));
    }

    /**
     * Converts events to point events.
     *
     * @param alignment {@code "lag"}, {@code "center"} or {@code "lead"}; null means center
     */
    public Pipeline asEvents(String alignment) {
        return append(new Converter(this, EventType.TIME, null, alignmentOrCenter(alignment)));
    }

    /**
     * @param alignment {@code "front"}, {@code "center"} or {@code "behind"}; null means center
     * @param duration length of the ranges built from point events, such as {@code "1h"}
     */
    public Pipeline asTimeRangeEvents(String alignment, String duration) {
        return append(new Converter(this, EventType.TIME_RANGE, duration, alignmentOrCenter(alignment)));
    }

    /**
     * @param duration fixed window used to index point events, such as {@code "5m"}
     */
    public Pipeline asIndexedEvents(String duration) {
        return append(new Converter(this, EventType.INDEXED, duration, ConversionAlignment.CENTER));
    }

    private static ConversionAlignment alignmentOrCenter(String alignment) {
        return alignment == null ? ConversionAlignment.CENTER : ConversionAlignment.fromString(alignment);
    }

    // -- evaluation

    private void to(PipelineOutput output) {
        if (mode == null) {
            throw new PipelineException("pipeline has no source, call from() first");
        }
        if (mode == PipelineMode.BATCH) {
            new Runner(this, output).start(true);
        } else {
            for (Processor processor : processors) {
                if (processor instanceof Aggregator && processor.getPipeline().getWindowType() == WindowType.GLOBAL) {
                    throw new PipelineException("Unable to aggregate a stream without a window, call windowBy() before aggregate()");
                }
            }
            streamInput.addObserver(Runner.instantiate(Runner.chain(this), output));
        }
    }

    private void requireBatch(String operation) {
        if (mode != PipelineMode.BATCH) {
            throw new PipelineException(String.format(Locale.ROOT, "%s needs a bounded source, use to() with a stream", operation));
        }
    }

    /**
     * Runs a batch pipeline and returns the emitted events.
     */
    public List<Event> toEventList() {
        requireBatch("toEventList");
        EventOut output = new EventOut(this, null);
        to(output);
        return output.getResults();
    }

    /**
     * Runs a batch pipeline and returns the emitted collections by result key, see {@link CollectionOut}.
     */
    public Map<String, EventCollection> toKeyedCollections() {
        requireBatch("toKeyedCollections");
        CollectionOut output = new CollectionOut(this, null);
        to(output);
        return output.getResults();
    }

    /**
     * Sends every output event to {@code callback}: immediately for a batch pipeline, as events
     * are added for a stream.
     */
    public Pipeline to(Consumer<Event> callback) {
        to(new EventOut(this, callback));
        return this;
    }

    public Pipeline toCollections(CollectionCallback callback) {
        to(new CollectionOut(this, callback));
        return this;
    }

    public Pipeline count(CountCallback callback) {
        return toCollections((collection, windowKey, groupByKey) -> callback.onCount(collection.size(), windowKey, groupByKey));
    }

    // -- accessors

    public Settings getSettings() {
        return settings;
    }

    public PipelineMode getMode() {
        return mode;
    }

    public EventCollection getBoundedInput() {
        return boundedInput;
    }

    public EventStream getStreamInput() {
        return streamInput;
    }

    public List<Processor> getProcessors() {
        return processors;
    }

    public Processor first() {
        return processors.isEmpty() ? null : processors.get(0);
    }

    public Processor last() {
        return processors.isEmpty() ? null : processors.get(processors.size() - 1);
    }

    public Function<Event, Object> getGroupBy() {
        return groupBy;
    }

    public WindowType getWindowType() {
        return windowType;
    }

    public String getWindowDuration() {
        return windowDuration;
    }

    public EmitPolicy getEmitOn() {
        return emitOn;
    }

    public boolean isUtc() {
        return utc;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("mode", mode == null ? null : mode.name().toLowerCase(Locale.ROOT));
        builder.field("window", windowType.getName());
        if (windowDuration != null) {
            builder.field("window_duration", windowDuration);
        }
        builder.field("utc", utc);
        builder.field("emit_on", emitOn.getName());
        builder.field("grouped", groupBy != null);
        builder.startArray("processors");
        for (Processor processor : processors) {
            processor.toXContent(builder, params);
        }
        builder.endArray();
        builder.endObject();
        return builder;
    }

    @Override
    public String toString() {
        return XContentUtils.toJsonString(this);
    }
}
