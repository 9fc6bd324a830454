/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.processor;

import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.pond.core.exception.IndexException;
import org.opensearch.pond.core.exception.ProcessorException;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.model.EventType;
import org.opensearch.pond.core.model.Index;
import org.opensearch.pond.core.model.IndexedEvent;
import org.opensearch.pond.core.model.TimeEvent;
import org.opensearch.pond.core.model.TimeRange;
import org.opensearch.pond.core.model.TimeRangeEvent;
import org.opensearch.pond.query.pipeline.Pipeline;

import java.io.IOException;
import java.util.Locale;

/**
 * Converts events to another variant.
 *
 * <h2>Conversions</h2>
 * <ul>
 *   <li><strong>point to range</strong>: a range of the configured duration placed {@code front},
 *   {@code center} or {@code behind} the timestamp</li>
 *   <li><strong>point to indexed</strong>: the fixed window of the configured duration holding the timestamp</li>
 *   <li><strong>range or indexed to point</strong>: the begin ({@code lag}), middle ({@code center})
 *   or end ({@code lead}) of the range</li>
 *   <li><strong>indexed to range</strong>: the range the index covers</li>
 * </ul>
 *
 * <p>Range events cannot become indexed events, since a range does not name a bucket.</p>
 */
public class Converter extends Processor {

    public static final String NAME = "convert";

    private final EventType targetType;
    private final String duration;
    private final long durationMillis;
    private final ConversionAlignment alignment;

    /**
     * @param targetType variant to convert to
     * @param duration window string such as {@code "1h"}, needed when converting points to ranges or indexes
     * @param alignment placement of the converted event; null means center
     */
    public Converter(Pipeline pipeline, EventType targetType, String duration, ConversionAlignment alignment) {
        super(pipeline);
        if (targetType == null) {
            throw new ProcessorException("Converter needs a target event type");
        }
        this.targetType = targetType;
        this.duration = duration;
        this.alignment = alignment == null ? ConversionAlignment.CENTER : alignment;
        if (duration != null) {
            try {
                this.durationMillis = Index.windowDuration(duration);
            } catch (IndexException e) {
                throw new ProcessorException("Converter duration is invalid: " + e.getMessage(), e);
            }
        } else {
            this.durationMillis = 0;
        }
    }

    private Converter(Converter other) {
        super(other);
        this.targetType = other.targetType;
        this.duration = other.duration;
        this.durationMillis = other.durationMillis;
        this.alignment = other.alignment;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Converter copy() {
        return new Converter(this);
    }

    @Override
    protected void optionsToXContent(XContentBuilder builder) throws IOException {
        builder.field("type", targetType.getKeyName());
        if (duration != null) {
            builder.field("duration", duration);
        }
        builder.field("alignment", alignment.getName());
    }

    @Override
    public void addEvent(Event event) {
        if (!hasObservers()) {
            return;
        }
        Event converted = switch (event.getType()) {
            case TIME -> convertTimeEvent((TimeEvent) event);
            case TIME_RANGE -> convertTimeRangeEvent((TimeRangeEvent) event);
            case INDEXED -> convertIndexedEvent((IndexedEvent) event);
        };
        emit(converted);
    }

    private Event convertTimeEvent(TimeEvent event) {
        long timestamp = event.getTimestamp();
        return switch (targetType) {
            case TIME -> event;
            case TIME_RANGE -> {
                requireDuration();
                TimeRange range = switch (alignment) {
                    case FRONT -> new TimeRange(timestamp, timestamp + durationMillis);
                    case CENTER -> new TimeRange(timestamp - durationMillis / 2, timestamp + durationMillis / 2);
                    case BEHIND -> new TimeRange(timestamp - durationMillis, timestamp);
                    default -> throw unsupportedAlignment("a point event to a range event");
                };
                yield new TimeRangeEvent(range, event.getData());
            }
            case INDEXED -> {
                requireDuration();
                yield new IndexedEvent(Index.getIndexString(duration, timestamp), event.getData(), getPipeline().isUtc());
            }
        };
    }

    private Event convertTimeRangeEvent(TimeRangeEvent event) {
        return switch (targetType) {
            case TIME -> new TimeEvent(pointOf(event.getTimeRange()), event.getData());
            case TIME_RANGE -> event;
            case INDEXED -> throw new ProcessorException("Unable to convert a range event to an indexed event");
        };
    }

    private Event convertIndexedEvent(IndexedEvent event) {
        return switch (targetType) {
            case TIME -> new TimeEvent(pointOf(event.getTimeRange()), event.getData());
            case TIME_RANGE -> new TimeRangeEvent(event.getTimeRange(), event.getData());
            case INDEXED -> event;
        };
    }

    private long pointOf(TimeRange range) {
        return switch (alignment) {
            case LAG -> range.getBegin();
            case CENTER -> (range.getBegin() + range.getEnd()) / 2;
            case LEAD -> range.getEnd();
            default -> throw unsupportedAlignment("a range to a point event");
        };
    }

    private void requireDuration() {
        if (duration == null) {
            throw new ProcessorException(String.format(Locale.ROOT, "Converting point events to %s needs a duration", targetType));
        }
    }

    private ProcessorException unsupportedAlignment(String conversion) {
        return new ProcessorException(String.format(Locale.ROOT, "Alignment %s is not supported when converting %s", alignment.getName(), conversion));
    }
}
