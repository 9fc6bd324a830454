/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.utils;

import org.opensearch.common.xcontent.XContentFactory;
import org.opensearch.common.xcontent.json.JsonXContent;
import org.opensearch.core.common.bytes.BytesReference;
import org.opensearch.core.xcontent.DeprecationHandler;
import org.opensearch.core.xcontent.NamedXContentRegistry;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.core.xcontent.XContentParser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * JSON rendering and parsing on top of OpenSearch XContent.
 */
public final class XContentUtils {

    private XContentUtils() {}

    public static String toJsonString(ToXContent content) {
        try (XContentBuilder builder = XContentFactory.jsonBuilder()) {
            content.toXContent(builder, ToXContent.EMPTY_PARAMS);
            return BytesReference.bytes(builder).utf8ToString();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to render JSON", e);
        }
    }

    /**
     * Renders a plain value (map, list, number, string) as JSON.
     */
    public static String toJsonValue(Object value) {
        try (XContentBuilder builder = XContentFactory.jsonBuilder()) {
            builder.value(value);
            return BytesReference.bytes(builder).utf8ToString();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to render JSON", e);
        }
    }

    /**
     * Parses a JSON object into an insertion-ordered map.
     */
    public static Map<String, Object> parseMap(String json) throws IOException {
        try (
            XContentParser parser = JsonXContent.jsonXContent.createParser(
                NamedXContentRegistry.EMPTY,
                DeprecationHandler.THROW_UNSUPPORTED_OPERATION,
                json
            )
        ) {
            return parser.mapOrdered();
        }
    }
}
