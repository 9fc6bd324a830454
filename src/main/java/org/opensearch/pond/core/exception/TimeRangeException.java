/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.exception;

/**
 * Raised when a time range is inverted or built from unusable values.
 */
public class TimeRangeException extends PondException {

    public TimeRangeException(String message) {
        super(message);
    }

    public TimeRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
