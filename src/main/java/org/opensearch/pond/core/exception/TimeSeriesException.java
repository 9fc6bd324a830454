/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.exception;

/**
 * Raised when a time series cannot be built, for instance from out-of-order points.
 */
public class TimeSeriesException extends PondException {

    public TimeSeriesException(String message) {
        super(message);
    }

    public TimeSeriesException(String message, Throwable cause) {
        super(message, cause);
    }
}
