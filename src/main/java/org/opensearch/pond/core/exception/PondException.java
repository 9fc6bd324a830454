/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.exception;

/**
 * Root of the library's exception hierarchy.
 *
 * <p>Each subsystem raises its own subclass so callers can tell where a failure originated.
 * All of them are unchecked and surface to the immediate caller; nothing inside the library
 * retries or recovers.</p>
 */
public abstract class PondException extends RuntimeException {

    protected PondException(String message) {
        super(message);
    }

    protected PondException(String message, Throwable cause) {
        super(message, cause);
    }
}
