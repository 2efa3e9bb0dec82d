/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.dispatch;

/**
 * A shard could not be fetched in time, or at all. Fails the whole request.
 */
public class ShardFetchException extends RuntimeException {

    private final String location;

    public ShardFetchException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /**
     * Location of the shard that failed, or {@code null} when the failure is not tied to one shard.
     */
    public String getLocation() {
        return location;
    }
}
