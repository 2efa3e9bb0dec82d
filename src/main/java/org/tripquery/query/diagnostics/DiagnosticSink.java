/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.diagnostics;

/**
 * Receives the diagnostics reported while a plan executes. Passed into each execution, so the pure
 * transformations stay independent of where diagnostics end up.
 */
@FunctionalInterface
public interface DiagnosticSink {

    /** Sink that discards everything. */
    DiagnosticSink NOOP = diagnostic -> {};

    void report(Diagnostic diagnostic);
}
