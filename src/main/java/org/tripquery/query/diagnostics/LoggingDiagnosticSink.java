/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.diagnostics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default sink: writes every diagnostic as a warning.
 */
public final class LoggingDiagnosticSink implements DiagnosticSink {

    private static final Logger logger = LogManager.getLogger(LoggingDiagnosticSink.class);

    /** Shared instance; the sink holds no state. */
    public static final LoggingDiagnosticSink INSTANCE = new LoggingDiagnosticSink();

    private LoggingDiagnosticSink() {}

    @Override
    public void report(Diagnostic diagnostic) {
        logger.warn("[{}] {}: {}", diagnostic.stage(), diagnostic.code(), diagnostic.message());
    }
}
