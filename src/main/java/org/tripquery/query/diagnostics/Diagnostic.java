/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.diagnostics;

import java.util.Locale;

/**
 * A data-quality degradation observed while executing a plan. Diagnostics never stop execution; the
 * stage that reports one has already substituted its documented fallback.
 *
 * @param code what kind of degradation occurred
 * @param stage name of the stage that observed it, e.g. {@code "filter"} or {@code "rollup.bucket"}
 * @param message human readable detail
 */
public record Diagnostic(Code code, String stage, String message) {

    /**
     * Kinds of degradation.
     */
    public enum Code {
        /** An operation name outside the supported set. */
        UNKNOWN_OPERATION,
        /** A timestamp that could not be parsed. */
        UNPARSEABLE_TIMESTAMP,
        /** An operation argument of the wrong shape. */
        MALFORMED_ARGUMENT,
        /** A limit that cannot truncate anything. */
        IGNORED_LIMIT,
        /** A summary key that is not an ISO date. */
        UNPARSEABLE_DATE,
        /** A value the merge expected but did not find. */
        MISSING_VALUE
    }

    public static Diagnostic of(Code code, String stage, String format, Object... args) {
        return new Diagnostic(code, stage, String.format(Locale.ROOT, format, args));
    }

    @Override
    public String toString() {
        return "[" + stage + "] " + code + ": " + message;
    }
}
