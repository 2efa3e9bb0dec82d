/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.query.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sink that keeps diagnostics in report order so a caller can return them alongside the result rows.
 * Optionally forwards each diagnostic to another sink as well.
 *
 * <p>Not thread-safe; use one instance per execution.</p>
 */
public final class CollectingDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final DiagnosticSink delegate;

    public CollectingDiagnosticSink() {
        this(DiagnosticSink.NOOP);
    }

    public CollectingDiagnosticSink(DiagnosticSink delegate) {
        this.delegate = delegate;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        delegate.report(diagnostic);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hasCode(Diagnostic.Code code) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.code() == code) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}
