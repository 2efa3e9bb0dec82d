/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.config;

import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;
import org.tripquery.TripQueryEngine;
import org.tripquery.TripQueryTestCase;
import org.tripquery.query.filter.UnknownFilterPolicy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class EngineConfigTests extends TripQueryTestCase {

    public void testDefaults() {
        EngineConfig config = EngineConfig.defaultConfig();

        assertEquals(10, config.getTopK());
        assertEquals(UnknownFilterPolicy.PASS, config.getUnknownFilterPolicy());
        assertEquals(TimeValue.timeValueSeconds(30), config.getFetchTimeout());
        assertEquals(4, config.getMaxConcurrentFetches());
    }

    public void testSettingsOverrides() {
        int topK = randomIntBetween(1, 1000);
        Settings settings = Settings.builder()
            .put(EngineConfig.ROLLUP_TOP_K.getKey(), topK)
            .put(EngineConfig.UNKNOWN_FILTER_POLICY.getKey(), " REJECT ")
            .put(EngineConfig.FETCH_TIMEOUT.getKey(), "250ms")
            .put(EngineConfig.MAX_CONCURRENT_FETCHES.getKey(), 16)
            .build();

        EngineConfig config = new EngineConfig(settings);

        assertEquals(topK, config.getTopK());
        assertEquals(UnknownFilterPolicy.REJECT, config.getUnknownFilterPolicy());
        assertEquals(TimeValue.timeValueMillis(250), config.getFetchTimeout());
        assertEquals(16, config.getMaxConcurrentFetches());
    }

    public void testInvalidSettingsRejected() {
        Settings zeroTopK = Settings.builder().put(EngineConfig.ROLLUP_TOP_K.getKey(), 0).build();
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(zeroTopK));

        Settings tooManyFetches = Settings.builder().put(EngineConfig.MAX_CONCURRENT_FETCHES.getKey(), 65).build();
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(tooManyFetches));

        Settings badPolicy = Settings.builder().put(EngineConfig.UNKNOWN_FILTER_POLICY.getKey(), "ignore").build();
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(badPolicy));
    }

    public void testSettingsAreNodeScopedAndStatic() {
        for (Setting<?> setting : TripQueryEngine.getSettings()) {
            assertTrue(setting.getKey(), setting.hasNodeScope());
            assertFalse(setting.getKey(), setting.isDynamic());
        }
    }

    public void testExplicitValues() {
        EngineConfig config = new EngineConfig(3, null, null, 1);

        assertEquals(3, config.getTopK());
        assertEquals(UnknownFilterPolicy.PASS, config.getUnknownFilterPolicy());
        assertEquals(EngineConfig.FETCH_TIMEOUT.getDefault(Settings.EMPTY), config.getFetchTimeout());

        IllegalArgumentException e = assertThrows(
            IllegalArgumentException.class,
            () -> new EngineConfig(0, UnknownFilterPolicy.PASS, TimeValue.timeValueSeconds(1), 1)
        );
        assertEquals("topK must be positive, got: 0", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(1, UnknownFilterPolicy.PASS, TimeValue.timeValueSeconds(1), -2));
    }
}
