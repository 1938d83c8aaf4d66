/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.alertflow.builder.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the graph mutation store.
 *
 * Provides 3 metrics:
 * - alertflow.builder.mutations (counter) - Applied mutations, by operation
 * - alertflow.builder.mutations.rejected (counter) - Rejected mutations, by operation and reason
 * - alertflow.builder.violations (histogram) - Violations recorded after each mutation
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 * @version 1.0 (OpenTelemetry)
 */
public class BuilderMetrics {

    private static final Logger logger = LoggerFactory.getLogger(BuilderMetrics.class);
    private static final String METER_NAME = "alertflow-builder";

    private static BuilderMetrics instance;

    private final LongCounter mutations;
    private final LongCounter rejections;
    private final LongHistogram violations;

    private final AtomicLong mutationCount = new AtomicLong(0);
    private final AtomicLong rejectionCount = new AtomicLong(0);

    private static final AttributeKey<String> OPERATION_KEY = AttributeKey.stringKey("operation");
    private static final AttributeKey<String> REJECTION_KEY = AttributeKey.stringKey("rejection");

    private BuilderMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        mutations = meter.counterBuilder("alertflow.builder.mutations")
                .setDescription("Number of graph mutations applied")
                .setUnit("1")
                .build();

        rejections = meter.counterBuilder("alertflow.builder.mutations.rejected")
                .setDescription("Number of graph mutations rejected")
                .setUnit("1")
                .build();

        violations = meter.histogramBuilder("alertflow.builder.violations")
                .setDescription("Validation violations recorded after a mutation")
                .setUnit("1")
                .ofLongs()
                .build();

        logger.debug("BuilderMetrics initialized");
    }

    public static synchronized BuilderMetrics getInstance() {
        if (instance == null) {
            instance = new BuilderMetrics();
        }
        return instance;
    }

    public void recordMutation(String operation, int violationCount) {
        Attributes attrs = Attributes.of(OPERATION_KEY, operation);
        mutations.add(1, attrs);
        violations.record(violationCount, attrs);
        mutationCount.incrementAndGet();
    }

    public void recordRejected(String operation, String rejection) {
        rejections.add(1, Attributes.of(OPERATION_KEY, operation, REJECTION_KEY, rejection));
        rejectionCount.incrementAndGet();
    }

    public long getMutationCount() {
        return mutationCount.get();
    }

    public long getRejectionCount() {
        return rejectionCount.get();
    }
}
