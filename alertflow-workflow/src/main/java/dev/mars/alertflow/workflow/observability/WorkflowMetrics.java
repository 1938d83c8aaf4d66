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

package dev.mars.alertflow.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for workflow document handling.
 *
 * Provides 4 metrics:
 * - alertflow.workflow.parsed (counter) - Documents parsed into definitions
 * - alertflow.workflow.parse.failed (counter) - Documents rejected, by failure class
 * - alertflow.workflow.serialized (counter) - Definitions serialized to text
 * - alertflow.workflow.parse.duration.seconds (histogram) - Parse duration distribution
 *
 * Recording is a no-op unless an OpenTelemetry SDK has been registered globally.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 * @version 1.0 (OpenTelemetry)
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "alertflow-workflow";

    private static WorkflowMetrics instance;

    private final LongCounter workflowsParsed;
    private final LongCounter parseFailures;
    private final LongCounter workflowsSerialized;
    private final DoubleHistogram parseDuration;

    // Local tallies, readable without an SDK
    private final AtomicLong parsedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final AtomicLong serializedCount = new AtomicLong(0);

    private static final AttributeKey<String> FAILURE_CLASS_KEY = AttributeKey.stringKey("failure.class");
    private static final AttributeKey<String> LEGACY_WRAPPER_KEY = AttributeKey.stringKey("document.wrapper");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        workflowsParsed = meter.counterBuilder("alertflow.workflow.parsed")
                .setDescription("Number of workflow documents parsed into definitions")
                .setUnit("1")
                .build();

        parseFailures = meter.counterBuilder("alertflow.workflow.parse.failed")
                .setDescription("Number of workflow documents rejected by the parser")
                .setUnit("1")
                .build();

        workflowsSerialized = meter.counterBuilder("alertflow.workflow.serialized")
                .setDescription("Number of definitions serialized to workflow documents")
                .setUnit("1")
                .build();

        parseDuration = meter.histogramBuilder("alertflow.workflow.parse.duration.seconds")
                .setDescription("Workflow document parse duration in seconds")
                .setUnit("s")
                .build();

        logger.debug("WorkflowMetrics initialized");
    }

    /**
     * Get the singleton instance of WorkflowMetrics.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    /**
     * Record a document parsed successfully.
     *
     * @param wrapper the top-level key the payload was found under
     */
    public void recordParsed(String wrapper, double durationSeconds) {
        Attributes attrs = Attributes.of(LEGACY_WRAPPER_KEY, wrapper);
        workflowsParsed.add(1, attrs);
        parseDuration.record(durationSeconds, attrs);
        parsedCount.incrementAndGet();
    }

    /**
     * Record a document the parser rejected.
     *
     * @param failureClass simple name of the exception raised
     */
    public void recordParseFailed(String failureClass) {
        parseFailures.add(1, Attributes.of(FAILURE_CLASS_KEY,
                failureClass != null ? failureClass : "unknown"));
        failedCount.incrementAndGet();
    }

    /**
     * Record a definition serialized to text.
     */
    public void recordSerialized() {
        workflowsSerialized.add(1);
        serializedCount.incrementAndGet();
    }

    public long getParsedCount() {
        return parsedCount.get();
    }

    public long getFailedCount() {
        return failedCount.get();
    }

    public long getSerializedCount() {
        return serializedCount.get();
    }
}
