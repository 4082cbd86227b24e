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


package dev.mars.flowsmith.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for workflow validation and diff application.
 *
 * Provides 6 metrics:
 * - flowsmith.validation.total (counter) - Workflow validations run
 * - flowsmith.validation.failed (counter) - Validations that produced errors
 * - flowsmith.validation.issues (counter) - Issues reported, by severity
 * - flowsmith.validation.duration.seconds (histogram) - Validation duration distribution
 * - flowsmith.diff.batches.applied (counter) - Diff batches accepted
 * - flowsmith.diff.batches.rejected (counter) - Diff batches rejected
 *
 * Without an OpenTelemetry SDK on the classpath every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0 (OpenTelemetry)
 */
public class ValidationMetrics {

    private static final Logger logger = Logger.getLogger(ValidationMetrics.class.getName());
    private static final String METER_NAME = "flowsmith-workflow";

    // Singleton instance
    private static ValidationMetrics instance;

    // Counters
    private final LongCounter validationsTotal;
    private final LongCounter validationsFailed;
    private final LongCounter issuesTotal;
    private final LongCounter diffBatchesApplied;
    private final LongCounter diffBatchesRejected;

    // Histograms
    private final DoubleHistogram validationDuration;

    // Attribute keys
    private static final AttributeKey<String> PROFILE_KEY = AttributeKey.stringKey("validation.profile");
    private static final AttributeKey<String> SEVERITY_KEY = AttributeKey.stringKey("issue.severity");
    private static final AttributeKey<String> MODE_KEY = AttributeKey.stringKey("diff.mode");

    private ValidationMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        validationsTotal = meter.counterBuilder("flowsmith.validation.total")
                .setDescription("Total number of workflow validations")
                .setUnit("1")
                .build();

        validationsFailed = meter.counterBuilder("flowsmith.validation.failed")
                .setDescription("Number of workflow validations that reported errors")
                .setUnit("1")
                .build();

        issuesTotal = meter.counterBuilder("flowsmith.validation.issues")
                .setDescription("Number of validation issues reported")
                .setUnit("1")
                .build();

        diffBatchesApplied = meter.counterBuilder("flowsmith.diff.batches.applied")
                .setDescription("Number of diff batches accepted")
                .setUnit("1")
                .build();

        diffBatchesRejected = meter.counterBuilder("flowsmith.diff.batches.rejected")
                .setDescription("Number of diff batches rejected")
                .setUnit("1")
                .build();

        validationDuration = meter.histogramBuilder("flowsmith.validation.duration.seconds")
                .setDescription("Workflow validation duration in seconds")
                .setUnit("s")
                .build();

        logger.info("ValidationMetrics initialized");
    }

    /**
     * Get the singleton instance of ValidationMetrics.
     */
    public static synchronized ValidationMetrics getInstance() {
        if (instance == null) {
            instance = new ValidationMetrics();
        }
        return instance;
    }

    /**
     * Record a finished workflow validation.
     */
    public void recordValidation(String profile, boolean valid, int errors, int warnings, double durationSeconds) {
        Attributes attrs = Attributes.of(PROFILE_KEY, profile);

        validationsTotal.add(1, attrs);
        if (!valid) {
            validationsFailed.add(1, attrs);
        }
        if (errors > 0) {
            issuesTotal.add(errors, Attributes.of(PROFILE_KEY, profile, SEVERITY_KEY, "error"));
        }
        if (warnings > 0) {
            issuesTotal.add(warnings, Attributes.of(PROFILE_KEY, profile, SEVERITY_KEY, "warning"));
        }
        validationDuration.record(durationSeconds, attrs);
    }

    /**
     * Record the outcome of a diff batch.
     */
    public void recordDiffBatch(boolean applied, boolean validateOnly) {
        Attributes attrs = Attributes.of(MODE_KEY, validateOnly ? "validate_only" : "apply");
        if (applied) {
            diffBatchesApplied.add(1, attrs);
        } else {
            diffBatchesRejected.add(1, attrs);
        }
    }
}
