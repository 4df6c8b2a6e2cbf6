/**
 * Test support for the retry harness.
 *
 * <ul>
 *   <li>{@link com.ryuqq.retry.testkit.RecordingReporter} - In-memory reporter that records instead of failing</li>
 *   <li>{@link com.ryuqq.retry.testkit.SlowMarker} - Delayed flag for "finished fast" assertions</li>
 *   <li>{@link com.ryuqq.retry.testkit.AbstractRetryContractTest} - Base class with counting and timing helpers</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.testkit;
