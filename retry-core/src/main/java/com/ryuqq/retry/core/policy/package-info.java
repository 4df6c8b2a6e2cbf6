/**
 * Built-in retry policies.
 *
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.policy.Timer} - Deadline based: retries every {@code waitMs} until {@code timeoutMs} has passed (default)</li>
 *   <li>{@link com.ryuqq.retry.core.policy.Counter} - Attempt-count based: at most {@code count} attempts</li>
 *   <li>{@link com.ryuqq.retry.core.policy.TimerConfig} - Immutable timeout/wait settings (defaults 2000ms / 25ms)</li>
 *   <li>{@link com.ryuqq.retry.core.policy.SystemRetryClock} - Wall-clock time source</li>
 * </ul>
 *
 * <p>Policies hold mutable progress state and are not thread-safe.
 * One instance drives one retry run at a time.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.core.policy;
