/**
 * Attempt context package.
 *
 * <p>The object handed to a check function on every attempt, plus the pieces it is built from.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.context.AttemptContext} - Fail flag, recording methods and the abort signal</li>
 *   <li>{@link com.ryuqq.retry.core.context.AttemptSession} - Loop-side owner of the context: clears failures, records thrown exceptions, dedups output</li>
 *   <li>{@link com.ryuqq.retry.core.context.OutputLog} - Run-wide diagnostic lines with order-preserving dedup</li>
 *   <li>{@link com.ryuqq.retry.core.context.CallSite} - {@code File.java:line} prefix captured at the public API boundary</li>
 *   <li>{@link com.ryuqq.retry.core.context.AttemptAbortedSignal} - Unwinds the current attempt only</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.core.context;
