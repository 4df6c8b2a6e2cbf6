/**
 * Retry loop package.
 *
 * <p>{@link com.ryuqq.retry.core.runner.Retry} is the entry point.
 * {@link com.ryuqq.retry.core.runner.RetryRunner} asks the policy whether to continue,
 * runs one attempt of the {@link com.ryuqq.retry.core.runner.CheckFunction} on its own
 * thread, and either loops or reports final failure through the reporter.</p>
 *
 * <h2>Architecture</h2>
 * <pre>
 * runner (Retry, RetryRunner)
 *   ↓ drives
 * spi (Retryer ← policy.Timer / policy.Counter)
 *   ↓ reports to
 * spi (Reporter ← retry-junit / retry-testkit)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.core.runner;
