/**
 * JUnit 5 Adapter.
 *
 * <p>Adapts the {@link com.ryuqq.retry.core.spi.Reporter} SPI to JUnit 5: exhaustion
 * fails the calling test with an {@link org.opentest4j.AssertionFailedError}.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.adapter.junit.JUnitReporter} - Reporter that logs diagnostics and throws on abandonment</li>
 *   <li>{@link com.ryuqq.retry.adapter.junit.RetryAssertions} - {@code eventually(...)} entry points for test code</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.adapter.junit;
