/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the capability interfaces the retry loop consumes.
 * Hosts and callers provide the implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.spi.Reporter} - Receives final diagnostics and the abandonment signal</li>
 *   <li>{@link com.ryuqq.retry.core.spi.Retryer} - Decides before each attempt whether another attempt runs</li>
 *   <li>{@link com.ryuqq.retry.core.spi.RetryClock} - Time source used by the built-in policies</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>{@code retry-junit} adapts {@code Reporter} to JUnit 5. {@code retry-testkit}
 * provides an in-memory {@code Reporter} for contract tests. The built-in
 * {@code Retryer} implementations live in {@code com.ryuqq.retry.core.policy}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.core.spi;
