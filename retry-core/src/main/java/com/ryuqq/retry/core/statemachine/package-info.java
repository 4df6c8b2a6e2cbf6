/**
 * Retry run state machine.
 *
 * <p>{@link com.ryuqq.retry.core.statemachine.RunState} lists the states of one retry run.
 * {@link com.ryuqq.retry.core.statemachine.StateTransition} rejects every transition
 * outside the four allowed ones. The retry loop routes each of its transitions through it.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.retry.core.statemachine;
