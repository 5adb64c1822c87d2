/**
 * Invocation lifecycle state machine.
 *
 * <p>Each in-flight invocation moves through these states exactly once, which is
 * how the "one Completion Notification per operation" rule is enforced.</p>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → IN_PROGRESS (submitted)
 * PENDING → FAILED (submission failed)
 * IN_PROGRESS → COMPLETED (Ok delivered)
 * IN_PROGRESS → FAILED (Fail delivered)
 *
 * Forbidden:
 * - COMPLETED → * (terminal state)
 * - FAILED → * (terminal state)
 * </pre>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.core.statemachine;
