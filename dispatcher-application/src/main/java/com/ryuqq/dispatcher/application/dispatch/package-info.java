/**
 * Dispatch ports: building an invocation adapter for the chosen service and the
 * select-build-submit facade.
 *
 * <p>Implementations live in {@code dispatcher-adapter-invoker}.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.application.dispatch;
