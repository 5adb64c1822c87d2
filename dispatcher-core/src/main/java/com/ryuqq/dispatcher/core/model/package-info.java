/**
 * Operation and request value types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.model.Operation} - the unit of work; only its output format is mutable</li>
 *   <li>{@link com.ryuqq.dispatcher.core.model.Source} / {@link com.ryuqq.dispatcher.core.model.Granule} - resolved inputs</li>
 *   <li>{@link com.ryuqq.dispatcher.core.model.RequestContext} - caller's acceptable media types in preference order</li>
 *   <li>{@link com.ryuqq.dispatcher.core.model.MediaTypes} - wildcard media type matching</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.model;
