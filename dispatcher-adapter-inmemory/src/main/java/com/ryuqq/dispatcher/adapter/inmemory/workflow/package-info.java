/**
 * In-memory workflow engine used by the workflow invocation adapter in tests.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.adapter.inmemory.workflow;
