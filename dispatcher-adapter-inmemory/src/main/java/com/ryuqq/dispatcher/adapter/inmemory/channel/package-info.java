/**
 * In-memory message channel used by the queue invocation adapter in tests.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.adapter.inmemory.channel;
