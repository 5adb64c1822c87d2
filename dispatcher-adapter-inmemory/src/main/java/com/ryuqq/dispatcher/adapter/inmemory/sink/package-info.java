/**
 * In-memory Completion Sink.
 *
 * <p>Records notifications per operation and exposes latch-based waiting for tests.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.adapter.inmemory.sink;
