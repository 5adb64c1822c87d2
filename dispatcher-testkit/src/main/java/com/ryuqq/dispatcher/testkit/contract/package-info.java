/**
 * Shared fixtures for the dispatcher contract tests.
 *
 * <p>{@link com.ryuqq.dispatcher.testkit.contract.AbstractContractTest} wires the in-memory SPI
 * implementations together; {@link com.ryuqq.dispatcher.testkit.contract.ControlledProcess} stands in
 * for a spawned container whose exit the test decides.</p>
 */
package com.ryuqq.dispatcher.testkit.contract;
