/**
 * Contract test base class.
 *
 * <p>Extend {@link com.ryuqq.dispatch.testkit.contract.AbstractContractTest} to verify a bus
 * configuration against the dispatch contract with deterministic time.</p>
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.testkit.contract;
