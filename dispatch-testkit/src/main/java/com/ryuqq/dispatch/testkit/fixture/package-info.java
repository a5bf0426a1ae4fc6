/**
 * Test fixtures: a manual clock, sample messages and scripted handlers.
 *
 * @since 1.0.0
 * @author Dispatch Team
 */
package com.ryuqq.dispatch.testkit.fixture;
