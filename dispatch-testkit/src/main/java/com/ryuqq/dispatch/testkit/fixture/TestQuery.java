package com.ryuqq.dispatch.testkit.fixture;

import com.ryuqq.dispatch.core.contract.MessageType;
import com.ryuqq.dispatch.core.contract.Query;

/**
 * Sample query used by contract tests.
 *
 * @param id looked-up identifier
 *
 * @author Dispatch Team
 * @since 1.0.0
 */
public record TestQuery(String id) implements Query<String> {

    public static final MessageType TYPE = MessageType.of("test.query");

    @Override
    public MessageType type() {
        return TYPE;
    }
}
