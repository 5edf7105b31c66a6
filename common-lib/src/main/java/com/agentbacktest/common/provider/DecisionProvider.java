package com.agentbacktest.common.provider;

import com.agentbacktest.common.model.AgentRole;

/**
 * Pluggable source of agent opinions. Implementations may block; callers run them on
 * a bounded-elastic scheduler behind a {@link com.agentbacktest.common.resilience.ResilientCaller}.
 *
 * <p>May fail with {@link com.agentbacktest.common.exception.ProviderTimeoutException},
 * {@link com.agentbacktest.common.exception.MalformedOutputException} or any runtime
 * exception, which is treated as a transient provider failure.
 */
public interface DecisionProvider {

    ProviderReply generate(AgentRole role, AgentContext context);

    /** Short label for logs. */
    default String providerName() {
        return getClass().getSimpleName();
    }
}
