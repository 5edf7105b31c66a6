package com.agentbacktest.common.provider;

/**
 * Raw answer of a {@link DecisionProvider}.
 *
 * @param content JSON document expected to bind to the role's payload type
 */
public record ProviderReply(
    String content,
    double confidence,
    String rationale
) {}
