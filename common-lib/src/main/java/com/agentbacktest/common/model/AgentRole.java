package com.agentbacktest.common.model;

import java.util.List;

/**
 * The nine agent roles of a decision cycle, grouped by the phase that consults them.
 * Each role is also a resilience channel: retries and circuit state are tracked per role.
 */
public enum AgentRole {
    MARKET_ANALYST(Group.ANALYST, TechnicalReport.class),
    SENTIMENT_ANALYST(Group.ANALYST, SentimentReport.class),
    NEWS_ANALYST(Group.ANALYST, NewsReport.class),
    FUNDAMENTALS_ANALYST(Group.ANALYST, FundamentalsReport.class),
    BULL_RESEARCHER(Group.RESEARCHER, ResearchThesis.class),
    BEAR_RESEARCHER(Group.RESEARCHER, ResearchThesis.class),
    AGGRESSIVE_DEBATOR(Group.RISK_DEBATOR, RiskPerspective.class),
    CONSERVATIVE_DEBATOR(Group.RISK_DEBATOR, RiskPerspective.class),
    NEUTRAL_DEBATOR(Group.RISK_DEBATOR, RiskPerspective.class);

    public enum Group { ANALYST, RESEARCHER, RISK_DEBATOR }

    private final Group group;
    private final Class<? extends OpinionPayload> payloadType;

    AgentRole(Group group, Class<? extends OpinionPayload> payloadType) {
        this.group = group;
        this.payloadType = payloadType;
    }

    public Group group() { return group; }

    public Class<? extends OpinionPayload> payloadType() { return payloadType; }

    /** Stance defended by a risk debator, {@code null} for every other role. */
    public RiskStance stance() {
        return switch (this) {
            case AGGRESSIVE_DEBATOR   -> RiskStance.AGGRESSIVE;
            case CONSERVATIVE_DEBATOR -> RiskStance.CONSERVATIVE;
            case NEUTRAL_DEBATOR      -> RiskStance.NEUTRAL;
            default                   -> null;
        };
    }

    /** Placeholder content used when the role's opinion could not be obtained or validated. */
    public OpinionPayload neutralPayload() {
        return switch (this) {
            case MARKET_ANALYST       -> TechnicalReport.neutral();
            case SENTIMENT_ANALYST    -> SentimentReport.neutral();
            case NEWS_ANALYST         -> NewsReport.neutral();
            case FUNDAMENTALS_ANALYST -> FundamentalsReport.neutral();
            case BULL_RESEARCHER, BEAR_RESEARCHER -> ResearchThesis.neutral();
            case AGGRESSIVE_DEBATOR, CONSERVATIVE_DEBATOR, NEUTRAL_DEBATOR ->
                RiskPerspective.neutral(stance());
        };
    }

    public static List<AgentRole> analysts() {
        return List.of(MARKET_ANALYST, SENTIMENT_ANALYST, NEWS_ANALYST, FUNDAMENTALS_ANALYST);
    }

    public static List<AgentRole> researchers() {
        return List.of(BULL_RESEARCHER, BEAR_RESEARCHER);
    }

    public static List<AgentRole> riskDebators() {
        return List.of(AGGRESSIVE_DEBATOR, CONSERVATIVE_DEBATOR, NEUTRAL_DEBATOR);
    }
}
