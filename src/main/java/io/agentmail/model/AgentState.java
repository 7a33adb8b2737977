package io.agentmail.model;

public enum AgentState {
    ACTIVE,
    DEREGISTERED
}
