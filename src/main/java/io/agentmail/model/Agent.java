package io.agentmail.model;

public record Agent(
        long id,
        long projectId,
        String name,
        String program,
        String model,
        String taskDescription,
        long inceptionTs,
        long lastActiveTs,
        AttachmentsPolicy attachmentsPolicy,
        ContactPolicy contactPolicy,
        Long deregisteredTs,
        AgentState state
) {
    public boolean isActive() {
        return state == AgentState.ACTIVE;
    }
}
