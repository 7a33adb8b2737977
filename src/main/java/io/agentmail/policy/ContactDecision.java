package io.agentmail.policy;

public record ContactDecision(boolean allowed, String reason) {
    public static final String RECIPIENT_INACTIVE = "recipient inactive";
    public static final String RECIPIENT_BLOCKS_ALL = "recipient blocks all contact";
    public static final String LINK_BLOCKED = "link blocked";
    public static final String NO_CONTACT_PATH = "no contact path";

    public static ContactDecision allow(String reason) {
        return new ContactDecision(true, reason);
    }

    public static ContactDecision deny(String reason) {
        return new ContactDecision(false, reason);
    }
}
