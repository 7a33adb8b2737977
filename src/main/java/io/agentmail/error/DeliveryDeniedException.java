package io.agentmail.error;

import java.util.List;
import java.util.Map;

public final class DeliveryDeniedException extends CoordinationException {
    private final List<DeniedRecipient> deniedRecipients;

    public DeliveryDeniedException(List<DeniedRecipient> deniedRecipients) {
        super(ErrorKind.DELIVERY_DENIED, describe(deniedRecipients), Map.of("denied", deniedRecipients));
        this.deniedRecipients = List.copyOf(deniedRecipients);
    }

    public List<DeniedRecipient> deniedRecipients() {
        return deniedRecipients;
    }

    private static String describe(List<DeniedRecipient> denied) {
        StringBuilder sb = new StringBuilder("Delivery denied for ");
        for (int i = 0; i < denied.size(); i++) {
            DeniedRecipient d = denied.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(d.agentName()).append(" (").append(d.reason()).append(')');
        }
        return sb.toString();
    }

    public record DeniedRecipient(long agentId, String agentName, String reason) {
    }
}
