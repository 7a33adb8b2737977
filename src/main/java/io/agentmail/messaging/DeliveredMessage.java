package io.agentmail.messaging;

import io.agentmail.model.Message;
import io.agentmail.model.MessageRecipient;

import java.util.List;

public record DeliveredMessage(Message message, List<MessageRecipient> recipients) {
}
