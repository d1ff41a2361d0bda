package dev.receiptly.conversation;

public enum ConversationRole {
    USER,
    ASSISTANT
}
