package com.stormline.herald.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * One turn of a conversation transcript.
 *
 * <p>Assistant turns that request a tool carry {@code toolCall}; tool turns carry
 * the {@code toolCallId} and {@code toolName} of the request they answer.
 */
public record ConversationTurn(
        Role role,
        String content,
        ToolCallRequest toolCall,
        String toolCallId,
        String toolName
) {

    public enum Role {
        USER,
        ASSISTANT,
        TOOL;

        /**
         * Parse a role label, accepting the {@code human}/{@code ai} aliases.
         */
        public static Optional<Role> parse(String label) {
            if (label == null) {
                return Optional.empty();
            }
            return switch (label.trim().toLowerCase(Locale.ROOT)) {
                case "user", "human" -> Optional.of(USER);
                case "assistant", "ai" -> Optional.of(ASSISTANT);
                case "tool" -> Optional.of(TOOL);
                default -> Optional.empty();
            };
        }

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Role.USER, content, null, null, null);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Role.ASSISTANT, content, null, null, null);
    }

    public static ConversationTurn toolRequest(ToolCallRequest call) {
        return new ConversationTurn(Role.ASSISTANT, null, call, null, null);
    }

    public static ConversationTurn toolResult(ToolCallRequest call, String content) {
        return new ConversationTurn(Role.TOOL, content, null, call.id(), call.name());
    }

    public boolean isToolRequest() {
        return toolCall != null;
    }
}
