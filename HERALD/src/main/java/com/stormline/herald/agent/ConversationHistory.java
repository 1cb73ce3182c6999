package com.stormline.herald.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.stormline.herald.domain.model.ConversationTurn;
import com.stormline.herald.domain.model.ConversationTurn.Role;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Normalizes caller-supplied history.
 * A malformed history is replaced by an empty one instead of failing the execution.
 */
@Slf4j
public final class ConversationHistory {

    private ConversationHistory() {
    }

    /**
     * Validate a typed history.
     *
     * @param history caller history, may be null
     * @return an unmodifiable copy, or an empty list if any turn is malformed
     */
    public static List<ConversationTurn> normalize(List<ConversationTurn> history) {
        if (history == null) {
            return List.of();
        }
        for (ConversationTurn turn : history) {
            if (turn == null || turn.role() == null || (turn.content() == null && !turn.isToolRequest())) {
                log.warn("Malformed conversation history ({} turns), continuing with empty history", history.size());
                return List.of();
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    /**
     * Read a history from JSON. Only an array of {@code {role, content}} objects is accepted.
     *
     * @param node the JSON value, may be null
     * @return the parsed turns, or an empty list if the value is missing or malformed
     */
    public static List<ConversationTurn> fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        if (!node.isArray()) {
            log.warn("Conversation history is not an array ({}), continuing with empty history", node.getNodeType());
            return List.of();
        }

        List<ConversationTurn> turns = new ArrayList<>();
        for (JsonNode element : node) {
            Optional<ConversationTurn> turn = parseTurn(element);
            if (turn.isEmpty()) {
                log.warn("Malformed conversation turn at index {}, continuing with empty history", turns.size());
                return List.of();
            }
            turns.add(turn.get());
        }
        return Collections.unmodifiableList(turns);
    }

    private static Optional<ConversationTurn> parseTurn(JsonNode element) {
        if (element == null || !element.isObject()) {
            return Optional.empty();
        }
        JsonNode role = element.get("role");
        JsonNode content = element.get("content");
        if (role == null || !role.isTextual() || content == null || !content.isTextual()) {
            return Optional.empty();
        }
        return Role.parse(role.asText())
                .map(parsed -> new ConversationTurn(parsed, content.asText(), null, null, null));
    }
}
