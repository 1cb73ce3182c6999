package com.stormline.herald.agent;

import com.stormline.herald.domain.model.ToolCallRequest;
import com.stormline.herald.tool.ToolResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered tool exchanges of a single execution. Not shared between executions.
 */
public class ScratchPad {

    private final List<ToolExchange> exchanges = new ArrayList<>();

    public ToolExchange record(ToolCallRequest request, ToolResult result) {
        ToolExchange exchange = new ToolExchange(request, result);
        exchanges.add(exchange);
        return exchange;
    }

    /**
     * Find an earlier successful exchange with the same tool name and arguments.
     * Failed exchanges are never matched, so a retry reaches the tool again.
     */
    public Optional<ToolExchange> findCompletedInvocation(ToolCallRequest request) {
        return exchanges.stream()
                .filter(exchange -> exchange.result().isSuccess())
                .filter(exchange -> exchange.request().sameInvocationAs(request))
                .findFirst();
    }

    public List<ToolExchange> exchanges() {
        return Collections.unmodifiableList(exchanges);
    }

    public int size() {
        return exchanges.size();
    }

    /**
     * A tool request paired with the result it produced.
     */
    public record ToolExchange(ToolCallRequest request, ToolResult result) {

        public String output() {
            return result.getOutputForLLM();
        }
    }
}
