package com.jobmemory.tools;

import java.util.UUID;

/**
 * Per-call metadata supplied by the transport that received the call.
 */
public record ToolContext(String requestId, String channel) {

    public static ToolContext of(String channel) {
        return new ToolContext(UUID.randomUUID().toString(), channel);
    }
}
