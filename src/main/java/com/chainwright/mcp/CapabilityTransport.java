package com.chainwright.mcp;

import java.time.Duration;
import java.util.Map;

/**
 * Wire access to MCP servers, keyed by server id.
 */
public interface CapabilityTransport {

    /**
     * Pings the server, failing if it does not answer within the timeout.
     *
     * @throws Exception any transport or timeout failure
     */
    void ping(McpServerDescriptor server, Duration timeout) throws Exception;

    /**
     * Calls a tool on the server and returns its text result.
     *
     * @throws Exception any transport failure or a tool-reported error
     */
    String callTool(McpServerDescriptor server, String toolName, Map<String, Object> arguments) throws Exception;
}
