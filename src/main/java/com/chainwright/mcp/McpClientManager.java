package com.chainwright.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manages MCP sync client lifecycle for all configured servers and implements
 * {@link CapabilityTransport} on top of them.
 * <p>
 * Clients are created lazily on first use and cached per server id. A client whose
 * initialisation fails is not cached, so the next call retries the connection. Pings run on
 * a dedicated daemon pool and are cancelled when they overrun the health check timeout.
 */
@Component
public class McpClientManager implements CapabilityTransport {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final McpProperties props;

    private final Map<String, McpSyncClient> clientCache = new ConcurrentHashMap<>();

    private final ExecutorService pingExecutor;

    public McpClientManager(McpProperties props) {
        this.props = props;
        var counter = new AtomicInteger();
        this.pingExecutor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "mcp-ping-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void ping(McpServerDescriptor server, Duration timeout) throws Exception {
        var client = clientFor(server);
        awaitPing(server.id(), client::ping, timeout);
    }

    /**
     * Runs the ping on the ping pool and waits for it; an overrunning ping is interrupted.
     *
     * @throws TimeoutException if the ping did not answer within the timeout
     */
    void awaitPing(String serverId, Runnable ping, Duration timeout) throws Exception {
        Future<?> future = pingExecutor.submit(ping);
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Ping to MCP server '{}' overran {} ms; cancelled", serverId, timeout.toMillis());
            throw e;
        }
    }

    @Override
    public String callTool(McpServerDescriptor server, String toolName, Map<String, Object> arguments) {
        var client = clientFor(server);
        McpSchema.CallToolResult result = client.callTool(new McpSchema.CallToolRequest(toolName, arguments));
        String text = textOf(result);
        if (Boolean.TRUE.equals(result.isError())) {
            throw new IllegalStateException("Tool '" + toolName + "' on " + server.id() + " failed: " + text);
        }
        return text;
    }

    /**
     * Returns the cached client for the server, creating and initialising it if needed.
     */
    McpSyncClient clientFor(McpServerDescriptor server) {
        if (server.url().isBlank()) {
            throw new IllegalStateException("MCP server '" + server.id() + "' has no URL");
        }
        return clientCache.computeIfAbsent(server.id(), id -> {
            var config = props.getServers().get(id);
            String token = config != null ? config.getToken() : null;

            var transportBuilder = HttpClientSseClientTransport.builder(server.url());
            if (token != null && !token.isBlank()) {
                transportBuilder.customizeRequest(req -> req.header("Authorization", "Bearer " + token));
            }
            var client = McpClient.sync(transportBuilder.build())
                    .requestTimeout(Duration.ofSeconds(props.getRequestTimeoutSeconds()))
                    .build();
            client.initialize();
            log.info("MCP client connected to server '{}' at {}", id, server.url());
            return client;
        });
    }

    public Map<String, McpSyncClient> getClients() {
        return Collections.unmodifiableMap(clientCache);
    }

    private static String textOf(McpSchema.CallToolResult result) {
        if (result.content() == null) return "";
        var sb = new StringBuilder();
        for (var content : result.content()) {
            if (content instanceof McpSchema.TextContent text) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(text.text());
            }
        }
        return sb.toString();
    }

    @PreDestroy
    void shutdown() {
        pingExecutor.shutdownNow();
        for (var entry : clientCache.entrySet()) {
            try {
                entry.getValue().close();
                log.info("MCP client disconnected (server: {})", entry.getKey());
            } catch (Exception e) {
                log.debug("Error closing MCP client '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        clientCache.clear();
    }
}
