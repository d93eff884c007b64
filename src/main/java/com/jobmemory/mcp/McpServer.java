package com.jobmemory.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jobmemory.tools.ToolContext;
import com.jobmemory.tools.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Serves the tool set as an MCP server: JSON-RPC 2.0 over a byte stream pair with
 * Content-Length framing (like LSP). Requests are answered one at a time in
 * arrival order.
 */
public class McpServer {

    private static final Logger log = LoggerFactory.getLogger(McpServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String PROTOCOL_VERSION = "2024-11-05";
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int PARSE_ERROR = -32700;

    /** Returned by {@link #readFrame()} when the header block was unusable. */
    private static final byte[] MALFORMED = new byte[0];

    private final ToolDispatcher dispatcher;
    private final String serverName;
    private final String serverVersion;
    private InputStream in;
    private OutputStream out;

    public McpServer(ToolDispatcher dispatcher, String serverName, String serverVersion) {
        this.dispatcher = dispatcher;
        this.serverName = serverName;
        this.serverVersion = serverVersion;
    }

    /** Serves until the input reaches end of stream. */
    public void serve(InputStream input, OutputStream output) throws IOException {
        this.in = new BufferedInputStream(input);
        this.out = new BufferedOutputStream(output);
        log.info("MCP server '{}' listening on stdio", serverName);
        while (true) {
            byte[] body = readFrame();
            if (body == null) break;
            if (body == MALFORMED) {
                writeMessage(error(null, PARSE_ERROR, "Invalid Content-Length header"));
                continue;
            }
            JsonNode msg;
            try {
                msg = MAPPER.readTree(body);
            } catch (IOException e) {
                log.warn("Discarding unparseable MCP message: {}", e.getMessage());
                writeMessage(error(null, PARSE_ERROR, "Parse error"));
                continue;
            }
            var reply = handle(msg);
            if (reply != null) writeMessage(reply);
        }
        log.info("MCP input closed, server '{}' stopping", serverName);
    }

    /** Returns the response for {@code msg}, or null for notifications. */
    JsonNode handle(JsonNode msg) {
        var method = msg.path("method").asText("");
        var id = msg.get("id");
        if (id == null || id.isNull()) {
            log.debug("MCP notification: {}", method);
            return null;
        }
        var params = msg.path("params");
        return switch (method) {
            case "initialize" -> result(id, initializeResult());
            case "ping" -> result(id, MAPPER.createObjectNode());
            case "tools/list" -> {
                var res = MAPPER.createObjectNode();
                res.set("tools", dispatcher.registry().describe());
                yield result(id, res);
            }
            case "tools/call" -> callTool(id, params);
            default -> error(id, METHOD_NOT_FOUND, "Method not found: " + method);
        };
    }

    private ObjectNode initializeResult() {
        var res = MAPPER.createObjectNode();
        res.put("protocolVersion", PROTOCOL_VERSION);
        res.putObject("capabilities").putObject("tools");
        res.putObject("serverInfo").put("name", serverName).put("version", serverVersion);
        return res;
    }

    private JsonNode callTool(JsonNode id, JsonNode params) {
        var name = params.path("name");
        if (!name.isTextual()) return error(id, INVALID_PARAMS, "params.name is required");
        var ctx = new ToolContext(id.asText(), "mcp");
        var toolResult = dispatcher.call(ctx, name.asText(), params.get("arguments"));

        var res = MAPPER.createObjectNode();
        res.putArray("content").addObject()
           .put("type", "text")
           .put("text", toolResult.output());
        res.put("isError", toolResult.isError());
        return result(id, res);
    }

    private static ObjectNode result(JsonNode id, JsonNode result) {
        var resp = envelope(id);
        resp.set("result", result);
        return resp;
    }

    private static ObjectNode error(JsonNode id, int code, String message) {
        var resp = envelope(id);
        resp.putObject("error").put("code", code).put("message", message);
        return resp;
    }

    private static ObjectNode envelope(JsonNode id) {
        var resp = MAPPER.createObjectNode();
        resp.put("jsonrpc", "2.0");
        if (id == null) resp.putNull("id");
        else resp.set("id", id);
        return resp;
    }

    private byte[] readFrame() throws IOException {
        int contentLength = -1;
        boolean malformed = false;
        String headerLine;
        while ((headerLine = readHeaderLine()) != null) {
            if (headerLine.isEmpty()) {
                if (contentLength >= 0 || malformed) break;
                continue;
            }
            if (headerLine.regionMatches(true, 0, "Content-Length:", 0, 15)) {
                var raw = headerLine.substring(15).trim();
                try {
                    contentLength = Integer.parseInt(raw);
                } catch (NumberFormatException e) {
                    contentLength = -1;
                }
                if (contentLength < 0) {
                    log.warn("Discarding MCP frame with invalid Content-Length: {}", raw);
                    malformed = true;
                }
            }
        }
        if (headerLine == null) return null;
        if (malformed) return MALFORMED;
        byte[] body = in.readNBytes(contentLength);
        if (body.length < contentLength) return null;
        return body;
    }

    private String readHeaderLine() throws IOException {
        var sb = new StringBuilder();
        int prev = -1;
        while (true) {
            int b = in.read();
            if (b == -1) return null;
            if (b == '\n' && prev == '\r') {
                sb.setLength(sb.length() - 1);
                return sb.toString();
            }
            sb.append((char) b);
            prev = b;
        }
    }

    private void writeMessage(JsonNode msg) throws IOException {
        byte[] body = MAPPER.writeValueAsBytes(msg);
        var header = ("Content-Length: " + body.length + "\r\n\r\n").getBytes(StandardCharsets.UTF_8);
        out.write(header);
        out.write(body);
        out.flush();
    }
}
