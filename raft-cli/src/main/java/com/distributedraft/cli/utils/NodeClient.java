package com.distributedraft.cli.utils;

import com.distributedraft.common.constant.RaftConstants;
import com.distributedraft.common.dto.SubmitCommandResponse;
import com.distributedraft.common.exception.ErrorCode;
import com.distributedraft.common.exception.RaftException;
import com.distributedraft.common.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;

/**
 * HTTP client for one node's REST surface
 */
public class NodeClient {

    public static final String DEFAULT_NODE = "localhost:8080";

    private static final int CONNECT_TIMEOUT_MS = 5000;
    private static final int READ_TIMEOUT_MS = 10000;

    private final String baseUrl;

    /**
     * @param node host:port of the node, or a full http:// URL
     */
    public NodeClient(String node) {
        String url = node.startsWith("http://") || node.startsWith("https://") ? node : "http://" + node;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public JsonNode getStatus() throws IOException {
        return JsonUtils.readTree(send("GET", RaftConstants.STATUS_PATH, null, null));
    }

    public JsonNode getStateMachineStats() throws IOException {
        return JsonUtils.readTree(send("GET", "/state-machine/stats", null, null));
    }

    /**
     * Ask the node to add {@code address} to its membership
     */
    public void join(String address) throws IOException {
        send("POST", RaftConstants.JOIN_PATH, "text/plain; charset=UTF-8", address.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Submit a command to the leader and wait for it to commit
     *
     * @return reply carrying the committed index and term
     */
    public SubmitCommandResponse submit(byte[] command) throws IOException {
        return JsonUtils.fromJson(send("POST", RaftConstants.COMMANDS_PATH, "application/octet-stream", command),
                SubmitCommandResponse.class);
    }

    private String send(String method, String path, String contentType, byte[] body) throws IOException {
        URL url = new URL(baseUrl + RaftConstants.API_BASE_PATH + path);
        HttpURLConnection conn = (HttpURLConnection) url.openConnection();
        try {
            conn.setRequestMethod(method);
            conn.setConnectTimeout(CONNECT_TIMEOUT_MS);
            conn.setReadTimeout(READ_TIMEOUT_MS);
            conn.setRequestProperty("Accept", "application/json");

            if (body != null) {
                conn.setDoOutput(true);
                conn.setRequestProperty("Content-Type", contentType);
                try (OutputStream out = conn.getOutputStream()) {
                    out.write(body);
                }
            }

            int responseCode = conn.getResponseCode();
            if (responseCode != HttpURLConnection.HTTP_OK) {
                throw toException(responseCode, readFully(conn.getErrorStream()));
            }
            return readFully(conn.getInputStream());
        } finally {
            conn.disconnect();
        }
    }

    /**
     * Turn an error reply of the node into a {@link RaftException} carrying its error code
     */
    private RaftException toException(int responseCode, String body) {
        if (!body.isEmpty()) {
            try {
                JsonNode error = JsonUtils.readTree(body);
                if (error.has("errorCode")) {
                    ErrorCode code = ErrorCode.fromCode(error.get("errorCode").asInt());
                    String message = error.has("message") ? error.get("message").asText() : code.getMessage();
                    return new RaftException(code, code.name() + ": " + message + " (HTTP " + responseCode + ")");
                }
            } catch (IllegalArgumentException e) {
                return new RaftException(ErrorCode.UNKNOWN_ERROR,
                        "Request failed: HTTP " + responseCode + ": " + body, e);
            }
        }
        return new RaftException(ErrorCode.UNKNOWN_ERROR, "Request failed: HTTP " + responseCode);
    }

    private static String readFully(InputStream in) throws IOException {
        if (in == null) {
            return "";
        }
        try (InputStream stream = in) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            stream.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }
}
