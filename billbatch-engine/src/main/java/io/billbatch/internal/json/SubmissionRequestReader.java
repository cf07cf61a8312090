package io.billbatch.internal.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.billbatch.core.BatchConfig;
import io.billbatch.core.RetryPolicy;
import io.billbatch.core.SubmissionRequest;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the JSON submission document:
 * <pre>
 * {"job_id": "...", "processor": "render", "items": [...],
 *  "config": {"max_workers": 4, "batch_size": 100, "timeout_seconds": 300, "continue_on_error": true,
 *             "retry": {"max_retries": 3, "base_delay_s": 1, "max_delay_s": 30, "exponential": true}}}
 * </pre>
 * Missing config fields fall back to the defaults given at construction.
 */
public class SubmissionRequestReader {

    private final ObjectMapper objectMapper;
    private final BatchConfig defaults;

    public SubmissionRequestReader(ObjectMapper objectMapper) {
        this(objectMapper, BatchConfig.defaults());
    }

    public SubmissionRequestReader(ObjectMapper objectMapper, BatchConfig defaults) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
    }

    public SubmissionRequest read(String json) {
        try {
            return read(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed submission JSON: " + e.getOriginalMessage(), e);
        }
    }

    public SubmissionRequest read(InputStream in) throws IOException {
        return read(objectMapper.readTree(in));
    }

    public SubmissionRequest read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Submission must be a JSON object");
        }
        String processor = text(root, "processor");
        if (processor == null || processor.isBlank()) {
            throw new IllegalArgumentException("Submission is missing 'processor'");
        }
        String jobId = text(root, "job_id");

        List<Object> items = new ArrayList<>();
        JsonNode itemsNode = root.get("items");
        if (itemsNode != null && !itemsNode.isNull()) {
            if (!itemsNode.isArray()) {
                throw new IllegalArgumentException("'items' must be an array");
            }
            items = objectMapper.convertValue(itemsNode, new TypeReference<List<Object>>() {
            });
        }

        return new SubmissionRequest(jobId, processor, items, readConfig(root.get("config")));
    }

    BatchConfig readConfig(JsonNode node) {
        if (node == null || node.isNull()) {
            return defaults;
        }
        RetryPolicy retry = readRetry(node.get("retry"), defaults.retryPolicy());
        return new BatchConfig(
                node.path("max_workers").asInt(defaults.maxWorkers()),
                node.path("batch_size").asInt(defaults.batchSize()),
                seconds(node.get("timeout_seconds"), defaults.timeout()),
                retry,
                node.path("continue_on_error").asBoolean(defaults.continueOnError())
        );
    }

    private static RetryPolicy readRetry(JsonNode node, RetryPolicy fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        return new RetryPolicy(
                node.path("max_retries").asInt(fallback.maxRetries()),
                seconds(node.get("base_delay_s"), fallback.baseDelay()),
                seconds(node.get("max_delay_s"), fallback.maxDelay()),
                node.path("exponential").asBoolean(fallback.exponential())
        );
    }

    private static Duration seconds(JsonNode node, Duration fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isNumber()) {
            throw new IllegalArgumentException("Expected a number of seconds but got: " + node);
        }
        return Duration.ofNanos(Math.round(node.asDouble() * 1_000_000_000L));
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
