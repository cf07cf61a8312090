package io.billbatch.internal.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.billbatch.core.ItemOutcome;
import io.billbatch.core.JobSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes job snapshots into the status document and the detailed job report.
 */
public class JobReportWriter {
    private static final Logger log = LoggerFactory.getLogger(JobReportWriter.class);

    static final int MAX_ITEM_TEXT = 200;

    private final ObjectMapper objectMapper;

    public JobReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public ObjectNode statusNode(JobSnapshot snapshot) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("job_id", snapshot.jobId());
        node.put("status", snapshot.status().wireName());
        node.put("total_items", snapshot.totalItems());
        node.put("processed_count", snapshot.processedCount());
        node.put("progress_percent", snapshot.progressPercent());
        node.put("errors_count", snapshot.errorsCount());
        putTime(node, "start_time", snapshot.startedAt());
        putTime(node, "end_time", snapshot.endedAt());
        node.put("duration_seconds", seconds(snapshot.duration()));
        return node;
    }

    public String writeStatus(JobSnapshot snapshot) {
        return toJson(statusNode(snapshot));
    }

    /**
     * Status fields plus every item outcome (ordered by item index) and an {@code errors_summary}
     * mapping each distinct error text to its count.
     */
    public ObjectNode reportNode(JobSnapshot snapshot) {
        ObjectNode node = statusNode(snapshot);
        putTime(node, "submitted_time", snapshot.submittedAt());

        List<ItemOutcome<?, ?>> outcomes = new ArrayList<>(snapshot.results());
        outcomes.addAll(snapshot.errors());
        outcomes.sort(Comparator.comparingInt(ItemOutcome::index));

        ArrayNode items = node.putArray("items");
        for (ItemOutcome<?, ?> outcome : outcomes) {
            ObjectNode item = items.addObject();
            item.put("index", outcome.index());
            item.put("status", outcome.status().name().toLowerCase(Locale.ROOT));
            item.put("item", truncate(String.valueOf(outcome.item())));
            item.put("attempts", outcome.attemptsUsed());
            item.put("duration_ms", outcome.duration() == null ? 0 : outcome.duration().toMillis());
            if (!outcome.isSuccess()) {
                item.put("error", outcome.error());
                item.put("error_type", outcome.errorType());
            }
        }

        ObjectNode summary = node.putObject("errors_summary");
        errorsSummary(snapshot).forEach(summary::put);
        return node;
    }

    public String writeReport(JobSnapshot snapshot) {
        return toJson(reportNode(snapshot));
    }

    public void writeReport(JobSnapshot snapshot, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), reportNode(snapshot));
        log.info("Job report written jobId={} path={}", snapshot.jobId(), target);
    }

    public String summaryText(JobSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        sb.append("Job ").append(snapshot.jobId()).append(": ").append(snapshot.status().wireName()).append('\n');
        sb.append("Items: ").append(snapshot.processedCount()).append('/').append(snapshot.totalItems())
                .append(String.format(Locale.ROOT, " (%.1f%%)", snapshot.progressPercent())).append('\n');
        sb.append("Succeeded: ").append(snapshot.results().size())
                .append(", failed: ").append(snapshot.errorsCount()).append('\n');
        sb.append(String.format(Locale.ROOT, "Duration: %.2fs", seconds(snapshot.duration()))).append('\n');

        Map<String, Integer> summary = errorsSummary(snapshot);
        if (!summary.isEmpty()) {
            sb.append("Errors:\n");
            summary.forEach((error, count) -> sb.append("  ").append(count).append("x ").append(error).append('\n'));
        }
        return sb.toString();
    }

    static Map<String, Integer> errorsSummary(JobSnapshot snapshot) {
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (ItemOutcome<?, ?> error : snapshot.errors()) {
            String key = error.error() == null ? "unknown" : error.error();
            summary.merge(key, 1, Integer::sum);
        }
        return summary;
    }

    private String toJson(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job document", e);
        }
    }

    private static void putTime(ObjectNode node, String field, Instant time) {
        if (time == null) {
            node.putNull(field);
        } else {
            node.put(field, time.toString());
        }
    }

    private static double seconds(Duration duration) {
        return duration == null ? 0.0 : duration.toMillis() / 1000.0;
    }

    private static String truncate(String text) {
        return text.length() <= MAX_ITEM_TEXT ? text : text.substring(0, MAX_ITEM_TEXT) + "...";
    }
}
