package com.umitunal.tasklite.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.umitunal.tasklite.core.Job;
import com.umitunal.tasklite.core.JobPriority;
import com.umitunal.tasklite.core.JobStatus;
import com.umitunal.tasklite.storage.StorageCategory;
import com.umitunal.tasklite.storage.StorageItemMeta;
import org.junit.jupiter.api.*;

import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JsonCodecTest {

    private final JsonCodec codec = new JsonCodec();

    @Test
    @DisplayName("Should write jobs with lowercase status and priority and omit unset fields")
    void testJobJsonShape() {
        // Given
        Job job = new Job("job_1_1", "scrape", TextNode.valueOf("https://example.com"), JobPriority.CRITICAL, 3, 42L);

        // When
        JsonNode tree = codec.decode(codec.encode(job), JsonNode.class);

        // Then
        assertThat(tree.get("status").asText()).isEqualTo("pending");
        assertThat(tree.get("priority").asText()).isEqualTo("critical");
        assertThat(tree.get("payload").asText()).isEqualTo("https://example.com");
        assertThat(tree.has("startedAt")).isFalse();
        assertThat(tree.has("result")).isFalse();
    }

    @Test
    @DisplayName("Should read a job written by an earlier run")
    void testReadJob() {
        // Given
        String json = "{\"id\":\"job_5_2\",\"type\":\"export\",\"payload\":{\"format\":\"csv\"},"
                + "\"priority\":\"low\",\"status\":\"running\",\"createdAt\":5,\"startedAt\":6,"
                + "\"retries\":1,\"maxRetries\":2,\"extra\":true}";

        // When
        Job job = codec.decode(json.getBytes(UTF_8), Job.class);

        // Then
        assertThat(job.getId()).isEqualTo("job_5_2");
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getPriority()).isEqualTo(JobPriority.LOW);
        assertThat(job.getPayload().get("format").asText()).isEqualTo("csv");
        assertThat(job.getStartedAt()).isEqualTo(6L);
        assertThat(job.canRetry()).isTrue();
    }

    @Test
    @DisplayName("Should read storage metadata with its category tag")
    void testReadMeta() {
        // Given
        String json = "{\"key\":\"cache_x\",\"size\":12,\"category\":\"cache\",\"createdAt\":1,\"lastAccessedAt\":2}";

        // When
        StorageItemMeta meta = codec.decode(json.getBytes(UTF_8), StorageItemMeta.class);

        // Then
        assertThat(meta.getCategory()).isEqualTo(StorageCategory.CACHE);
        assertThat(meta.getSize()).isEqualTo(12);
        assertThat(codec.toTree(meta).get("category").asText()).isEqualTo("cache");
    }

    @Test
    @DisplayName("Should convert values through JSON trees, mapping null to null")
    void testTrees() {
        JsonNode tree = codec.toTree(Map.of("count", 3));

        assertThat(codec.fromTree(tree, Map.class)).containsEntry("count", 3);
        assertThat(codec.fromTree(codec.toTree(null), String.class)).isNull();
        assertThat(codec.fromTree(null, String.class)).isNull();
    }

    @Test
    @DisplayName("Should wrap malformed input in SerializationException")
    void testMalformed() {
        assertThatThrownBy(() -> codec.decode("{not json".getBytes(UTF_8), Job.class))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("Job");
    }
}
