package com.askdb.llm;

import com.askdb.schema.ColumnDescriptor;
import com.askdb.schema.SchemaMap;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OpenAI answer generator")
class OpenAiAnswerGeneratorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private SchemaMap schema;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        schema = new SchemaMap();
        schema.addColumn("users", new ColumnDescriptor("id", "integer", false));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private OpenAiAnswerGenerator generator(boolean withKey) {
        MockEnvironment env = new MockEnvironment()
                .withProperty("askdb.ai.base-url", server.url("/").toString())
                .withProperty("askdb.ai.model", "test-model");
        if (withKey) {
            env.setProperty("askdb.ai.api-key", "sk-test");
        }
        return new OpenAiAnswerGenerator(objectMapper, env);
    }

    @Test
    @DisplayName("Disabled without an API key and never calls the gateway")
    void disabled() {
        assertThatThrownBy(() -> generator(false).generate("How many users?", schema, "postgresql"))
                .isInstanceOf(AnswerGenerationException.class)
                .hasMessageContaining("disabled");
        assertThat(server.getRequestCount()).isZero();
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("Reads the answer from the JSON message content")
        void success() throws Exception {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "application/json")
                    .setBody("{\"choices\":[{\"message\":{\"content\":"
                            + "\"```json\\n{\\\"sql\\\":\\\"SELECT COUNT(*) FROM users\\\","
                            + "\\\"explanation\\\":\\\"Counts.\\\"}\\n```\"}}]}"));

            GeneratedAnswer answer = generator(true).generate("How many users?", schema, "PostgreSQL");

            assertThat(answer.sql()).isEqualTo("SELECT COUNT(*) FROM users");
            assertThat(answer.explanation()).isEqualTo("Counts.");

            RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
            assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
            assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
            JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
            assertThat(body.path("model").asText()).isEqualTo("test-model");
            assertThat(body.path("response_format").path("type").asText()).isEqualTo("json_object");
            assertThat(body.path("messages").path(0).path("content").asText())
                    .contains("Table: users")
                    .contains("postgresql");
            assertThat(body.path("messages").path(1).path("content").asText()).isEqualTo("How many users?");
        }

        @Test
        @DisplayName("Gateway errors surface as generation failures")
        void gatewayError() {
            server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\":\"boom\"}"));

            assertThatThrownBy(() -> generator(true).generate("q", schema, "postgresql"))
                    .isInstanceOf(AnswerGenerationException.class)
                    .hasMessage("AI gateway error: HTTP 500");
        }

        @Test
        @DisplayName("Content that is not the expected JSON is rejected")
        void invalidJson() {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "application/json")
                    .setBody("{\"choices\":[{\"message\":{\"content\":\"{\\\"query\\\":\\\"SELECT 1\\\"}\"}}]}"));

            assertThatThrownBy(() -> generator(true).generate("q", schema, "postgresql"))
                    .isInstanceOf(AnswerGenerationException.class)
                    .hasMessage("AI gateway returned invalid JSON output");
        }
    }

    @Nested
    @DisplayName("stream")
    class Stream {

        @Test
        @DisplayName("Delivers each content delta and stops at DONE")
        void deltas() throws Exception {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "text/event-stream")
                    .setBody("data: {\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}\n\n"
                            + "data: {\"choices\":[{\"delta\":{\"content\":\"sql: SELECT\"}}]}\n\n"
                            + ": keep-alive\n\n"
                            + "data: {\"choices\":[{\"delta\":{\"content\":\" 1\"}}]}\n\n"
                            + "data: [DONE]\n\n"
                            + "data: {\"choices\":[{\"delta\":{\"content\":\"ignored\"}}]}\n\n"));
            List<String> fragments = new ArrayList<>();

            generator(true).stream("q", schema, "postgresql", fragments::add);

            assertThat(fragments).containsExactly("sql: SELECT", " 1");
            JsonNode body = objectMapper.readTree(server.takeRequest(5, TimeUnit.SECONDS).getBody().readUtf8());
            assertThat(body.path("stream").asBoolean()).isTrue();
            assertThat(body.path("messages").path(0).path("content").asText()).contains("explanation:");
        }

        @Test
        @DisplayName("Gateway errors surface as generation failures")
        void gatewayError() {
            server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));

            assertThatThrownBy(() -> generator(true).stream("q", schema, "postgresql", f -> { }))
                    .isInstanceOf(AnswerGenerationException.class)
                    .hasMessage("AI gateway error: HTTP 503");
        }

        @Test
        @DisplayName("A malformed chunk fails the stream")
        void malformedChunk() {
            server.enqueue(new MockResponse()
                    .setHeader("Content-Type", "text/event-stream")
                    .setBody("data: {not json\n\n"));

            assertThatThrownBy(() -> generator(true).stream("q", schema, "postgresql", f -> { }))
                    .isInstanceOf(AnswerGenerationException.class)
                    .hasMessage("AI gateway sent a malformed stream chunk");
        }
    }
}
