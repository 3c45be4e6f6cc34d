package com.askdb.llm;

import com.askdb.config.EnvironmentSettings;
import com.askdb.schema.SchemaMap;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * {@link AnswerGenerator} for OpenAI-compatible chat-completions endpoints.
 *
 * Plain HTTP through {@link HttpClient}; no vendor SDK. No retries: a failed call surfaces as
 * {@link AnswerGenerationException}.
 */
@Service
public class OpenAiAnswerGenerator implements AnswerGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiAnswerGenerator.class);

    private static final String DEFAULT_BASE_URL = "https://api.openai.com";
    private static final int DEFAULT_TIMEOUT_MS = 30000;
    private static final String DEFAULT_DB_TYPE = "postgresql";
    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE = "[DONE]";

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Environment environment;

    /**
     * Create the generator.
     *
     * @param objectMapper Jackson object mapper
     * @param environment Spring environment for configuration
     */
    public OpenAiAnswerGenerator(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Log whether generation is enabled. Never logs the API key.
     */
    @PostConstruct
    public void logAiConfigStatus() {
        OpenAiConfig config = OpenAiConfig.fromEnvironment(environment);
        if (config.isEnabled()) {
            log.info("AI SQL generation is ENABLED (base_url={}, model={}, timeout_ms={})",
                    config.baseUrl(), config.model(), config.timeoutMs());
            return;
        }
        log.warn("AI SQL generation is DISABLED (base_url={}, api_key_configured={}, model_configured={})",
                config.baseUrl(),
                config.apiKey() != null && !config.apiKey().isBlank(),
                config.model() != null && !config.model().isBlank());
    }

    @Override
    public GeneratedAnswer generate(String question, SchemaMap schema, String dbType) {
        OpenAiConfig config = requireEnabled();
        Map<String, Object> payload = basePayload(config, buildJsonSystemPrompt(schema, dialect(dbType)), question);
        payload.put("response_format", Map.of("type", "json_object"));

        try {
            HttpResponse<String> response = httpClient.send(
                    buildRequest(config, payload), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() >= 400) {
                log.warn("AI gateway request failed (status_code={}, base_url={}, model={})",
                        response.statusCode(), config.baseUrl(), config.model());
                throw new AnswerGenerationException("AI gateway error: HTTP " + response.statusCode());
            }

            JsonNode root = objectMapper.readTree(response.body());
            JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
            String content = contentNode.isTextual() ? contentNode.asText() : "";
            JsonNode answer = objectMapper.readTree(stripCodeFence(content));
            if (answer == null || !answer.path("sql").isTextual()) {
                throw new AnswerGenerationException("AI gateway returned invalid JSON output");
            }
            return new GeneratedAnswer(answer.path("sql").asText(), answer.path("explanation").asText(""));
        } catch (IOException e) {
            throw new AnswerGenerationException("AI generation failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnswerGenerationException("AI generation interrupted", e);
        }
    }

    @Override
    public void stream(String question, SchemaMap schema, String dbType, Consumer<String> fragments) {
        OpenAiConfig config = requireEnabled();
        Map<String, Object> payload = basePayload(config, buildLabeledSystemPrompt(schema, dialect(dbType)), question);
        payload.put("stream", true);

        HttpResponse<Stream<String>> response;
        try {
            response = httpClient.send(buildRequest(config, payload), HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new AnswerGenerationException("AI generation failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnswerGenerationException("AI generation interrupted", e);
        }

        try (Stream<String> lines = response.body()) {
            if (response.statusCode() >= 400) {
                log.warn("AI gateway stream failed (status_code={}, base_url={}, model={})",
                        response.statusCode(), config.baseUrl(), config.model());
                throw new AnswerGenerationException("AI gateway error: HTTP " + response.statusCode());
            }
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                if (!line.startsWith(SSE_DATA_PREFIX)) {
                    continue;
                }
                String data = line.substring(SSE_DATA_PREFIX.length()).trim();
                if (SSE_DONE.equals(data)) {
                    break;
                }
                if (data.isEmpty()) {
                    continue;
                }
                String delta = readDelta(data);
                if (delta != null && !delta.isEmpty()) {
                    fragments.accept(delta);
                }
            }
        }
    }

    private String readDelta(String data) {
        try {
            JsonNode node = objectMapper.readTree(data).path("choices").path(0).path("delta").path("content");
            return node.isTextual() ? node.asText() : null;
        } catch (IOException e) {
            throw new AnswerGenerationException("AI gateway sent a malformed stream chunk", e);
        }
    }

    private OpenAiConfig requireEnabled() {
        OpenAiConfig config = OpenAiConfig.fromEnvironment(environment);
        if (!config.isEnabled()) {
            throw new AnswerGenerationException("AI generation is disabled - set askdb.ai.api-key and askdb.ai.model");
        }
        return config;
    }

    private Map<String, Object> basePayload(OpenAiConfig config, String systemPrompt, String question) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.model());
        payload.put("temperature", 0);
        payload.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", question != null ? question.trim() : "")
        ));
        return payload;
    }

    private HttpRequest buildRequest(OpenAiConfig config, Map<String, Object> payload) throws IOException {
        String json = objectMapper.writeValueAsString(payload);
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/v1/chat/completions"))
                .timeout(Duration.ofMillis(config.timeoutMs()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
    }

    private String dialect(String dbType) {
        if (dbType == null || dbType.isBlank()) {
            return DEFAULT_DB_TYPE;
        }
        return dbType.trim().toLowerCase(Locale.ROOT);
    }

    private String rules(SchemaMap schema, String dbType) {
        return "You are a SQL expert. Generate a " + dbType + " SQL query based on the user's question "
                + "and the provided database schema.\n\n"
                + "Database Schema:\n" + (schema != null ? schema.toPromptText().trim() : "") + "\n\n"
                + "Rules:\n"
                + "1. Generate ONLY SELECT queries (no INSERT, UPDATE, DELETE, DROP, etc.)\n"
                + "2. Use exact table and column names from the schema provided\n"
                + "3. Use proper " + dbType + " syntax\n"
                + "4. Use proper JOIN syntax when querying multiple tables\n"
                + "5. Keep queries simple and focused on data retrieval\n\n";
    }

    private String buildJsonSystemPrompt(SchemaMap schema, String dbType) {
        return rules(schema, dbType)
                + "Output ONLY valid JSON and nothing else. Do not use markdown fences. "
                + "Output schema: {\"sql\": \"<SQL statement>\", \"explanation\": \"<one or two sentences>\"}.";
    }

    private String buildLabeledSystemPrompt(SchemaMap schema, String dbType) {
        return rules(schema, dbType)
                + "Answer in exactly this format and nothing else:\n"
                + "sql: <SQL statement>\n"
                + "explanation: <one or two sentences>";
    }

    private String stripCodeFence(String content) {
        if (content == null) {
            return "";
        }
        String s = content.trim();
        if (s.startsWith("```")) {
            s = s.replaceFirst("^```[a-zA-Z0-9_-]*\\n", "");
            s = s.replaceFirst("\\n```$", "");
            s = s.trim();
        }
        return s;
    }

    /**
     * Gateway settings resolved from Spring properties or environment variables.
     */
    record OpenAiConfig(String baseUrl, String apiKey, String model, int timeoutMs) {

        static OpenAiConfig fromEnvironment(Environment environment) {
            String baseUrl = EnvironmentSettings.getTrimmed(environment, "askdb.ai.base-url", "ASKDB_AI_BASE_URL");
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = DEFAULT_BASE_URL;
            }
            if (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }
            String apiKey = EnvironmentSettings.getTrimmed(environment, "askdb.ai.api-key", "ASKDB_AI_API_KEY");
            String model = EnvironmentSettings.getTrimmed(environment, "askdb.ai.model", "ASKDB_AI_MODEL");
            int timeoutMs = EnvironmentSettings.getInt(environment, "askdb.ai.timeout-ms", "ASKDB_AI_TIMEOUT_MS",
                    DEFAULT_TIMEOUT_MS);
            return new OpenAiConfig(baseUrl, apiKey, model, timeoutMs);
        }

        boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank()
                    && model != null && !model.isBlank();
        }

        @Override
        public String toString() {
            return "OpenAiConfig[baseUrl=" + baseUrl + ", model=" + model + ", timeoutMs=" + timeoutMs + "]";
        }
    }
}
