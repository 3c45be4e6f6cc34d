package com.askdb.llm;

import com.askdb.schema.SchemaMap;

import java.util.function.Consumer;

/**
 * Turns a question and a schema into SQL plus an explanation.
 */
public interface AnswerGenerator {

    /**
     * Generate a complete answer.
     *
     * @param question natural-language question
     * @param schema tenant schema
     * @param dbType SQL dialect, e.g. {@code postgresql}
     * @return answer
     * @throws AnswerGenerationException when the model call fails
     */
    GeneratedAnswer generate(String question, SchemaMap schema, String dbType);

    /**
     * Stream an answer labelled {@code sql: ... explanation: ...}, one fragment at a time.
     * Returns once the stream has ended.
     *
     * @param question natural-language question
     * @param schema tenant schema
     * @param dbType SQL dialect
     * @param fragments receives fragments in delivery order
     * @throws AnswerGenerationException when the model call fails
     */
    void stream(String question, SchemaMap schema, String dbType, Consumer<String> fragments);
}
