package com.askdb.llm;

/**
 * Complete answer from the model.
 *
 * @param sql generated statement, may be empty
 * @param explanation short description of the statement
 */
public record GeneratedAnswer(String sql, String explanation) {
}
