package com.askdb.query;

import com.askdb.api.StreamEvent;
import com.askdb.llm.AnswerGenerationException;
import com.askdb.llm.AnswerGenerator;
import com.askdb.llm.GeneratedAnswer;
import com.askdb.notify.CompletionNotifier;
import com.askdb.notify.QueryCompletion;
import com.askdb.schema.SchemaIntrospector;
import com.askdb.schema.SchemaMap;
import com.askdb.stream.ExtractedSections;
import com.askdb.stream.LabeledSectionExtractor;
import com.askdb.stream.Section;
import com.askdb.stream.SectionExtractor;
import com.askdb.stream.SectionSnapshot;
import com.askdb.validation.StatementRejectedException;
import com.askdb.validation.StatementValidator;
import com.askdb.validation.ValidationVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Question to rows: schema, generation, validation, execution.
 *
 * <p>A statement that fails validation never reaches the pool manager. Every outcome, success
 * or failure, is published to the {@link CompletionNotifier} after the caller has it.
 */
@Slf4j
@Service
public class QueryPipeline {

    static final String EXECUTING_MESSAGE = "Executing query...";
    static final String NO_SQL_MESSAGE = "Generated answer contains no SQL section";
    static final String UNEXPECTED_ERROR_MESSAGE = "An unexpected error occurred";

    private final SchemaIntrospector schemaIntrospector;
    private final AnswerGenerator answerGenerator;
    private final StatementValidator statementValidator;
    private final QueryExecutor queryExecutor;
    private final CompletionNotifier completionNotifier;

    public QueryPipeline(
            SchemaIntrospector schemaIntrospector,
            AnswerGenerator answerGenerator,
            StatementValidator statementValidator,
            QueryExecutor queryExecutor,
            CompletionNotifier completionNotifier
    ) {
        this.schemaIntrospector = schemaIntrospector;
        this.answerGenerator = answerGenerator;
        this.statementValidator = statementValidator;
        this.queryExecutor = queryExecutor;
        this.completionNotifier = completionNotifier;
    }

    /**
     * Answer a question in one piece.
     *
     * @param tenantId tenant identifier
     * @param dsn tenant DSN
     * @param question natural-language question
     * @param dbType SQL dialect handed to the generator
     * @return generated SQL, explanation and rows
     * @throws AnswerGenerationException when the model fails or returns no SQL
     * @throws StatementRejectedException when the generated SQL fails validation
     * @throws QueryExecutionException when the database call fails
     */
    public QueryAnswer ask(String tenantId, String dsn, String question, String dbType) {
        String sql = null;
        try {
            SchemaMap schema = schemaIntrospector.fetchSchema(tenantId, dsn);
            GeneratedAnswer answer = answerGenerator.generate(question, schema, dbType);
            sql = answer.sql() != null ? answer.sql().trim() : "";
            if (sql.isEmpty()) {
                throw new AnswerGenerationException(NO_SQL_MESSAGE);
            }
            requireValid(sql);

            ExecutionOutcome outcome = queryExecutor.execute(tenantId, dsn, sql);
            String explanation = answer.explanation() != null ? answer.explanation().trim() : "";
            publishSuccess(tenantId, question, sql, outcome);
            return new QueryAnswer(sql, explanation, outcome.rows(), outcome.rowCount(), outcome.elapsedMillis());
        } catch (RuntimeException e) {
            publishFailure(tenantId, question, sql, e);
            throw e;
        }
    }

    /**
     * Answer a question as a stream of events.
     *
     * <p>On success the sink sees {@code schema-ready}, partial {@code sql}/{@code explanation}
     * events, one final {@code sql}, one final {@code explanation}, {@code status},
     * {@code results} and {@code complete}. The final sections are only sent for a statement
     * that passed validation. A failure produces a single {@code error} event and nothing after
     * it. Once the sink closes no more events are produced; a statement already running
     * completes, its completion is still published and its result is dropped.
     *
     * <p>Never throws; all failures go to the sink.
     *
     * @param tenantId tenant identifier
     * @param dsn tenant DSN
     * @param question natural-language question
     * @param dbType SQL dialect handed to the generator
     * @param sink event receiver
     */
    public void askStreaming(String tenantId, String dsn, String question, String dbType, StreamEventSink sink) {
        String sql = null;
        try {
            SchemaMap schema = schemaIntrospector.fetchSchema(tenantId, dsn);
            emit(sink, StreamEvent.schemaReady(schema.tableCount()));

            SectionExtractor extractor = newExtractor();
            answerGenerator.stream(question, schema, dbType, fragment -> {
                for (SectionSnapshot snapshot : extractor.accept(fragment)) {
                    emit(sink, StreamEvent.section(snapshot));
                }
                ensureOpen(sink);
            });
            ExtractedSections sections = extractor.finish();
            if (!sections.hasSql() || sections.sql().isEmpty()) {
                throw new AnswerGenerationException(NO_SQL_MESSAGE);
            }
            sql = sections.sql();
            requireValid(sql);

            emit(sink, StreamEvent.section(Section.SQL, sql, false));
            emit(sink, StreamEvent.section(Section.EXPLANATION, sections.explanation(), false));
            emit(sink, StreamEvent.status(EXECUTING_MESSAGE));

            ExecutionOutcome outcome = queryExecutor.execute(tenantId, dsn, sql);
            publishSuccess(tenantId, question, sql, outcome);
            emit(sink, StreamEvent.results(outcome.rows(), outcome.rowCount(), outcome.elapsedMillis()));
            emit(sink, StreamEvent.complete());
        } catch (ClientGoneException e) {
            log.info("Client disconnected; stopped streaming answer for tenant {}", tenantId);
        } catch (RuntimeException e) {
            publishFailure(tenantId, question, sql, e);
            if (sink.isOpen()) {
                sink.send(StreamEvent.error(clientMessage(e)));
            }
        }
    }

    protected SectionExtractor newExtractor() {
        return new LabeledSectionExtractor();
    }

    private void requireValid(String sql) {
        ValidationVerdict verdict = statementValidator.validate(sql);
        if (!verdict.accepted()) {
            log.info("Rejected generated statement (reason={}, keyword={})", verdict.reason(), verdict.keyword());
            throw new StatementRejectedException(verdict);
        }
    }

    private static void emit(StreamEventSink sink, StreamEvent event) {
        ensureOpen(sink);
        sink.send(event);
    }

    private static void ensureOpen(StreamEventSink sink) {
        if (!sink.isOpen()) {
            throw new ClientGoneException();
        }
    }

    private String clientMessage(RuntimeException e) {
        if (e instanceof QueryExecutionException
                || e instanceof StatementRejectedException
                || e instanceof AnswerGenerationException
                || e instanceof IllegalArgumentException) {
            return e.getMessage();
        }
        log.error("Unexpected failure while streaming an answer", e);
        return UNEXPECTED_ERROR_MESSAGE;
    }

    private void publishSuccess(String tenantId, String question, String sql, ExecutionOutcome outcome) {
        completionNotifier.publish(new QueryCompletion(tenantId, question, sql, true,
                outcome.rowCount(), outcome.elapsedMillis(), null, Instant.now()));
    }

    private void publishFailure(String tenantId, String question, String sql, RuntimeException e) {
        completionNotifier.publish(new QueryCompletion(tenantId, question, sql, false,
                0, 0, errorKind(e), Instant.now()));
    }

    static String errorKind(RuntimeException e) {
        if (e instanceof QueryExecutionException qe) {
            return qe.getKind().name();
        }
        if (e instanceof StatementRejectedException se) {
            return se.getVerdict().reason().name();
        }
        if (e instanceof AnswerGenerationException) {
            return "GENERATION_FAILED";
        }
        if (e instanceof IllegalArgumentException) {
            return "INVALID_ARGUMENT";
        }
        return "INTERNAL_ERROR";
    }

    /**
     * Unwinds the pipeline once the client is gone.
     */
    private static final class ClientGoneException extends RuntimeException {
        ClientGoneException() {
            super("Client disconnected", null, false, false);
        }
    }
}
