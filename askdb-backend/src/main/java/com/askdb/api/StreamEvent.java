package com.askdb.api;

import com.askdb.stream.Section;
import com.askdb.stream.SectionSnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One event of a streamed answer. Sent as the JSON {@code data:} payload of an SSE message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamEvent {

    public static final String SCHEMA_READY = "schema-ready";
    public static final String SQL = "sql";
    public static final String EXPLANATION = "explanation";
    public static final String STATUS = "status";
    public static final String RESULTS = "results";
    public static final String COMPLETE = "complete";
    public static final String ERROR = "error";

    private String type;
    private String content;
    private Boolean partial;
    private String message;
    private Integer tableCount;
    private List<Map<String, Object>> rows;
    private Integer rowCount;
    private Long elapsedMillis;

    public static StreamEvent schemaReady(int tableCount) {
        return StreamEvent.builder().type(SCHEMA_READY).tableCount(tableCount).build();
    }

    public static StreamEvent section(SectionSnapshot snapshot) {
        return section(snapshot.section(), snapshot.content(), snapshot.partial());
    }

    public static StreamEvent section(Section section, String content, boolean partial) {
        return StreamEvent.builder()
                .type(section == Section.SQL ? SQL : EXPLANATION)
                .content(content)
                .partial(partial)
                .build();
    }

    public static StreamEvent status(String message) {
        return StreamEvent.builder().type(STATUS).message(message).build();
    }

    public static StreamEvent results(List<Map<String, Object>> rows, int rowCount, long elapsedMillis) {
        return StreamEvent.builder().type(RESULTS).rows(rows).rowCount(rowCount).elapsedMillis(elapsedMillis).build();
    }

    public static StreamEvent complete() {
        return StreamEvent.builder().type(COMPLETE).build();
    }

    public static StreamEvent error(String message) {
        return StreamEvent.builder().type(ERROR).message(message).build();
    }
}
