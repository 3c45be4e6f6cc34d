package com.askdb.stream;

/**
 * Current text of one region of a streamed answer.
 *
 * @param section region
 * @param content region text seen so far (partial) or final text
 * @param partial true while the stream is still open
 */
public record SectionSnapshot(Section section, String content, boolean partial) {
}
