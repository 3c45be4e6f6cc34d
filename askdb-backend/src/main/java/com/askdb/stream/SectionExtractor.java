package com.askdb.stream;

import java.util.List;

/**
 * Incrementally splits a streamed answer into its SQL and explanation regions.
 *
 * <p>One instance serves one stream. Fragments must be passed in delivery order; the output for
 * a given prefix of fragments is deterministic.
 */
public interface SectionExtractor {

    /**
     * Consume the next fragment.
     *
     * @param fragment text fragment, may be empty
     * @return partial snapshots of every region whose text changed, in the order the regions appear
     * @throws IllegalStateException if {@link #finish()} was already called
     */
    List<SectionSnapshot> accept(String fragment);

    /**
     * End the stream and compute the final regions from the entire accumulated text.
     *
     * @return final regions; later calls return the same value
     */
    ExtractedSections finish();
}
