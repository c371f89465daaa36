package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A query to populate ahead of live demand.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarmingQuery {

    private String query;

    @Builder.Default
    private RequestType type = RequestType.TEXT_GENERATION;

    /**
     * Response to write. Null leaves the query for the caller to generate.
     */
    private String expectedResponse;

    private String model;

    /**
     * Higher goes first.
     */
    private int priority;
}
