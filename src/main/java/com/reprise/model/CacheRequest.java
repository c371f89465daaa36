package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A generation request as seen by the cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheRequest {

    private String id;

    /**
     * Free-text query the response answers.
     */
    private String query;

    @Builder.Default
    private RequestType type = RequestType.TEXT_GENERATION;

    /**
     * Context keys (user, session, workspace...). Order does not matter.
     */
    @Builder.Default
    private List<String> context = new ArrayList<>();

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    public static CacheRequest of(String query, RequestType type) {
        return CacheRequest.builder()
                .id("cache_req_" + UUID.randomUUID())
                .query(query)
                .type(type)
                .build();
    }
}
