package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;

/**
 * What the cache manager hands back to callers on {@code get}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheResult {

    private boolean hit;

    private byte[] response;

    private Double similarity;

    private Long timeSaved;

    private Double costSaved;

    @Builder.Default
    private CacheSource source = CacheSource.NONE;

    public static CacheResult miss() {
        return CacheResult.builder()
                .hit(false)
                .source(CacheSource.NONE)
                .build();
    }

    public String responseAsString() {
        return response == null ? null : new String(response, StandardCharsets.UTF_8);
    }
}
