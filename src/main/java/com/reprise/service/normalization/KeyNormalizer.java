package com.reprise.service.normalization;

import com.reprise.config.CacheSettings;
import com.reprise.model.CacheKey;
import com.reprise.model.CacheRequest;
import com.reprise.model.RequestType;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonicalizes queries into stable cache keys.
 *
 * Steps:
 * 1. Lowercase, trim, collapse whitespace
 * 2. If query normalization is on: strip punctuation, drop stop tokens, shorten code terms
 * 3. Sort context keys so their order does not matter
 * 4. Qualify with the model/context partition
 * 5. Generate SHA-256 fingerprint
 *
 * Target: same logical query in the same partition → same fingerprint
 */
public class KeyNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[.,!?;:]+");

    private static final Map<String, String> CODE_TERMS = Map.of(
            "javascript", "js",
            "typescript", "ts",
            "python", "py",
            "function", "func",
            "method", "func",
            "variable", "var",
            "constant", "const"
    );

    /**
     * Build the key of a request.
     *
     * @param request  request; query must not be null
     * @param model    model the response belongs to, may be null
     * @param settings current settings
     * @return immutable key
     */
    public CacheKey normalize(CacheRequest request, String model, CacheSettings settings) {
        return normalize(request.getQuery(), request.getType(), model, request.getContext(), settings);
    }

    public CacheKey normalize(String query, RequestType type, String model, List<String> context,
                              CacheSettings settings) {
        RequestType requestType = type != null ? type : RequestType.TEXT_GENERATION;
        String normalized = normalizeQuery(query, requestType, settings);
        List<String> sortedContext = settings.isCacheByContext() ? sortContext(context) : List.of();
        String partition = partition(settings.isCacheByModel() ? model : null, sortedContext);

        return CacheKey.builder()
                .query(query)
                .model(model)
                .context(sortedContext)
                .requestType(requestType)
                .normalized(normalized)
                .partition(partition)
                .fingerprint(DigestUtils.sha256Hex(partition + "\n" + normalized))
                .build();
    }

    /**
     * Canonical text of a query. Never fails; null and blank queries normalize to "".
     */
    public String normalizeQuery(String query, RequestType type, CacheSettings settings) {
        if (query == null) {
            return "";
        }

        String normalized = collapse(query.toLowerCase(Locale.ROOT));
        if (!settings.isEnableQueryNormalization() || normalized.isEmpty()) {
            return normalized;
        }

        normalized = PUNCTUATION.matcher(normalized).replaceAll("");
        normalized = removeStopTokens(normalized, settings.getStopTokens());

        if (type == RequestType.CODE_GENERATION) {
            normalized = shortenCodeTerms(normalized);
        }

        return collapse(normalized);
    }

    /**
     * Trimmed, sorted, blank-free copy of the context keys.
     */
    List<String> sortContext(List<String> context) {
        if (context == null || context.isEmpty()) {
            return List.of();
        }
        List<String> sorted = new ArrayList<>();
        for (String key : context) {
            if (key != null && !key.isBlank()) {
                sorted.add(key.trim());
            }
        }
        Collections.sort(sorted);
        return List.copyOf(sorted);
    }

    private String partition(String model, List<String> context) {
        List<String> parts = new ArrayList<>();
        if (model != null && !model.isBlank()) {
            parts.add(model.trim());
        }
        if (!context.isEmpty()) {
            parts.add("ctx:" + String.join(",", context));
        }
        return parts.isEmpty() ? CacheKey.DEFAULT_PARTITION : String.join("|", parts);
    }

    private String removeStopTokens(String text, Set<String> stopTokens) {
        if (stopTokens == null || stopTokens.isEmpty()) {
            return text;
        }
        return Arrays.stream(text.split(" "))
                .filter(word -> !stopTokens.contains(word))
                .collect(Collectors.joining(" "));
    }

    private String shortenCodeTerms(String text) {
        return Arrays.stream(text.split(" "))
                .map(word -> CODE_TERMS.getOrDefault(word, word))
                .collect(Collectors.joining(" "));
    }

    private String collapse(String text) {
        return WHITESPACE.matcher(text.trim()).replaceAll(" ");
    }
}
