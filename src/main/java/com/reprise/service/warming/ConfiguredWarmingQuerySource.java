package com.reprise.service.warming;

import com.reprise.config.RepriseProperties;
import com.reprise.model.WarmingQuery;

import java.util.List;

/**
 * Serves the queries listed under {@code reprise.warming.queries}.
 */
public class ConfiguredWarmingQuerySource implements WarmingQuerySource {

    private final RepriseProperties.WarmingConfig config;

    public ConfiguredWarmingQuerySource(RepriseProperties.WarmingConfig config) {
        this.config = config;
    }

    @Override
    public List<WarmingQuery> nextQueries() {
        return config.getQueries() == null ? List.of() : List.copyOf(config.getQueries());
    }

    @Override
    public WarmingMode mode() {
        return config.getMode();
    }
}
