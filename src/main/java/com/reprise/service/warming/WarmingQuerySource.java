package com.reprise.service.warming;

import com.reprise.model.WarmingQuery;

import java.util.List;

/**
 * Produces the queries a warming run should populate.
 */
public interface WarmingQuerySource {

    List<WarmingQuery> nextQueries();

    WarmingMode mode();
}
