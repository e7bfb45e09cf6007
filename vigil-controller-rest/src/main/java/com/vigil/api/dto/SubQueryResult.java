package com.vigil.api.dto;

import com.vigil.service.core.query.DataQuery;
import com.vigil.service.core.results.QueryResults;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** One sub-query and its answer. JSON object keys cannot carry queries, so results travel as a list. */
public record SubQueryResult<Q extends DataQuery, R extends QueryResults>(Q query, R results) {

    public static <Q extends DataQuery, R extends QueryResults> List<SubQueryResult<Q, R>> fromMap(Map<Q, R> results) {
        List<SubQueryResult<Q, R>> output = new ArrayList<>(results.size());
        results.forEach((query, result) -> output.add(new SubQueryResult<>(query, result)));
        return output;
    }
}
