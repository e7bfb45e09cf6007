package com.vigil.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vigil.service.core.model.ViewMedia;
import com.vigil.service.core.query.DataQuery;
import com.vigil.service.core.results.QueryResults;
import java.util.List;

/** Results per sub-query, plus the projected media for event and recording queries. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse<Q extends DataQuery, R extends QueryResults>(
        List<SubQueryResult<Q, R>> results, List<ViewMedia> media) {}
