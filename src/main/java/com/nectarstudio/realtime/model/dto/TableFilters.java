package com.nectarstudio.realtime.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * List-view filters attached to a subscription. Subscriptions only share a polling job
 * when their filters are identical after canonicalisation.
 *
 * @param page   1-based page number of the snapshot
 * @param fields comma separated projection, null for all columns
 * @param sort   {@code column [asc|desc]}, comma separated
 * @param filter filter expression, e.g. {@code status = 'open' and amount > 10}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableFilters(Integer page, String fields, String sort, String filter) {

    public static TableFilters none() {
        return new TableFilters(null, null, null, null);
    }
}
