package com.simrelay.core.state;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for the group listing.
 */
public record GroupListing(
    @JsonProperty("last_updated") String lastUpdated,
    @JsonProperty("schema_groups") List<String> schemaGroups,
    @JsonProperty("inferred_groups") List<String> inferredGroups
) {}
