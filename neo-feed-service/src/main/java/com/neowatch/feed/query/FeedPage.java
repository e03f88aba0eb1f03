package com.neowatch.feed.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neowatch.common.model.ScoredNearEarthObject;

import java.util.List;

public record FeedPage(
    @JsonProperty("items")       List<ScoredNearEarthObject> items,
    @JsonProperty("total")       int                         total,
    @JsonProperty("page")        int                         page,
    @JsonProperty("size")        int                         size,
    @JsonProperty("totalPages")  int                         totalPages,
    @JsonProperty("hasNext")     boolean                     hasNext,
    @JsonProperty("hasPrevious") boolean                     hasPrevious
) {

    public FeedPage {
        items = List.copyOf(items);
    }
}
