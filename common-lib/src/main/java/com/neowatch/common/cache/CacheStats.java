package com.neowatch.common.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CacheStats(
    @JsonProperty("name")    String name,
    @JsonProperty("size")    int    size,
    @JsonProperty("hits")    long   hits,
    @JsonProperty("misses")  long   misses,
    @JsonProperty("hitRate") double hitRate
) {}
