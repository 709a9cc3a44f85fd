package io.campus.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SourceView(
    @JsonProperty("title") String title,
    @JsonProperty("content") String content,
    @JsonProperty("score") double score
) {
}
