package com.mnemo.core.semantic;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class SemanticMatch {
    @NonNull
    String id;

    @NonNull
    String content;

    @Builder.Default
    Map<String, String> metadata = Map.of();

    double similarity;
}
