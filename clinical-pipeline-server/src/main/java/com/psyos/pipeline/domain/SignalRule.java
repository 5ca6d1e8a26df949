package com.psyos.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignalRule {

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String directive;

    public boolean hasKeywords() {
        return keywords != null && !keywords.isEmpty();
    }

    public boolean hasDirective() {
        return directive != null && !directive.isBlank();
    }
}
