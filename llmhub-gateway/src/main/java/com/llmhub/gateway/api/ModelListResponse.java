package com.llmhub.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmhub.gateway.core.catalog.ModelCatalogService.CatalogEntry;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * GET /v1/models 的 OpenAI 兼容格式
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelListResponse {

    private String object;
    private List<ModelEntry> data;

    public static ModelListResponse of(List<CatalogEntry> entries) {
        return new ModelListResponse("list",
                entries.stream().map(e -> new ModelEntry(e.getId(), "model", e.getProvider()))
                        .collect(Collectors.toList()));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelEntry {
        private String id;
        private String object;

        @JsonProperty("owned_by")
        private String ownedBy;
    }
}
