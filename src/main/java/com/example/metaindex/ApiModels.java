package com.example.metaindex;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ApiModels {

    public static class ToolRequest {
        private String name;
        private String version;
        private Map<String, Object> configuration;

        public String getName() {
            return name;
        }
        public void setName(String name) {
            this.name = name;
        }
        public String getVersion() {
            return version;
        }
        public void setVersion(String version) {
            this.version = version;
        }
        public Map<String, Object> getConfiguration() {
            return configuration;
        }
        public void setConfiguration(Map<String, Object> configuration) {
            this.configuration = configuration;
        }
    }

    public record ToolView(Long id, String name, String version, JsonNode configuration) {
        static ToolView of(IndexerTool t) {
            return t == null ? null : new ToolView(t.getId(), t.getName(), t.getVersion(), CanonicalJson.read(t.getConfiguration()));
        }
    }

    public static class FactEntryRequest {
        private String id;
        private Long toolId;
        private JsonNode payload;

        public String getId() {
            return id;
        }
        public void setId(String id) {
            this.id = id;
        }
        public Long getToolId() {
            return toolId;
        }
        public void setToolId(Long toolId) {
            this.toolId = toolId;
        }
        public JsonNode getPayload() {
            return payload;
        }
        public void setPayload(JsonNode payload) {
            this.payload = payload;
        }
    }

    public static class FactQuery {
        private List<String> ids = new ArrayList<>();
        private List<Long> toolIds;   // optional filter

        public List<String> getIds() {
            return ids;
        }
        public void setIds(List<String> ids) {
            this.ids = ids;
        }
        public List<Long> getToolIds() {
            return toolIds;
        }
        public void setToolIds(List<Long> toolIds) {
            this.toolIds = toolIds;
        }
    }

    public static class MissingQuery {
        private List<String> ids = new ArrayList<>();
        private Long toolId;

        public List<String> getIds() {
            return ids;
        }
        public void setIds(List<String> ids) {
            this.ids = ids;
        }
        public Long getToolId() {
            return toolId;
        }
        public void setToolId(Long toolId) {
            this.toolId = toolId;
        }
    }

    public record FactView(String id, ToolView tool, Object payload) {
        static FactView of(Fact<?> f) {
            return new FactView(f.objectId(), ToolView.of(f.tool()), f.payload());
        }
    }

    public record OriginHit(String url, ToolView tool, JsonNode metadata, List<String> mappings, String from) {
        static OriginHit of(Fact<OriginMetadata> f) {
            OriginMetadata m = f.payload();
            return new OriginHit(f.objectId(), ToolView.of(f.tool()), m.metadata(), m.mappings(), m.from());
        }
    }

    public record ProducerPageView(List<OriginHit> origins, List<String> ids, String nextPageToken) {}

    public static class IndexOriginsRequest {
        private List<String> origins = new ArrayList<>();

        public List<String> getOrigins() {
            return origins;
        }
        public void setOrigins(List<String> origins) {
            this.origins = origins;
        }
    }

    public static class ExtrinsicRequest {
        private String id;
        private String target;
        private MetadataAuthority authority;
        private String format;
        private JsonNode metadata;

        public String getId() {
            return id;
        }
        public void setId(String id) {
            this.id = id;
        }
        public String getTarget() {
            return target;
        }
        public void setTarget(String target) {
            this.target = target;
        }
        public MetadataAuthority getAuthority() {
            return authority;
        }
        public void setAuthority(MetadataAuthority authority) {
            this.authority = authority;
        }
        public String getFormat() {
            return format;
        }
        public void setFormat(String format) {
            this.format = format;
        }
        public JsonNode getMetadata() {
            return metadata;
        }
        public void setMetadata(JsonNode metadata) {
            this.metadata = metadata;
        }
    }

    public record ErrorBody(String error, String message) {}
}
