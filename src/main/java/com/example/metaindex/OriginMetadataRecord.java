package com.example.metaindex;

public interface OriginMetadataRecord extends FactRecord {
    String getMetadata();
    void setMetadata(String metadata);
    String getMappings();
    void setMappings(String mappings);
    String getSearchVector();
    void setSearchVector(String searchVector);
    String getProvenance();
    void setProvenance(String provenance);
}
