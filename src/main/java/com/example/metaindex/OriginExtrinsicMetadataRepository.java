package com.example.metaindex;

public interface OriginExtrinsicMetadataRepository extends OriginMetadataRepository<OriginExtrinsicMetadataRecord> {
}
