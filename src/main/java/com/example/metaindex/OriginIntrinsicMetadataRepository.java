package com.example.metaindex;

public interface OriginIntrinsicMetadataRepository extends OriginMetadataRepository<OriginIntrinsicMetadataRecord> {
}
