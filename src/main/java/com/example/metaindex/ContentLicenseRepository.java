package com.example.metaindex;

public interface ContentLicenseRepository extends FactRepository<ContentLicenseRecord> {
}
