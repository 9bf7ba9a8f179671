package com.example.metaindex;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface LicenseRepository extends JpaRepository<LicenseRecord, Integer> {
    Optional<LicenseRecord> findByName(String name);
    List<LicenseRecord> findByNameIn(Collection<String> names);
}
