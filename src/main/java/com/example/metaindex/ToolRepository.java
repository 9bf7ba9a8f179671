package com.example.metaindex;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ToolRepository extends JpaRepository<IndexerTool, Long> {
    Optional<IndexerTool> findByNameAndVersionAndConfigurationHash(String name, String version, String configurationHash);
}
