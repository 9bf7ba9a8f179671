package com.example.metaindex;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SchemaVersionRepository extends JpaRepository<SchemaVersionRecord, Integer> {

    Optional<SchemaVersionRecord> findTopByOrderByVersionDesc();

    List<SchemaVersionRecord> findAllByOrderByVersionAsc();
}
