package com.example.metaindex;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;

import java.util.Collection;
import java.util.List;

@NoRepositoryBean
public interface FactRepository<R extends FactRecord> extends JpaRepository<R, FactKey> {
    List<R> findByObjectIdIn(Collection<String> objectIds);
    List<R> findByObjectIdInAndToolIdIn(Collection<String> objectIds, Collection<Long> toolIds);
    List<R> findByToolId(Long toolId);
    long deleteByObjectIdInAndToolId(Collection<String> objectIds, Long toolId);
}
