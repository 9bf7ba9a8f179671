package com.example.metaindex;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.util.List;

@NoRepositoryBean
public interface OriginMetadataRepository<R extends OriginMetadataRecord> extends FactRepository<R> {

    List<R> findBySearchVectorContaining(String needle);

    @Query("select distinct r.objectId from #{#entityName} r where r.objectId > :after order by r.objectId")
    List<String> findObjectIdsAfter(@Param("after") String after, Pageable pageable);
}
