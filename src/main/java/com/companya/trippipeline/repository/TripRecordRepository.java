package com.companya.trippipeline.repository;

import com.companya.trippipeline.model.TripRecordEntity;
import com.companya.trippipeline.model.TripRecordKey;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TripRecordRepository extends JpaRepository<TripRecordEntity, TripRecordKey> {

    List<TripRecordEntity> findByTableNameOrderByIdAsc(String tableName, Pageable pageable);

    /**
     * Next page of a keyset scan: rows of the table sorted by id, strictly after
     * the last id already returned.
     */
    List<TripRecordEntity> findByTableNameAndIdGreaterThanOrderByIdAsc(String tableName, String id, Pageable pageable);

    long countByTableName(String tableName);
}
