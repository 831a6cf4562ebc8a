package com.sessionhub.ingestion.repository;

import com.sessionhub.ingestion.model.ContentRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContentRecordRepository extends JpaRepository<ContentRecord, UUID> {

    /**
     * Loads a record with a row lock so concurrent slot updates of the same record serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ContentRecord c WHERE c.id = :id")
    Optional<ContentRecord> findByIdForUpdate(@Param("id") UUID id);
}
