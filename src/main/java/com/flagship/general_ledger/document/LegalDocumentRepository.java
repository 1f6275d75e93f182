package com.flagship.general_ledger.document;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface LegalDocumentRepository extends JpaRepository<LegalDocumentEntity, UUID> {

    /**
     * SELECT ... FOR UPDATE on the document row. Every document-level operation takes
     * this lock before touching the document's entries.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM LegalDocumentEntity d WHERE d.id = :id")
    Optional<LegalDocumentEntity> findByIdForUpdate(@Param("id") UUID id);
}
