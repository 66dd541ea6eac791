package com.capgate.gatekeeper.repository;

import com.capgate.gatekeeper.model.ApprovalRecord;
import com.capgate.gatekeeper.model.ApprovalStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the approvals table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface ApprovalRepository extends JpaRepository<ApprovalRecord, UUID> {

    /**
     * Load a record with SELECT ... FOR UPDATE.
     *
     * The row lock is held until the surrounding transaction commits, so two
     * concurrent resolutions of the same approval run one after the other and
     * the second one sees the first one's outcome.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM ApprovalRecord a WHERE a.id = :id")
    Optional<ApprovalRecord> findByIdForUpdate(@Param("id") UUID id);

    List<ApprovalRecord> findAllByOrderByCreatedAtAscIdAsc();

    List<ApprovalRecord> findByStatusOrderByCreatedAtAscIdAsc(ApprovalStatus status);
}
