package com.eyelevel.imageprocessor.repository;

import com.eyelevel.imageprocessor.model.BatchMaster;
import com.eyelevel.imageprocessor.model.BatchStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link BatchMaster} entity.
 */
@Repository
public interface BatchMasterRepository extends JpaRepository<BatchMaster, Long> {

    Optional<BatchMaster> findByBatchId(String batchId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE BatchMaster b SET b.status = :status, b.packagePath = :packagePath, b.errorMessage = :errorMessage, "
            + "b.updatedAt = CURRENT_TIMESTAMP WHERE b.batchId = :batchId")
    int updateOutcome(@Param("batchId") String batchId, @Param("status") BatchStatus status,
                      @Param("packagePath") String packagePath, @Param("errorMessage") String errorMessage);
}
