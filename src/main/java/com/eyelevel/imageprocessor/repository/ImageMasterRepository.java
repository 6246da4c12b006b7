package com.eyelevel.imageprocessor.repository;

import com.eyelevel.imageprocessor.model.ImageMaster;
import com.eyelevel.imageprocessor.model.ImageStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the {@link ImageMaster} entity.
 */
@Repository
public interface ImageMasterRepository extends JpaRepository<ImageMaster, Long> {

    List<ImageMaster> findAllByBatchMasterBatchId(String batchId);

    long countByBatchMasterBatchIdAndStatus(String batchId, ImageStatus status);
}
