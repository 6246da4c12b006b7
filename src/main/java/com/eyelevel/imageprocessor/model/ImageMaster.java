package com.eyelevel.imageprocessor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "image_master", indexes = @Index(name = "idx_image_master_batch", columnList = "batch_master_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageMaster {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "batch_master_id", nullable = false)
    private BatchMaster batchMaster;

    @Column(nullable = false, length = 2048)
    private String originalPath;

    @Column(nullable = false)
    private String fileName;

    private Long fileSize;

    private String extension;

    private String fileHash;

    @Column(length = 2048)
    private String processedPath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ImageStatus status;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
