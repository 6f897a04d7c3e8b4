package com.yizhaoqi.filevault.repository;

import com.yizhaoqi.filevault.model.FileDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FileDocumentRepository extends JpaRepository<FileDocument, Long> {

    Optional<FileDocument> findByIdAndUserId(Long id, Long userId);


    List<FileDocument> findByUserIdAndParentId(Long userId, Long parentId, Pageable pageable);
}
