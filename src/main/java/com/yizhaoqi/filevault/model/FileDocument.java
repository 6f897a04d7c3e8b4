package com.yizhaoqi.filevault.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;


@Data
@Entity
@Table(name = "files", indexes = {
        @Index(name = "idx_files_owner_parent", columnList = "user_id, parent_id")
})
public class FileDocument {

    /** Stored value of {@code parentId} for entries placed at the top level. */
    public static final long ROOT_PARENT_ID = 0L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "file_type", length = 16, nullable = false, updatable = false)
    private FileType type;


    @Column(name = "parent_id", nullable = false, updatable = false)
    private Long parentId = ROOT_PARENT_ID;


    @Column(name = "is_public", nullable = false)
    private boolean isPublic = false;

    // Null for folders.
    @Column(name = "content_ref", length = 64)
    private String contentRef;

    @CreationTimestamp
    private LocalDateTime createdAt;

    public ParentRef getParent() {
        return ParentRef.fromStored(parentId);
    }

    public void setParent(ParentRef parent) {
        this.parentId = parent.toStored();
    }
}
