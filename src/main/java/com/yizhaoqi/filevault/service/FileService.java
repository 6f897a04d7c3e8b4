package com.yizhaoqi.filevault.service;

import com.yizhaoqi.filevault.exception.ContentStoreException;
import com.yizhaoqi.filevault.exception.CustomException;
import com.yizhaoqi.filevault.exception.JobException;
import com.yizhaoqi.filevault.model.FileDocument;
import com.yizhaoqi.filevault.model.FileType;
import com.yizhaoqi.filevault.model.ParentRef;
import com.yizhaoqi.filevault.model.ThumbnailTask;
import com.yizhaoqi.filevault.repository.FileDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * File tree metadata: creation, lookup, listing and visibility. Content
 * bytes go to the {@link ContentStore}; image uploads additionally queue
 * thumbnail generation.
 */
@Service
public class FileService {

    private static final Logger logger = LoggerFactory.getLogger(FileService.class);

    private final FileDocumentRepository fileDocumentRepository;
    private final ContentStore contentStore;
    private final JobQueueService jobQueueService;

    @Value("${files.page-size:20}")
    private int pageSize = 20;

    public FileService(FileDocumentRepository fileDocumentRepository, ContentStore contentStore,
                       JobQueueService jobQueueService) {
        this.fileDocumentRepository = fileDocumentRepository;
        this.contentStore = contentStore;
        this.jobQueueService = jobQueueService;
    }


    /**
     * Creates a folder, file or image. Validation order: name, type, data, parent.
     *
     * @param data decoded content; required unless {@code type} is a folder
     */
    public FileDocument create(Long ownerId, String name, FileType type, ParentRef parent,
                               boolean isPublic, byte[] data) throws ContentStoreException {
        if (name == null || name.isEmpty()) {
            throw CustomException.badRequest("Missing name");
        }
        if (type == null) {
            throw CustomException.badRequest("Missing type");
        }
        if (type == FileType.FOLDER) {
            return createFolder(ownerId, name, parent, isPublic);
        }
        return createFile(ownerId, name, type, parent, isPublic, data);
    }


    public FileDocument createFolder(Long ownerId, String name, ParentRef parent, boolean isPublic) {
        if (name == null || name.isEmpty()) {
            throw CustomException.badRequest("Missing name");
        }
        validateParent(parent);

        FileDocument folder = newDocument(ownerId, name, FileType.FOLDER, parent, isPublic);
        FileDocument saved = fileDocumentRepository.save(folder);
        logger.info("Folder created, id={}, owner={}, parent={}", saved.getId(), ownerId, parent);
        return saved;
    }


    /**
     * Writes the content, then the metadata. If the metadata write fails the
     * content is deleted; if queueing thumbnails fails both are removed.
     */
    public FileDocument createFile(Long ownerId, String name, FileType type, ParentRef parent,
                                   boolean isPublic, byte[] data) throws ContentStoreException {
        if (type == null || !type.hasContent()) {
            throw new IllegalArgumentException("createFile requires a file or image type, got " + type);
        }
        if (name == null || name.isEmpty()) {
            throw CustomException.badRequest("Missing name");
        }
        if (data == null) {
            throw CustomException.badRequest("Missing data");
        }
        validateParent(parent);

        String contentRef = contentStore.put(data);

        FileDocument file = newDocument(ownerId, name, type, parent, isPublic);
        file.setContentRef(contentRef);
        FileDocument saved;
        try {
            saved = fileDocumentRepository.save(file);
        } catch (RuntimeException e) {
            logger.error("Failed to persist file metadata, removing content {}", contentRef, e);
            contentStore.delete(contentRef);
            throw e;
        }

        if (type == FileType.IMAGE) {
            try {
                jobQueueService.enqueueThumbnails(new ThumbnailTask(saved.getId(), ownerId));
            } catch (JobException e) {
                logger.error("Failed to queue thumbnails for file {}, rolling back", saved.getId(), e);
                try {
                    fileDocumentRepository.deleteById(saved.getId());
                } catch (RuntimeException cleanup) {
                    e.addSuppressed(cleanup);
                }
                contentStore.delete(contentRef);
                throw e;
            }
        }

        logger.info("File created, id={}, owner={}, type={}, content={}", saved.getId(), ownerId, type, contentRef);
        return saved;
    }


    public Optional<FileDocument> findById(Long fileId) {
        if (fileId == null) {
            return Optional.empty();
        }
        return fileDocumentRepository.findById(fileId);
    }


    /**
     * One page of the owner's entries under {@code parent}, newest first.
     * Pages past the end, and parents that do not exist, give an empty list.
     */
    public List<FileDocument> listChildren(Long ownerId, ParentRef parent, long page) {
        long safePage = Math.max(page, 0);
        // Offsets beyond the int range cannot be queried and cannot hold any record.
        if (safePage > Integer.MAX_VALUE / pageSize) {
            return List.of();
        }
        PageRequest pageRequest = PageRequest.of((int) safePage, pageSize, Sort.by(Sort.Direction.DESC, "id"));
        return fileDocumentRepository.findByUserIdAndParentId(ownerId, parent.toStored(), pageRequest);
    }


    /**
     * Publishes or unpublishes a file. Files owned by someone else are
     * reported exactly like missing ones.
     */
    @Transactional
    public FileDocument setVisibility(Long fileId, Long ownerId, boolean isPublic) {
        FileDocument file = findOwned(fileId, ownerId).orElseThrow(CustomException::notFound);
        file.setPublic(isPublic);
        fileDocumentRepository.save(file);
        logger.info("Visibility changed, id={}, owner={}, isPublic={}", fileId, ownerId, isPublic);
        return findOwned(fileId, ownerId).orElseThrow(CustomException::notFound);
    }


    /**
     * Content of a readable file.
     *
     * @param requesterId authenticated caller or null
     * @param width derivative width, or null for the original
     */
    public FileContent readContent(Long fileId, Long requesterId, Integer width) {
        FileDocument file = findById(fileId).orElseThrow(CustomException::notFound);
        if (!AccessResolver.canRead(requesterId, file)) {
            throw CustomException.notFound();
        }
        if (!file.getType().hasContent()) {
            throw CustomException.badRequest("A folder doesn't have content");
        }

        byte[] data;
        try {
            data = contentStore.get(file.getContentRef(), width).orElseThrow(CustomException::notFound);
        } catch (ContentStoreException e) {
            logger.warn("Failed to read content of file {}", fileId, e);
            throw CustomException.notFound();
        }
        MediaType mediaType = MediaTypeFactory.getMediaType(file.getName())
                .orElse(MediaType.APPLICATION_OCTET_STREAM);
        return new FileContent(file, data, mediaType);
    }


    private Optional<FileDocument> findOwned(Long fileId, Long ownerId) {
        if (fileId == null || ownerId == null) {
            return Optional.empty();
        }
        return fileDocumentRepository.findByIdAndUserId(fileId, ownerId);
    }

    // A null parent is a request value that was neither the root marker nor a well-formed id.
    private void validateParent(ParentRef parent) {
        if (parent == null) {
            throw CustomException.badRequest("Parent not found");
        }
        if (parent.isRoot()) {
            return;
        }
        FileDocument parentFile = fileDocumentRepository.findById(parent.folderId())
                .orElseThrow(() -> CustomException.badRequest("Parent not found"));
        if (parentFile.getType() != FileType.FOLDER) {
            throw CustomException.badRequest("Parent is not a folder");
        }
    }

    private FileDocument newDocument(Long ownerId, String name, FileType type, ParentRef parent, boolean isPublic) {
        FileDocument file = new FileDocument();
        file.setUserId(ownerId);
        file.setName(name);
        file.setType(type);
        file.setParent(parent);
        file.setPublic(isPublic);
        return file;
    }


    public record FileContent(FileDocument file, byte[] data, MediaType mediaType) {
    }
}
