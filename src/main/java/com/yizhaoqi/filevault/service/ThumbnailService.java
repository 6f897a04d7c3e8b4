package com.yizhaoqi.filevault.service;

import com.yizhaoqi.filevault.exception.ContentStoreException;
import com.yizhaoqi.filevault.exception.FatalJobException;
import com.yizhaoqi.filevault.exception.JobException;
import com.yizhaoqi.filevault.model.FileDocument;
import com.yizhaoqi.filevault.model.ThumbnailTask;
import com.yizhaoqi.filevault.repository.FileDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Builds the scaled copies of an uploaded image. Output locations depend
 * only on the content reference and width, so running a task again
 * overwrites the same files with the same bytes.
 */
@Service
public class ThumbnailService {

    private static final Logger logger = LoggerFactory.getLogger(ThumbnailService.class);

    public static final List<Integer> WIDTHS = List.of(500, 250, 100);

    private final FileDocumentRepository fileDocumentRepository;
    private final ContentStore contentStore;
    private final ImageResizer imageResizer;

    public ThumbnailService(FileDocumentRepository fileDocumentRepository, ContentStore contentStore,
                            ImageResizer imageResizer) {
        this.fileDocumentRepository = fileDocumentRepository;
        this.contentStore = contentStore;
        this.imageResizer = imageResizer;
    }


    /**
     * Maps a {@code size} query value to a derivative width. Anything other
     * than one of {@link #WIDTHS} means the original.
     */
    public static Integer widthFromSelector(String size) {
        if (size == null) {
            return null;
        }
        try {
            int width = Integer.parseInt(size.trim());
            return WIDTHS.contains(width) ? width : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }


    /**
     * @throws FatalJobException when the task is malformed, names no file of that owner,
     *         or the content is not a decodable image
     * @throws JobException when the content store fails and the task should be retried
     */
    public void generate(ThumbnailTask task) {
        if (task == null || task.getFileId() == null) {
            throw new FatalJobException("Missing fileId");
        }
        if (task.getUserId() == null) {
            throw new FatalJobException("Missing userId");
        }

        FileDocument file = fileDocumentRepository.findByIdAndUserId(task.getFileId(), task.getUserId())
                .orElseThrow(() -> new FatalJobException("File not found"));
        if (file.getContentRef() == null) {
            throw new FatalJobException("File has no content: " + task.getFileId());
        }

        byte[] original;
        try {
            original = contentStore.get(file.getContentRef(), null)
                    .orElseThrow(() -> new FatalJobException("Content not found for file " + task.getFileId()));
        } catch (ContentStoreException e) {
            throw new JobException("Failed to read content of file " + task.getFileId(), e);
        }

        for (int width : WIDTHS) {
            logger.info("Generating thumbnail, file={}, content={}, width={}", file.getId(), file.getContentRef(), width);
            byte[] scaled;
            try {
                scaled = imageResizer.resizeToWidth(original, width)
                        .orElseThrow(() -> new FatalJobException("Not a decodable image: " + task.getFileId()));
            } catch (IOException e) {
                throw new FatalJobException("Failed to encode width " + width + " for file " + task.getFileId(), e);
            }
            try {
                contentStore.putDerivative(file.getContentRef(), width, scaled);
            } catch (ContentStoreException e) {
                throw new JobException("Failed to write width " + width + " for file " + task.getFileId(), e);
            }
        }
        logger.info("Thumbnails generated for file {}", file.getId());
    }
}
