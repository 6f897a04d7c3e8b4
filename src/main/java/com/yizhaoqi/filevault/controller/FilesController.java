package com.yizhaoqi.filevault.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yizhaoqi.filevault.exception.ContentStoreException;
import com.yizhaoqi.filevault.exception.CustomException;
import com.yizhaoqi.filevault.exception.JobException;
import com.yizhaoqi.filevault.model.FileDocument;
import com.yizhaoqi.filevault.model.FileResponse;
import com.yizhaoqi.filevault.model.FileType;
import com.yizhaoqi.filevault.model.ParentRef;
import com.yizhaoqi.filevault.service.AccessResolver;
import com.yizhaoqi.filevault.service.FileService;
import com.yizhaoqi.filevault.service.ThumbnailService;
import com.yizhaoqi.filevault.utils.IdCodec;
import com.yizhaoqi.filevault.utils.LogUtils;
import org.apache.commons.codec.binary.Base64;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@RestController
@RequestMapping("/files")
public class FilesController {

    private static final Pattern PAGE_NUMBER = Pattern.compile("\\d+");

    private final FileService fileService;

    public FilesController(FileService fileService) {
        this.fileService = fileService;
    }


    /**
     * Creates a folder, file or image. {@code data} is the Base64 content and
     * is required for files and images; {@code parentId} defaults to the root.
     */
    @PostMapping
    public ResponseEntity<?> upload(@RequestBody(required = false) CreateFileRequest request,
                                    @RequestAttribute("userId") Long userId) {
        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor("UPLOAD_FILE");
        String owner = IdCodec.toHex(userId);
        CreateFileRequest body = request != null ? request : new CreateFileRequest(null, null, null, null, null);
        try {
            FileType type = body.type() == null ? null : FileType.fromValue(body.type()).orElse(null);
            ParentRef parent = ParentRef.parse(body.parentId()).orElse(null);
            byte[] data = body.data() == null || body.data().isEmpty() ? null : Base64.decodeBase64(body.data());
            boolean isPublic = Boolean.TRUE.equals(body.isPublic());

            LogUtils.logBusiness("UPLOAD_FILE", owner, "name=%s, type=%s, parent=%s, isPublic=%s",
                    body.name(), body.type(), parent, isPublic);

            FileDocument file = fileService.create(userId, body.name(), type, parent, isPublic, data);

            LogUtils.logFileOperation(owner, "UPLOAD", file.getName(), IdCodec.toHex(file.getId()), "SUCCESS");
            monitor.end("created");
            return ResponseEntity.status(HttpStatus.CREATED).body(FileResponse.from(file));
        } catch (CustomException e) {
            LogUtils.logFileOperation(owner, "UPLOAD", body.name(), null, "FAILED: " + e.getMessage());
            monitor.end("rejected: " + e.getMessage());
            return ResponseEntity.status(e.getStatus()).body(Map.of("error", e.getMessage()));
        } catch (ContentStoreException | JobException e) {
            LogUtils.logBusinessError("UPLOAD_FILE", owner, "Failed to store %s", e, body.name());
            monitor.end("failed: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", "Failed to store file"));
        } catch (Exception e) {
            LogUtils.logBusinessError("UPLOAD_FILE", owner, "Unexpected failure for %s", e, body.name());
            monitor.end("failed: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", "Internal server error"));
        }
    }


    @GetMapping("/{id}")
    public ResponseEntity<?> show(@PathVariable String id, @RequestAttribute("userId") Long userId) {
        Optional<FileDocument> file = IdCodec.parse(id).flatMap(fileService::findById);
        if (file.isEmpty() || !AccessResolver.canRead(userId, file.get())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Not found"));
        }
        return ResponseEntity.ok(FileResponse.from(file.get()));
    }


    /**
     * Lists the caller's entries under {@code parentId}, 20 per page, newest first.
     */
    @GetMapping
    public ResponseEntity<?> index(@RequestParam(value = "parentId", required = false) String parentId,
                                   @RequestParam(value = "page", required = false) String page,
                                   @RequestAttribute("userId") Long userId) {
        Optional<ParentRef> parent = ParentRef.parse(parentId);
        if (parent.isEmpty()) {
            return ResponseEntity.ok(List.of());
        }
        List<FileResponse> files = fileService.listChildren(userId, parent.get(), parsePage(page)).stream()
                .map(FileResponse::from)
                .toList();
        return ResponseEntity.ok(files);
    }


    @PutMapping("/{id}/publish")
    public ResponseEntity<?> publish(@PathVariable String id, @RequestAttribute("userId") Long userId) {
        return changeVisibility(id, userId, true);
    }


    @PutMapping("/{id}/unpublish")
    public ResponseEntity<?> unpublish(@PathVariable String id, @RequestAttribute("userId") Long userId) {
        return changeVisibility(id, userId, false);
    }


    /**
     * Returns the raw content, or the derivative named by {@code size}
     * (500, 250 or 100; any other value means the original). Private files
     * are only served to their owner.
     */
    @GetMapping("/{id}/data")
    public ResponseEntity<?> data(@PathVariable String id,
                                  @RequestParam(value = "size", required = false) String size,
                                  @RequestAttribute(value = "userId", required = false) Long userId) {
        try {
            Long fileId = IdCodec.parse(id).orElseThrow(CustomException::notFound);
            FileService.FileContent content = fileService.readContent(fileId, userId,
                    ThumbnailService.widthFromSelector(size));
            return ResponseEntity.ok()
                    .contentType(content.mediaType())
                    .body(content.data());
        } catch (CustomException e) {
            return ResponseEntity.status(e.getStatus()).body(Map.of("error", e.getMessage()));
        }
    }


    private ResponseEntity<?> changeVisibility(String id, Long userId, boolean isPublic) {
        String owner = IdCodec.toHex(userId);
        try {
            Long fileId = IdCodec.parse(id).orElseThrow(CustomException::notFound);
            FileDocument file = fileService.setVisibility(fileId, userId, isPublic);
            LogUtils.logFileOperation(owner, isPublic ? "PUBLISH" : "UNPUBLISH", file.getName(), id, "SUCCESS");
            return ResponseEntity.ok(FileResponse.from(file));
        } catch (CustomException e) {
            LogUtils.logFileOperation(owner, isPublic ? "PUBLISH" : "UNPUBLISH", null, id, "FAILED: " + e.getMessage());
            return ResponseEntity.status(e.getStatus()).body(Map.of("error", e.getMessage()));
        }
    }

    // Non-numeric values mean the first page; numbers too large for a long are past any last page.
    private long parsePage(String page) {
        if (page == null || !PAGE_NUMBER.matcher(page.trim()).matches()) {
            return 0;
        }
        try {
            return Long.parseLong(page.trim());
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}


record CreateFileRequest(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("parentId") Object parentId,
        @JsonProperty("isPublic") Boolean isPublic,
        @JsonProperty("data") String data) {}
