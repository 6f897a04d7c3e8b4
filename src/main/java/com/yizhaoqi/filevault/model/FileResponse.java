package com.yizhaoqi.filevault.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.yizhaoqi.filevault.utils.IdCodec;

/**
 * External view of a {@link FileDocument}. {@code parentId} is the number 0
 * for top-level entries and the parent's hex id otherwise.
 */
@JsonPropertyOrder({"id", "userId", "name", "type", "isPublic", "parentId"})
public record FileResponse(
        @JsonProperty("id") String id,
        @JsonProperty("userId") String userId,
        @JsonProperty("name") String name,
        @JsonProperty("type") FileType type,
        @JsonProperty("isPublic") boolean isPublic,
        @JsonProperty("parentId") Object parentId) {

    public static FileResponse from(FileDocument file) {
        return new FileResponse(
                IdCodec.toHex(file.getId()),
                IdCodec.toHex(file.getUserId()),
                file.getName(),
                file.getType(),
                file.isPublic(),
                file.getParent().toJsonValue());
    }
}
