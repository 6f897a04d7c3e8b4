package com.yizhaoqi.filevault.service;

import com.yizhaoqi.filevault.model.FileDocument;

import java.util.Objects;

public final class AccessResolver {

    private AccessResolver() {
    }

    /**
     * A file is readable when it is public, or when the requester owns it.
     *
     * @param requesterId the authenticated user, or null for anonymous callers
     */
    public static boolean canRead(Long requesterId, FileDocument file) {
        if (file.isPublic()) {
            return true;
        }
        return requesterId != null && Objects.equals(requesterId, file.getUserId());
    }
}
