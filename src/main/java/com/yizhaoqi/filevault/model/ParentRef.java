package com.yizhaoqi.filevault.model;

import com.yizhaoqi.filevault.utils.IdCodec;

import java.util.Objects;
import java.util.Optional;

/**
 * Placement of a file in the tree: either the root or a folder id.
 * Request values ({@code 0}, {@code "0"}, absent, or a hex id) are resolved
 * into this type once, at the HTTP boundary.
 */
public final class ParentRef {

    public static final ParentRef ROOT = new ParentRef(null);

    private final Long folderId;

    private ParentRef(Long folderId) {
        this.folderId = folderId;
    }

    public static ParentRef folder(long folderId) {
        if (folderId <= 0) {
            throw new IllegalArgumentException("Folder id must be positive: " + folderId);
        }
        return new ParentRef(folderId);
    }

    /**
     * Resolves a loosely-typed request value. Empty means the value is not
     * the root marker and not a well-formed id.
     */
    public static Optional<ParentRef> parse(Object raw) {
        if (raw == null) {
            return Optional.of(ROOT);
        }
        if (raw instanceof Number number) {
            return number.doubleValue() == 0
                    ? Optional.of(ROOT)
                    : Optional.empty();
        }
        String value = raw.toString().trim();
        if (value.isEmpty() || "0".equals(value)) {
            return Optional.of(ROOT);
        }
        return IdCodec.parse(value).map(ParentRef::folder);
    }

    static ParentRef fromStored(Long parentId) {
        return parentId == null || parentId == FileDocument.ROOT_PARENT_ID ? ROOT : folder(parentId);
    }

    public long toStored() {
        return isRoot() ? FileDocument.ROOT_PARENT_ID : folderId;
    }

    public boolean isRoot() {
        return folderId == null;
    }

    public long folderId() {
        if (folderId == null) {
            throw new IllegalStateException("Root has no folder id");
        }
        return folderId;
    }

    /** JSON form: numeric 0 for the root, the hex id otherwise. */
    public Object toJsonValue() {
        return isRoot() ? 0 : IdCodec.toHex(folderId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParentRef other)) return false;
        return Objects.equals(folderId, other.folderId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(folderId);
    }

    @Override
    public String toString() {
        return isRoot() ? "ParentRef[root]" : "ParentRef[" + IdCodec.toHex(folderId) + "]";
    }
}
