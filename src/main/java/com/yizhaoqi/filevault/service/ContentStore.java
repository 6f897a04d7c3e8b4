package com.yizhaoqi.filevault.service;

import com.yizhaoqi.filevault.exception.ContentStoreException;

import java.util.Optional;

/**
 * Raw file bytes addressed by a generated reference. Derivatives of a blob
 * share its reference and are told apart by width.
 */
public interface ContentStore {

    /**
     * Stores bytes under a freshly generated reference.
     *
     * @return the reference to store on the metadata record
     */
    String put(byte[] data) throws ContentStoreException;

    /**
     * Reads the original blob, or the derivative of the given width when
     * {@code width} is not null. Empty when nothing is stored there.
     */
    Optional<byte[]> get(String contentRef, Integer width) throws ContentStoreException;

    /** Writes or overwrites the derivative of the given width. */
    void putDerivative(String contentRef, int width, byte[] data) throws ContentStoreException;

    /** Removes the original blob; missing blobs are ignored. */
    void delete(String contentRef);
}
