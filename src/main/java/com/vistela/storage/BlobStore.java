package com.vistela.storage;

import org.springframework.core.io.Resource;

import java.io.IOException;

public interface BlobStore {

    /**
     * Upload {@code source} to object storage.
     * <p>
     * The key is {@code folder/name} with leading and trailing slashes stripped from the folder,
     * or {@code name} alone when no folder is given. An existing object under the same key is
     * overwritten.
     *
     * @param source re-readable content; every read starts at the first byte
     * @param name   object name, used verbatim
     * @param folder optional prefix, may be {@code null}
     * @return the object key
     * @throws com.vistela.exception.ConfigurationException if credentials or bucket are unset
     * @throws com.vistela.exception.BlobStoreException     if the store rejected the upload or stayed unreachable
     * @throws IOException                                  if the source cannot be read
     */
    String upload(Resource source, String name, String folder) throws IOException;

    default String upload(Resource source, String name) throws IOException {
        return upload(source, name, null);
    }
}
