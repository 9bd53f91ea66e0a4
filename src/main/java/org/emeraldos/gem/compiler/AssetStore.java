package org.emeraldos.gem.compiler;

import org.emeraldos.gem.lang.Result;

/**
 * Access to included files. Paths are passed exactly as written in the document;
 * resolving them against a storage location is up to the implementation.
 */
public interface AssetStore {

    boolean exists(String path);

    /**
     * Read the whole file as text. Fails with a {@link org.emeraldos.gem.error.GemError.FileError}
     * when the file cannot be read.
     */
    Result<String> read(String path);
}
