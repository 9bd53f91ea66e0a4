package org.emeraldos.gem.io;

import org.emeraldos.gem.compiler.AssetStore;
import org.emeraldos.gem.error.GemError;
import org.emeraldos.gem.lang.Result;
import org.emeraldos.gem.tree.SourcePosition;
import org.emeraldos.gem.tree.SourceSpan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Assets stored as files under a root directory. Paths leaving the root are treated as missing.
 */
public final class FileSystemAssetStore implements AssetStore {
    private final Path root;

    private FileSystemAssetStore(Path root) {
        this.root = root.toAbsolutePath()
                        .normalize();
    }

    public static FileSystemAssetStore rootedAt(Path root) {
        return new FileSystemAssetStore(root);
    }

    @Override
    public boolean exists(String path) {
        return resolve(path).map(Files::isRegularFile)
                            .orElse(false);
    }

    @Override
    public Result<String> read(String path) {
        var file = resolve(path);
        if (file.isEmpty() || !Files.isRegularFile(file.get())) {
            return Result.failure(fileError(path, "Cannot find file " + path + "."));
        }
        try{
            return Result.success(Files.readString(file.get(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            return Result.failure(fileError(path, "Cannot read file " + path + ": " + e.getMessage()));
        }
    }

    private Optional<Path> resolve(String path) {
        try{
            var resolved = root.resolve(path)
                               .normalize();
            return resolved.startsWith(root)
                   ? Optional.of(resolved)
                   : Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private static GemError fileError(String path, String details) {
        return new GemError.FileError(SourceSpan.at(SourcePosition.start(path)), details);
    }
}
