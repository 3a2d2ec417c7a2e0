package com.example.jsonecho;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

/** Reading or writing a file below the project root failed. */
public class FileAccessException extends JsonEchoException {

    private FileAccessException(JsonEchoErrorCode code, Object path, String message, Throwable cause) {
        super(code, message, Map.of("path", path), cause);
    }

    public static FileAccessException notFound(Path path) {
        return new FileAccessException(JsonEchoErrorCode.NOT_FOUND, path, "Path not found: " + path, null);
    }

    public static FileAccessException isADirectory(Path path) {
        return new FileAccessException(JsonEchoErrorCode.IS_A_DIRECTORY, path,
                "Expected a file but found a directory: " + path, null);
    }

    public static FileAccessException permissionDenied(Path path, Throwable cause) {
        return new FileAccessException(JsonEchoErrorCode.PERMISSION_DENIED, path,
                "Permission denied for path: " + path, cause);
    }

    public static FileAccessException ioError(Path path, Throwable cause) {
        return new FileAccessException(JsonEchoErrorCode.IO_ERROR, path,
                "I/O error accessing path '" + path + "': " + cause.getMessage(), cause);
    }

    public static FileAccessException invalidPath(String path, InvalidPathException cause) {
        return new FileAccessException(JsonEchoErrorCode.IO_ERROR, path,
                "Invalid path '" + path + "': " + cause.getReason(), cause);
    }

    /** Maps an {@link IOException} raised by {@code java.nio.file.Files} onto the error taxonomy. */
    static FileAccessException fromIo(Path path, IOException ex) {
        if (ex instanceof NoSuchFileException) {
            return new FileAccessException(JsonEchoErrorCode.NOT_FOUND, path, "Path not found: " + path, ex);
        }
        if (ex instanceof AccessDeniedException) {
            return permissionDenied(path, ex);
        }
        return ioError(path, ex);
    }
}
