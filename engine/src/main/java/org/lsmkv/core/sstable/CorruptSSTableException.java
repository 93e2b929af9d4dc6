package org.lsmkv.core.sstable;

import java.io.IOException;
import java.nio.file.Path;

public class CorruptSSTableException extends IOException {

    public CorruptSSTableException(Path path, String message) {
        super("corrupt sstable " + path + ": " + message);
    }

    public CorruptSSTableException(Path path, String message, Throwable cause) {
        super("corrupt sstable " + path + ": " + message, cause);
    }
}
