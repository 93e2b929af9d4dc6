package org.lsmkv.core.wal;

import java.io.IOException;

/**
 * A wal record whose framing is readable but whose content contradicts itself.
 * Unlike a torn tail this cannot be explained by a crash mid-append.
 */
public class WalCorruptionException extends IOException {

    public WalCorruptionException(String message) {
        super(message);
    }
}
