package org.lsmkv.core.wal;

public enum EntryKind {
    PUT((byte) 0),
    DELETE((byte) 1);

    private final byte code;

    EntryKind(byte code) {
        this.code = code;
    }

    public byte getCode() {
        return code;
    }

    public static EntryKind fromCode(byte code) throws WalCorruptionException {
        for (EntryKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new WalCorruptionException("unknown wal entry type: " + code);
    }
}
