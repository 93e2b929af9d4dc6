package org.lsmkv.core.sstable.util;

import java.nio.ByteBuffer;

public class SSTableFooterUtils {

    private SSTableFooterUtils() {}

    public static void writeFooter(ByteBuffer buffer, FooterData footer) {
        buffer.putLong(footer.metadataOffset);
        buffer.putLong(footer.filterOffset);
        buffer.putLong(footer.indexOffset);
        buffer.putLong(SSTableConstants.FOOTER_MAGIC);
    }

    /**
     * @throws IllegalArgumentException when the magic number does not match
     */
    public static FooterData readFooter(ByteBuffer buffer) {
        long metadataOffset = buffer.getLong();
        long filterOffset = buffer.getLong();
        long indexOffset = buffer.getLong();
        long magic = buffer.getLong();
        if (magic != SSTableConstants.FOOTER_MAGIC) {
            throw new IllegalArgumentException("footer magic mismatch " + Long.toHexString(magic));
        }
        return new FooterData(metadataOffset, filterOffset, indexOffset);
    }

    public static class FooterData {
        public final long metadataOffset;
        public final long filterOffset;
        public final long indexOffset;

        public FooterData(long metadataOffset, long filterOffset, long indexOffset) {
            this.metadataOffset = metadataOffset;
            this.filterOffset = filterOffset;
            this.indexOffset = indexOffset;
        }

        public boolean isOrderedWithin(long limit) {
            return metadataOffset >= 0
                    && metadataOffset <= filterOffset
                    && filterOffset <= indexOffset
                    && indexOffset <= limit;
        }
    }
}
