package org.lsmkv.core.compaction;

import java.util.List;

/**
 * Decides whether and what to compact. {@code levels} is indexed by level
 * number and covers every configured level, empty ones included.
 */
public interface CompactionStrategy {

    boolean shouldCompact(List<LevelMetadata> levels);

    /**
     * @return the highest priority job, or null when nothing needs compacting
     */
    CompactionJob selectSSTables(List<LevelMetadata> levels);
}
