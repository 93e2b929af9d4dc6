package org.lsmkv.core.compaction;

import java.util.List;

import org.lsmkv.common.AppConstants;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;

/**
 * Level 0 compacts once it holds {@code maxL0Files} tables, whatever their
 * size. Level {@code i >= 1} compacts once its size exceeds
 * {@code baseLevelBytes * multiplier^(i-1)}. The last level is never a source.
 */
public class SizeTieredStrategy implements CompactionStrategy {
    private final int maxL0Files;
    private final long baseLevelBytes;
    private final int multiplier;
    private final int maxLevels;

    public SizeTieredStrategy(int maxLevels) {
        this(AppConstants.DEFAULT_MAX_L0_FILES, AppConstants.DEFAULT_LEVEL_BASE_BYTES,
                AppConstants.DEFAULT_LEVEL_SIZE_MULTIPLIER, maxLevels);
    }

    public SizeTieredStrategy(int maxL0Files, long baseLevelBytes, int multiplier, int maxLevels) {
        Preconditions.checkArgument(maxL0Files >= 1, "maxL0Files must be at least 1");
        Preconditions.checkArgument(baseLevelBytes > 0, "baseLevelBytes must be positive");
        Preconditions.checkArgument(multiplier >= 1, "multiplier must be at least 1");
        Preconditions.checkArgument(maxLevels >= 2, "at least two levels are needed to compact");
        this.maxL0Files = maxL0Files;
        this.baseLevelBytes = baseLevelBytes;
        this.multiplier = multiplier;
        this.maxLevels = maxLevels;
    }

    @Override
    public boolean shouldCompact(List<LevelMetadata> levels) {
        return selectSSTables(levels) != null;
    }

    @Override
    public CompactionJob selectSSTables(List<LevelMetadata> levels) {
        int lastLevel = Math.min(levels.size(), maxLevels) - 1;
        if (lastLevel < 1) {
            return null;
        }
        LevelMetadata level0 = levels.get(0);
        if (level0.getFileCount() >= maxL0Files) {
            return jobFor(levels, 0);
        }
        for (int i = 1; i < lastLevel; i++) {
            LevelMetadata level = levels.get(i);
            if (!level.isEmpty() && level.getTotalSize() > maxBytesFor(i)) {
                return jobFor(levels, i);
            }
        }
        return null;
    }

    @VisibleForTesting
    long maxBytesFor(int level) {
        return LongMath.saturatedMultiply(baseLevelBytes, LongMath.saturatedPow(multiplier, level - 1));
    }

    private static CompactionJob jobFor(List<LevelMetadata> levels, int source) {
        boolean deeperTablesExist = false;
        for (int i = source + 1; i < levels.size(); i++) {
            if (!levels.get(i).isEmpty()) {
                deeperTablesExist = true;
                break;
            }
        }
        return new CompactionJob(source, source + 1, levels.get(source).getPaths(), !deeperTablesExist);
    }
}
