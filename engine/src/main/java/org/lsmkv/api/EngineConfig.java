package org.lsmkv.api;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import org.lsmkv.common.AppConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Settings of one store. Built through {@link #builder(Path)} or read from a
 * JSON object whose keys match the builder methods, for example
 * <pre>
 * {"dataDir": "/var/lib/kv", "memtableMaxBytes": 1048576, "compactionIntervalMs": 0}
 * </pre>
 * Missing keys keep their defaults.
 */
public final class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    private final Path dataDir;
    private final long memtableMaxBytes;
    private final long walSegmentMaxBytes;
    private final long compactionIntervalMs;
    private final int maxLevels;
    private final int maxL0Files;
    private final long levelBaseBytes;
    private final int levelSizeMultiplier;
    private final double bloomFalsePositiveRate;

    private EngineConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.memtableMaxBytes = builder.memtableMaxBytes;
        this.walSegmentMaxBytes = builder.walSegmentMaxBytes;
        this.compactionIntervalMs = builder.compactionIntervalMs;
        this.maxLevels = builder.maxLevels;
        this.maxL0Files = builder.maxL0Files;
        this.levelBaseBytes = builder.levelBaseBytes;
        this.levelSizeMultiplier = builder.levelSizeMultiplier;
        this.bloomFalsePositiveRate = builder.bloomFalsePositiveRate;
    }

    public static Builder builder(Path dataDir) {
        return new Builder(dataDir);
    }

    public static EngineConfig defaults(Path dataDir) {
        return builder(dataDir).build();
    }

    /**
     * @throws IllegalArgumentException when the document is not a JSON object,
     *         lacks {@code dataDir} or holds an invalid value
     */
    public static EngineConfig fromJson(String json) {
        try {
            return fromJsonObject(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid engine config: " + e.getMessage(), e);
        }
    }

    public static EngineConfig load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return fromJsonObject(JsonParser.parseReader(reader));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid engine config " + file + ": " + e.getMessage(), e);
        }
    }

    private static EngineConfig fromJsonObject(JsonElement element) {
        Preconditions.checkArgument(element != null && element.isJsonObject(), "engine config must be a JSON object");
        JsonObject config = element.getAsJsonObject();
        JsonElement dataDir = config.get("dataDir");
        Preconditions.checkArgument(dataDir != null && !dataDir.isJsonNull(), "engine config requires dataDir");

        Builder builder = builder(Paths.get(dataDir.getAsString()));
        for (Map.Entry<String, JsonElement> entry : config.entrySet()) {
            JsonElement value = entry.getValue();
            try {
                switch (entry.getKey()) {
                    case "dataDir":
                        break;
                    case "memtableMaxBytes":
                        builder.memtableMaxBytes(value.getAsLong());
                        break;
                    case "walSegmentMaxBytes":
                        builder.walSegmentMaxBytes(value.getAsLong());
                        break;
                    case "compactionIntervalMs":
                        builder.compactionIntervalMs(value.getAsLong());
                        break;
                    case "maxLevels":
                        builder.maxLevels(value.getAsInt());
                        break;
                    case "maxL0Files":
                        builder.maxL0Files(value.getAsInt());
                        break;
                    case "levelBaseBytes":
                        builder.levelBaseBytes(value.getAsLong());
                        break;
                    case "levelSizeMultiplier":
                        builder.levelSizeMultiplier(value.getAsInt());
                        break;
                    case "bloomFalsePositiveRate":
                        builder.bloomFalsePositiveRate(value.getAsDouble());
                        break;
                    default:
                        logger.warn("ignoring unknown engine config key {}", entry.getKey());
                }
            } catch (UnsupportedOperationException | IllegalStateException | NumberFormatException e) {
                throw new IllegalArgumentException("invalid value for " + entry.getKey() + ": " + value, e);
            }
        }
        return builder.build();
    }

    public Path getDataDir() {
        return dataDir;
    }

    public long getMemtableMaxBytes() {
        return memtableMaxBytes;
    }

    public long getWalSegmentMaxBytes() {
        return walSegmentMaxBytes;
    }

    public long getCompactionIntervalMs() {
        return compactionIntervalMs;
    }

    public int getMaxLevels() {
        return maxLevels;
    }

    public int getMaxL0Files() {
        return maxL0Files;
    }

    public long getLevelBaseBytes() {
        return levelBaseBytes;
    }

    public int getLevelSizeMultiplier() {
        return levelSizeMultiplier;
    }

    public double getBloomFalsePositiveRate() {
        return bloomFalsePositiveRate;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("dataDir", dataDir)
                .add("memtableMaxBytes", memtableMaxBytes)
                .add("walSegmentMaxBytes", walSegmentMaxBytes)
                .add("compactionIntervalMs", compactionIntervalMs)
                .add("maxLevels", maxLevels)
                .add("maxL0Files", maxL0Files)
                .add("levelBaseBytes", levelBaseBytes)
                .add("levelSizeMultiplier", levelSizeMultiplier)
                .add("bloomFalsePositiveRate", bloomFalsePositiveRate)
                .toString();
    }

    public static final class Builder {
        private final Path dataDir;
        private long memtableMaxBytes = AppConstants.DEFAULT_MEMTABLE_MAX_BYTES;
        private long walSegmentMaxBytes = AppConstants.DEFAULT_WAL_SEGMENT_MAX_BYTES;
        private long compactionIntervalMs = AppConstants.DEFAULT_COMPACTION_INTERVAL_MS;
        private int maxLevels = AppConstants.DEFAULT_MAX_LEVELS;
        private int maxL0Files = AppConstants.DEFAULT_MAX_L0_FILES;
        private long levelBaseBytes = AppConstants.DEFAULT_LEVEL_BASE_BYTES;
        private int levelSizeMultiplier = AppConstants.DEFAULT_LEVEL_SIZE_MULTIPLIER;
        private double bloomFalsePositiveRate = AppConstants.DEFAULT_BLOOM_FALSE_POSITIVE_RATE;

        private Builder(Path dataDir) {
            this.dataDir = Preconditions.checkNotNull(dataDir, "dataDir");
        }

        public Builder memtableMaxBytes(long memtableMaxBytes) {
            this.memtableMaxBytes = memtableMaxBytes;
            return this;
        }

        public Builder walSegmentMaxBytes(long walSegmentMaxBytes) {
            this.walSegmentMaxBytes = walSegmentMaxBytes;
            return this;
        }

        /** Zero or less disables background compaction. */
        public Builder compactionIntervalMs(long compactionIntervalMs) {
            this.compactionIntervalMs = compactionIntervalMs;
            return this;
        }

        public Builder maxLevels(int maxLevels) {
            this.maxLevels = maxLevels;
            return this;
        }

        public Builder maxL0Files(int maxL0Files) {
            this.maxL0Files = maxL0Files;
            return this;
        }

        public Builder levelBaseBytes(long levelBaseBytes) {
            this.levelBaseBytes = levelBaseBytes;
            return this;
        }

        public Builder levelSizeMultiplier(int levelSizeMultiplier) {
            this.levelSizeMultiplier = levelSizeMultiplier;
            return this;
        }

        public Builder bloomFalsePositiveRate(double bloomFalsePositiveRate) {
            this.bloomFalsePositiveRate = bloomFalsePositiveRate;
            return this;
        }

        public EngineConfig build() {
            Preconditions.checkArgument(memtableMaxBytes > 0, "memtableMaxBytes must be positive");
            Preconditions.checkArgument(walSegmentMaxBytes > 0, "walSegmentMaxBytes must be positive");
            Preconditions.checkArgument(maxLevels >= 2, "maxLevels must be at least 2");
            Preconditions.checkArgument(maxL0Files >= 1, "maxL0Files must be at least 1");
            Preconditions.checkArgument(levelBaseBytes > 0, "levelBaseBytes must be positive");
            Preconditions.checkArgument(levelSizeMultiplier >= 1, "levelSizeMultiplier must be at least 1");
            Preconditions.checkArgument(bloomFalsePositiveRate > 0 && bloomFalsePositiveRate < 1,
                    "bloomFalsePositiveRate must be between 0 and 1");
            return new EngineConfig(this);
        }
    }
}
