package org.lsmkv.core.sstable;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.lsmkv.common.AppConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;

/**
 * Naming and discovery of sstable files. Level and sequence are encoded in
 * the name as {@code level_<level>_<sequence>.sst}, which makes the directory
 * listing the only catalog of tables.
 */
public final class SSTableFiles {
    private static final Logger logger = LoggerFactory.getLogger(SSTableFiles.class);

    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');
    private static final Splitter UNDERSCORE = Splitter.on('_');

    /** Level ascending, then sequence descending. */
    public static final Comparator<Descriptor> NEWEST_FIRST = Comparator
            .comparingInt(Descriptor::getLevel)
            .thenComparing(Descriptor::getSequence, Comparator.reverseOrder());

    private SSTableFiles() {}

    public static final class Descriptor {
        private final int level;
        private final long sequence;
        private final Path path;

        public Descriptor(int level, long sequence, Path path) {
            this.level = level;
            this.sequence = sequence;
            this.path = path;
        }

        public int getLevel() {
            return level;
        }

        public long getSequence() {
            return sequence;
        }

        public Path getPath() {
            return path;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("level", level)
                    .add("sequence", sequence)
                    .add("path", path.getFileName())
                    .toString();
        }
    }

    public static String fileName(int level, long sequence) {
        return String.format("%s%d_%06d%s", AppConstants.SSTABLE_FILE_PREFIX, level, sequence,
                AppConstants.SSTABLE_FILE_SUFFIX);
    }

    /**
     * @return the parsed name, or empty when the file is not an sstable
     */
    public static Optional<Descriptor> parse(Path path) {
        String name = path.getFileName().toString();
        if (!name.startsWith(AppConstants.SSTABLE_FILE_PREFIX) || !name.endsWith(AppConstants.SSTABLE_FILE_SUFFIX)) {
            return Optional.empty();
        }
        String body = name.substring(AppConstants.SSTABLE_FILE_PREFIX.length(),
                name.length() - AppConstants.SSTABLE_FILE_SUFFIX.length());
        List<String> parts = UNDERSCORE.splitToList(body);
        if (parts.size() != 2 || !isNumber(parts.get(0)) || !isNumber(parts.get(1))) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Descriptor(Integer.parseInt(parts.get(0)), Long.parseLong(parts.get(1)), path));
        } catch (NumberFormatException e) {
            logger.warn("ignoring sstable {} with out of range level or sequence", name);
            return Optional.empty();
        }
    }

    private static boolean isNumber(String part) {
        return !part.isEmpty() && DIGITS.matchesAllOf(part);
    }

    public static List<Descriptor> list(Path dir) throws IOException {
        List<Descriptor> tables = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    parse(path).ifPresent(tables::add);
                }
            }
        }
        return tables;
    }

    /**
     * Tables in read precedence order: a lower level is newer than a higher
     * one, and within a level a higher sequence is newer.
     */
    public static List<Descriptor> newestFirst(Path dir) throws IOException {
        List<Descriptor> tables = list(dir);
        tables.sort(NEWEST_FIRST);
        return tables;
    }

    /**
     * @return the highest sequence on disk, or -1 when there are no tables
     */
    public static long maxSequence(Path dir) throws IOException {
        long max = -1;
        for (Descriptor table : list(dir)) {
            max = Math.max(max, table.getSequence());
        }
        return max;
    }

    /**
     * Removes leftovers of writers that never reached their rename.
     *
     * @return number of files deleted
     */
    public static int deleteTempFiles(Path dir) throws IOException {
        String tempSuffix = AppConstants.SSTABLE_FILE_SUFFIX + AppConstants.TEMP_FILE_SUFFIX;
        List<Path> stale = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (name.startsWith(AppConstants.SSTABLE_FILE_PREFIX) && name.endsWith(tempSuffix)) {
                    stale.add(path);
                }
            }
        }
        for (Path path : stale) {
            Files.deleteIfExists(path);
            logger.info("removed unfinished sstable {}", path.getFileName());
        }
        return stale.size();
    }
}
