package com.rewardpick.catalog.service;

import com.rewardpick.catalog.dto.CatalogVersionResponse;
import com.rewardpick.catalog.model.CatalogVersion;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

/**
 * Owns the catalog files on disk: exactly one current version in the data directory and a
 * bounded FIFO history of prior versions in the backup directory.
 *
 * <p>The directories are scanned once at construction. From then on the version list lives in
 * memory and readers only touch the volatile {@code current} reference, which is replaced after
 * the new file has been renamed into place.
 */
@Service
public class CatalogVersionStore {

    private static final Logger log = LoggerFactory.getLogger(CatalogVersionStore.class);

    private static final DateTimeFormatter STAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final String TEMP_SUFFIX = ".tmp";

    private final Clock clock;
    private final Path dataDir;
    private final Path backupDir;
    private final int maxBackups;
    private final String filePrefix;
    private final String bundledResource;
    private final Pattern fileNamePattern;

    // oldest first, guarded by this
    private final Deque<StoredVersion> history = new ArrayDeque<>();
    private OffsetDateTime lastStamp;

    private volatile CatalogVersion current;
    private volatile CatalogVersion bundled;

    public CatalogVersionStore(CatalogStorageProperties properties, Clock clock) {
        this.clock = clock;
        this.dataDir = Path.of(properties.getDataDir()).toAbsolutePath().normalize();
        this.backupDir = Path.of(properties.getBackupDir()).toAbsolutePath().normalize();
        this.maxBackups = Math.max(properties.getMaxBackups(), 0);
        this.filePrefix = properties.getFilePrefix();
        this.bundledResource = properties.getBundledResource();
        this.fileNamePattern = Pattern.compile(Pattern.quote(filePrefix) + "_([0-9]{8}_[0-9]{6}_[0-9]{3})\\.csv");

        try {
            Files.createDirectories(dataDir);
            Files.createDirectories(backupDir);
        } catch (IOException exception) {
            throw new CatalogStorageException("Failed to create catalog directories: " + exception.getMessage(), exception);
        }

        loadExisting();
    }

    /**
     * Makes {@code content} the current catalog and moves the previous current file into the
     * history. A write failure leaves the previous version current.
     */
    public synchronized CatalogVersion promote(byte[] content) {
        return promote(stage(content));
    }

    /**
     * Writes {@code content} next to the current catalog under a fresh version id without making
     * it current. The result must be passed to {@link #promote(StagedVersion)} or
     * {@link #discard(StagedVersion)}.
     */
    public synchronized StagedVersion stage(byte[] content) {
        if (content == null || content.length == 0) {
            throw new CatalogStorageException("Refusing to promote an empty catalog file");
        }

        OffsetDateTime createdAt = nextStamp();
        String versionId = fileName(createdAt);
        Path temp = dataDir.resolve(versionId + TEMP_SUFFIX);
        try {
            Files.write(temp, content);
        } catch (IOException exception) {
            deleteTempFile(temp);
            throw new CatalogStorageException(
                "Failed to write catalog version " + versionId + ": " + exception.getMessage(),
                exception
            );
        }
        return new StagedVersion(versionId, createdAt, content.clone(), temp);
    }

    public synchronized CatalogVersion promote(StagedVersion staged) {
        String versionId = staged.id();
        Path target = dataDir.resolve(versionId);
        try {
            moveAtomically(staged.tempFile, target);
        } catch (IOException exception) {
            deleteTempFile(staged.tempFile);
            throw new CatalogStorageException(
                "Failed to write catalog version " + versionId + ": " + exception.getMessage(),
                exception
            );
        }

        CatalogVersion previous = current;
        CatalogVersion promoted = new CatalogVersion(versionId, staged.createdAt(), staged.content, CatalogVersion.Source.PROMOTED);
        current = promoted;

        if (previous != null) {
            moveToHistory(previous);
        }
        evictOverflow();

        log.info(
            "Catalog version promoted (version={}, bytes={}, backups={}/{})",
            versionId,
            staged.content.length,
            history.size(),
            maxBackups
        );
        return promoted;
    }

    /**
     * Drops a staged file that will never become current. The current version is untouched.
     */
    public synchronized void discard(StagedVersion staged) {
        deleteTempFile(staged.tempFile);
        log.info("Discarded staged catalog version {}", staged.id());
    }

    /**
     * @throws CatalogNotFoundException when nothing was ever promoted and no bundled catalog exists
     */
    public CatalogVersion getCurrent() {
        CatalogVersion version = current;
        if (version != null) {
            return version;
        }
        return loadBundled().orElseThrow(() -> new CatalogNotFoundException(
            "No catalog has been promoted yet and no bundled catalog is available"
        ));
    }

    public Optional<String> currentVersionId() {
        CatalogVersion version = current;
        return version == null ? Optional.empty() : Optional.of(version.id());
    }

    public synchronized int backupCount() {
        return history.size();
    }

    /**
     * Current version first, then backups from newest to oldest.
     */
    public synchronized List<CatalogVersionResponse> history() {
        List<CatalogVersionResponse> versions = new ArrayList<>();
        CatalogVersion version = current;
        if (version != null) {
            versions.add(new CatalogVersionResponse(version.id(), version.createdAt(), version.sizeBytes(), true));
        }

        Iterator<StoredVersion> newestFirst = history.descendingIterator();
        while (newestFirst.hasNext()) {
            StoredVersion stored = newestFirst.next();
            versions.add(new CatalogVersionResponse(stored.id(), stored.createdAt(), stored.sizeBytes(), false));
        }
        return versions;
    }

    private void loadExisting() {
        List<Path> currentFiles = listVersionFiles(dataDir);
        List<Path> backupFiles = listVersionFiles(backupDir);

        for (Path backup : backupFiles) {
            history.addLast(toStoredVersion(backup));
        }

        if (!currentFiles.isEmpty()) {
            Path latest = currentFiles.get(currentFiles.size() - 1);
            // left behind by a promote that crashed before its backup move
            for (Path stale : currentFiles.subList(0, currentFiles.size() - 1)) {
                moveToHistory(toStoredVersion(stale));
            }

            try {
                OffsetDateTime createdAt = parseStamp(latest.getFileName().toString());
                current = new CatalogVersion(
                    latest.getFileName().toString(),
                    createdAt,
                    Files.readAllBytes(latest),
                    CatalogVersion.Source.PROMOTED
                );
                lastStamp = createdAt;
            } catch (IOException exception) {
                throw new CatalogStorageException("Failed to read current catalog " + latest + ": " + exception.getMessage(), exception);
            }
        }

        history.stream().map(StoredVersion::createdAt)
            .filter(stamp -> lastStamp == null || stamp.isAfter(lastStamp))
            .forEach(stamp -> lastStamp = stamp);

        evictOverflow();
        log.info(
            "Catalog version store ready (dataDir={}, current={}, backups={})",
            dataDir,
            current == null ? "none" : current.id(),
            history.size()
        );
    }

    private void moveToHistory(CatalogVersion version) {
        Path source = dataDir.resolve(version.id());
        moveToHistory(new StoredVersion(version.id(), version.createdAt(), source, version.sizeBytes()));
    }

    private void moveToHistory(StoredVersion version) {
        Path destination = backupDir.resolve(version.id());
        try {
            Files.move(version.path(), destination, StandardCopyOption.REPLACE_EXISTING);
            history.addLast(new StoredVersion(version.id(), version.createdAt(), destination, version.sizeBytes()));
        } catch (IOException exception) {
            log.warn("Failed to move catalog version {} into backups; it stays in {}", version.id(), version.path(), exception);
            history.addLast(version);
        }
    }

    private void evictOverflow() {
        while (history.size() > maxBackups) {
            StoredVersion evicted = history.removeFirst();
            try {
                Files.deleteIfExists(evicted.path());
                log.info("Evicted catalog backup {}", evicted.id());
            } catch (IOException exception) {
                log.warn("Failed to delete evicted catalog backup {}", evicted.path(), exception);
            }
        }
    }

    private Optional<CatalogVersion> loadBundled() {
        CatalogVersion cached = bundled;
        if (cached != null) {
            return Optional.of(cached);
        }
        if (bundledResource == null || bundledResource.isBlank()) {
            return Optional.empty();
        }

        ClassPathResource resource = new ClassPathResource(bundledResource);
        if (!resource.exists()) {
            return Optional.empty();
        }

        try (InputStream input = resource.getInputStream()) {
            CatalogVersion loaded = new CatalogVersion(
                "bundled:" + resource.getFilename(),
                null,
                input.readAllBytes(),
                CatalogVersion.Source.BUNDLED
            );
            bundled = loaded;
            return Optional.of(loaded);
        } catch (IOException exception) {
            log.warn("Failed to read bundled catalog {}", bundledResource, exception);
            return Optional.empty();
        }
    }

    private List<Path> listVersionFiles(Path directory) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (name.endsWith(TEMP_SUFFIX)) {
                    deleteTempFile(path);
                } else if (fileNamePattern.matcher(name).matches()) {
                    files.add(path);
                }
            }
        } catch (IOException exception) {
            throw new CatalogStorageException("Failed to list catalog directory " + directory + ": " + exception.getMessage(), exception);
        }
        files.sort(Path::compareTo);
        return files;
    }

    private StoredVersion toStoredVersion(Path path) {
        long size;
        try {
            size = Files.size(path);
        } catch (IOException exception) {
            log.warn("Failed to read size of catalog file {}", path, exception);
            size = 0;
        }
        String name = path.getFileName().toString();
        return new StoredVersion(name, parseStamp(name), path, size);
    }

    private OffsetDateTime nextStamp() {
        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
        if (lastStamp != null && !now.isAfter(lastStamp)) {
            now = lastStamp.plus(1, ChronoUnit.MILLIS);
        }
        lastStamp = now;
        return now;
    }

    private String fileName(OffsetDateTime createdAt) {
        return filePrefix + "_" + STAMP_FORMAT.format(createdAt) + ".csv";
    }

    private OffsetDateTime parseStamp(String fileName) {
        Matcher matcher = fileNamePattern.matcher(fileName);
        if (!matcher.matches()) {
            throw new CatalogStorageException("Not a catalog version file: " + fileName);
        }
        try {
            LocalDateTime local = LocalDateTime.parse(matcher.group(1), STAMP_FORMAT);
            return local.atZone(clock.getZone()).toOffsetDateTime();
        } catch (DateTimeParseException exception) {
            throw new CatalogStorageException("Invalid timestamp in catalog file name " + fileName, exception);
        }
    }

    private void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException exception) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteTempFile(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException exception) {
            log.warn("Failed to delete temporary catalog file {}", temp, exception);
        }
    }

    private record StoredVersion(String id, OffsetDateTime createdAt, Path path, long sizeBytes) {
    }

    /**
     * A catalog file written to disk but not yet current.
     */
    public static final class StagedVersion {

        private final String id;
        private final OffsetDateTime createdAt;
        private final byte[] content;
        private final Path tempFile;

        private StagedVersion(String id, OffsetDateTime createdAt, byte[] content, Path tempFile) {
            this.id = id;
            this.createdAt = createdAt;
            this.content = content;
            this.tempFile = tempFile;
        }

        public String id() {
            return id;
        }

        public OffsetDateTime createdAt() {
            return createdAt;
        }
    }
}
