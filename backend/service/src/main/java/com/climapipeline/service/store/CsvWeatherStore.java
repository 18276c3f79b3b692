package com.climapipeline.service.store;

import com.climapipeline.core.error.StorageException;
import com.climapipeline.core.model.WeatherDataset;
import com.climapipeline.core.model.WriteMode;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

public class CsvWeatherStore implements WeatherStore {
    private static final Logger LOGGER = Logger.getLogger(CsvWeatherStore.class.getName());

    private final WeatherCsvCodec codec;
    private final ReentrantLock lock = new ReentrantLock();

    public CsvWeatherStore() {
        this(new WeatherCsvCodec());
    }

    CsvWeatherStore(WeatherCsvCodec codec) {
        this.codec = codec;
    }

    @Override
    public int save(WeatherDataset dataset, Path path, WriteMode mode) {
        lock.lock();
        try {
            WeatherDataset table = dataset;
            FileFingerprint expected = null;
            if (mode == WriteMode.APPEND) {
                Snapshot existing = read(path);
                table = existing.dataset().merge(dataset);
                expected = existing.fingerprint();
            }
            replace(path, codec.encode(table), expected);
            int total = table.size();
            LOGGER.info(() -> "Wrote " + total + " rows to " + path + " ("
                    + mode.name().toLowerCase(Locale.ROOT) + ", " + dataset.size() + " incoming)");
            return total;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public WeatherDataset load(Path path) {
        lock.lock();
        try {
            return read(path).dataset();
        } finally {
            lock.unlock();
        }
    }

    private Snapshot read(Path path) {
        if (!Files.exists(path)) {
            return new Snapshot(WeatherDataset.empty(), FileFingerprint.ABSENT);
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            byte[] content = Files.readAllBytes(path);
            return new Snapshot(codec.decode(content, path), FileFingerprint.of(attributes, content));
        } catch (IOException e) {
            throw new StorageException(StorageException.Reason.IO_FAILURE, "Failed reading weather table " + path, e);
        }
    }

    private void replace(Path path, byte[] content, FileFingerprint expected) {
        Path parent = path.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw failure("Cannot create directory " + parent, e, StorageException.Reason.UNWRITABLE_PATH);
        }

        Path tmp = parent.resolve("." + path.getFileName() + "." + UUID.randomUUID() + ".tmp");
        boolean moved = false;
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            beforeCommit(path);
            if (expected != null) {
                FileFingerprint current = FileFingerprint.capture(path);
                if (!current.equals(expected)) {
                    throw new StorageException(StorageException.Reason.CONCURRENT_MODIFICATION,
                            "Weather table " + path + " was modified by another writer during append");
                }
            }
            move(tmp, path);
            moved = true;
        } catch (IOException e) {
            throw failure("Failed writing weather table " + path, e, StorageException.Reason.IO_FAILURE);
        } finally {
            if (!moved) {
                deleteTemp(tmp);
            }
        }
    }

    // Runs after the new table is on disk and before it replaces the destination.
    void beforeCommit(Path path) throws IOException {
    }

    private static void move(Path tmp, Path path) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.fine(() -> "Atomic move not supported for " + path + "; replacing in place");
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not remove temporary file " + tmp, e);
        }
    }

    private static StorageException failure(String message, IOException e, StorageException.Reason fallback) {
        return new StorageException(classify(e, fallback), message + ": " + describe(e), e);
    }

    static StorageException.Reason classify(IOException e, StorageException.Reason fallback) {
        String detail = describe(e).toLowerCase(Locale.ROOT);
        if (detail.contains("no space left") || detail.contains("disk quota exceeded")) {
            return StorageException.Reason.DISK_FULL;
        }
        if (e instanceof AccessDeniedException
                || e instanceof NotDirectoryException
                || e instanceof FileAlreadyExistsException
                || detail.contains("read-only file system")
                || detail.contains("not a directory")) {
            return StorageException.Reason.UNWRITABLE_PATH;
        }
        return fallback;
    }

    private static String describe(IOException e) {
        if (e instanceof FileSystemException fileSystemError && fileSystemError.getReason() != null) {
            return fileSystemError.getReason();
        }
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private record Snapshot(WeatherDataset dataset, FileFingerprint fingerprint) {
    }
}
