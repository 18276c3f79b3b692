package com.climapipeline.service.cache;

import com.climapipeline.core.error.StorageException;
import com.climapipeline.core.model.DateRange;
import com.climapipeline.core.model.LocationConfig;
import com.climapipeline.core.model.RawWeatherResponse;
import com.climapipeline.core.model.VariableKind;
import com.climapipeline.core.util.HashingUtils;
import com.climapipeline.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public final class ResponseCache {
    private static final Logger LOGGER = Logger.getLogger(ResponseCache.class.getName());

    private final Path file;
    private final Duration ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> byKey = new LinkedHashMap<>();

    public ResponseCache(Path file, Duration ttl, Clock clock) {
        this.file = file;
        this.ttl = ttl;
        this.clock = clock;
        load();
    }

    public static String keyFor(LocationConfig location, DateRange range, Set<VariableKind> variables) {
        String codes = variables.stream()
                .sorted()
                .map(VariableKind::providerCode)
                .collect(Collectors.joining(","));
        return HashingUtils.sha256(String.join("|",
                "weather_raw",
                Double.toString(location.latitude()),
                Double.toString(location.longitude()),
                location.timezone(),
                range.startDate().toString(),
                range.endDate().toString(),
                codes));
    }

    public Optional<RawWeatherResponse> get(String key) {
        lock.lock();
        try {
            CacheEntry entry = byKey.get(key);
            if (entry == null) {
                LOGGER.fine(() -> "Cache miss for " + key);
                return Optional.empty();
            }
            if (!clock.instant().isBefore(entry.storedAt().plus(ttl))) {
                LOGGER.fine(() -> "Cache entry expired for " + key);
                byKey.remove(key);
                persist();
                return Optional.empty();
            }
            LOGGER.fine(() -> "Cache hit for " + key);
            return Optional.of(entry.response());
        } finally {
            lock.unlock();
        }
    }

    public void put(String key, RawWeatherResponse response) {
        lock.lock();
        try {
            byKey.put(key, new CacheEntry(key, clock.instant(), response));
            persist();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            byKey.clear();
            persist();
            LOGGER.info(() -> "Cleared response cache " + file);
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            long size = 0;
            if (Files.exists(file)) {
                size = Files.size(file);
            }
            return new CacheStats(byKey.size(), size, file.toString(), ttl.toMinutes());
        } catch (IOException e) {
            throw new StorageException(StorageException.Reason.IO_FAILURE, "Unable to stat response cache " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void load() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                List<CacheEntry> entries = JsonUtils.objectMapper().readValue(in, new TypeReference<List<CacheEntry>>() {
                });
                if (entries == null) {
                    return;
                }
                for (CacheEntry entry : entries) {
                    if (entry != null && entry.key() != null && entry.storedAt() != null && entry.response() != null) {
                        byKey.put(entry.key(), entry);
                    }
                }
            }
        } catch (IOException e) {
            byKey.clear();
            LOGGER.log(Level.WARNING, "Ignoring unreadable response cache " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            JsonUtils.objectMapper().writeValue(tmp.toFile(), new ArrayList<>(byKey.values()));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Unable to write response cache " + file + "; keeping entries in memory only", e);
        }
    }

    record CacheEntry(String key, Instant storedAt, RawWeatherResponse response) {
    }
}
