package com.fauxcloud.core.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fauxcloud.core.model.Instance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Stores one YAML document per instance as {@code <stateDir>/<id>.yaml}.
 *
 * <p>Writes go to a temporary sibling first and are moved into place, so a crash never leaves a
 * truncated record. Unreadable records are skipped on {@link #list()} with a warning.
 *
 * <p>{@link #claim()} takes an OS file lock on {@code <stateDir>/.lock}. File locks are held per
 * process, so claims made inside this JVM are tracked separately.
 */
public class FileInstanceStore implements InstanceStore {

    private static final Logger log = LoggerFactory.getLogger(FileInstanceStore.class);
    private static final String SUFFIX = ".yaml";
    private static final String LOCK_FILE = ".lock";

    private static final Set<Path> CLAIMED = ConcurrentHashMap.newKeySet();

    private final Path stateDir;
    private final YAMLMapper yaml = YAMLMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build();

    public FileInstanceStore(Path stateDir) {
        this.stateDir = stateDir;
    }

    @Override
    public void put(Instance instance) {
        Path target = file(instance.getId());
        Path temp = stateDir.resolve(instance.getId() + SUFFIX + ".tmp");
        try {
            Files.createDirectories(stateDir);
            yaml.writeValue(temp.toFile(), instance);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist instance " + instance.getId(), e);
        }
    }

    @Override
    public Optional<Instance> get(String id) {
        Path file = file(id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(yaml.readValue(file.toFile(), Instance.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read instance " + id, e);
        }
    }

    @Override
    public void delete(String id) {
        try {
            Files.deleteIfExists(file(id));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete instance record " + id, e);
        }
    }

    @Override
    public List<Instance> list() {
        if (!Files.isDirectory(stateDir)) {
            return List.of();
        }
        var instances = new ArrayList<Instance>();
        try (Stream<Path> files = Files.list(stateDir)) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted(Comparator.naturalOrder()).toList()) {
                try {
                    instances.add(yaml.readValue(file.toFile(), Instance.class));
                } catch (IOException e) {
                    log.warn("Skipping unreadable instance record {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list instance records in " + stateDir, e);
        }
        return instances;
    }

    @Override
    public StoreLock claim() {
        Path lockFile = stateDir.resolve(LOCK_FILE).toAbsolutePath().normalize();
        if (!CLAIMED.add(lockFile)) {
            throw new StoreLockedException(stateDir);
        }
        try {
            Files.createDirectories(stateDir);
            FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (IOException | RuntimeException e) {
                channel.close();
                throw e;
            }
            if (lock == null) {
                channel.close();
                throw new StoreLockedException(stateDir);
            }
            log.debug("Claimed instance state in {}", stateDir);
            return new FileStoreLock(lockFile, channel, lock);
        } catch (IOException e) {
            CLAIMED.remove(lockFile);
            throw new UncheckedIOException("Failed to lock " + lockFile, e);
        } catch (RuntimeException e) {
            CLAIMED.remove(lockFile);
            throw e;
        }
    }

    private Path file(String id) {
        return stateDir.resolve(id + SUFFIX);
    }

    private static final class FileStoreLock implements StoreLock {

        private final Path lockFile;
        private final FileChannel channel;
        private final FileLock lock;
        private final AtomicBoolean released = new AtomicBoolean();

        FileStoreLock(Path lockFile, FileChannel channel, FileLock lock) {
            this.lockFile = lockFile;
            this.channel = channel;
            this.lock = lock;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                lock.release();
                channel.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to release " + lockFile, e);
            } finally {
                CLAIMED.remove(lockFile);
            }
        }
    }
}
