package com.gbu.workshophub.modules.legacy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * JSON file holding legacy workshops, challenges and registrations.
 *
 * <p>
 * Every access runs load-apply-save while holding an exclusive lock on a sibling
 * {@code .lock} file, so concurrent writers (threads or processes) are serialized.
 * OS file locks are held per process, which is why threads of this JVM queue on a
 * {@link ReentrantLock} first.
 */
@Slf4j
@Component
public class LegacyWorkshopStore {

    private final Path file;
    private final Path lockFile;
    private final ObjectMapper mapper;
    private final ReentrantLock processLock = new ReentrantLock();

    @Autowired
    public LegacyWorkshopStore(@Value("${app.legacy.store-path:data/workshops.json}") String storePath) {
        this(Paths.get(storePath));
    }

    LegacyWorkshopStore(Path file) {
        this.file = file.toAbsolutePath();
        this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
        this.mapper = JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
        try {
            Files.createDirectories(this.file.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory for workshop store " + this.file, e);
        }
    }

    /** Runs a read-only view of the data under the lock. */
    public <T> T read(Function<LegacyData, T> reader) {
        return withLock(() -> reader.apply(load()));
    }

    /**
     * Runs {@code mutator} under the lock and persists the data afterwards. If the
     * mutator throws, nothing is written.
     */
    public <T> T update(Function<LegacyData, T> mutator) {
        return withLock(() -> {
            LegacyData data = load();
            T result = mutator.apply(data);
            save(data);
            return result;
        });
    }

    private <T> T withLock(Supplier<T> action) {
        processLock.lock();
        try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                FileLock ignored = channel.lock()) {
            return action.get();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot lock workshop store " + file, e);
        } finally {
            processLock.unlock();
        }
    }

    // caller holds the lock
    private LegacyData load() {
        try {
            if (!Files.exists(file)) {
                return initialize("missing");
            }
            String content = Files.readString(file, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return initialize("empty");
            }
            LegacyData data = mapper.readValue(content, LegacyData.class);
            if (data == null) {
                return initialize("null");
            }
            data.normalize();
            return data;
        } catch (JsonProcessingException e) {
            log.warn("Workshop store {} is corrupt, reinitialising: {}", file, e.getOriginalMessage());
            return initialize("corrupt");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read workshop store " + file, e);
        }
    }

    private LegacyData initialize(String reason) {
        log.info("Initialising workshop store {} ({})", file, reason);
        LegacyData empty = new LegacyData();
        save(empty);
        return empty;
    }

    private void save(LegacyData data) {
        try {
            Files.writeString(file, mapper.writeValueAsString(data), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write workshop store " + file, e);
        }
    }
}
