package com.insightreport.generator.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreport.generator.config.StorageProperties;
import com.insightreport.generator.service.storage.StorageException;
import com.insightreport.generator.util.StripedLocks;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * 파이프라인 인스턴스 체크포인트 저장소
 *
 * {basePath}/workflows/{instanceId}.json 에 전이마다 기록한다.
 * 인스턴스별 잠금은 실행 중인 인스턴스와 취소/조회 요청이 공유한다.
 */
@Component
@Slf4j
public class WorkflowCheckpointStore {

    private final StorageProperties properties;
    private final ObjectMapper objectMapper;

    private final StripedLocks locks = new StripedLocks();

    private Path workflowsPath;

    public WorkflowCheckpointStore(StorageProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        this.workflowsPath = Paths.get(properties.getBasePath()).resolve(properties.getWorkflowsDir());
        try {
            Files.createDirectories(workflowsPath);
        } catch (IOException e) {
            throw new IllegalStateException("Could not create checkpoint directory " + workflowsPath.toAbsolutePath(), e);
        }
    }

    public ReentrantLock lockFor(String instanceId) {
        return locks.get(instanceId);
    }

    public void save(WorkflowCheckpoint checkpoint) {
        ReentrantLock lock = lockFor(checkpoint.getInstanceId());
        lock.lock();
        try {
            checkpoint.setUpdatedAt(LocalDateTime.now());
            Path file = pathOf(checkpoint.getInstanceId());
            Path temp = Files.createTempFile(workflowsPath, checkpoint.getInstanceId(), ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), checkpoint);
                try {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to save checkpoint " + checkpoint.getInstanceId() + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    public Optional<WorkflowCheckpoint> load(String instanceId) {
        Path file = pathOf(instanceId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), WorkflowCheckpoint.class));
        } catch (IOException e) {
            throw new StorageException("Failed to read checkpoint " + instanceId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads, mutates and saves a checkpoint under its instance lock.
     */
    public Optional<WorkflowCheckpoint> update(String instanceId, Consumer<WorkflowCheckpoint> mutation) {
        ReentrantLock lock = lockFor(instanceId);
        lock.lock();
        try {
            Optional<WorkflowCheckpoint> checkpoint = load(instanceId);
            checkpoint.ifPresent(cp -> {
                mutation.accept(cp);
                save(cp);
            });
            return checkpoint;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checkpoints without a result; unreadable files are logged and skipped.
     */
    public List<WorkflowCheckpoint> listUnfinished() {
        List<WorkflowCheckpoint> unfinished = new ArrayList<>();
        try (Stream<Path> files = Files.list(workflowsPath)) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().toList()) {
                try {
                    WorkflowCheckpoint checkpoint = objectMapper.readValue(file.toFile(), WorkflowCheckpoint.class);
                    if (!checkpoint.isFinished()) {
                        unfinished.add(checkpoint);
                    }
                } catch (IOException e) {
                    log.warn("Skipping unreadable checkpoint: file={}, error={}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list checkpoints: " + e.getMessage(), e);
        }
        return unfinished;
    }

    private Path pathOf(String instanceId) {
        Path file = workflowsPath.resolve(instanceId + ".json").normalize();
        if (!file.getParent().equals(workflowsPath.normalize())) {
            throw new IllegalArgumentException("Invalid instance id: " + instanceId);
        }
        return file;
    }
}
