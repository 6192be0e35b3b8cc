package io.querymesh.bus;

import io.querymesh.config.QueryMeshConfig;
import io.querymesh.model.TaskDescriptor;
import io.querymesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Directory-backed task queue with late acknowledgment.
 *
 * <p>A claim is an atomic move from {@code inbox/} into {@code processing/<worker>/}; the file
 * stays there until the worker acknowledges it, so a crash leaves it behind for
 * {@link #reclaimStale(long)} to redeliver. Retries wait in {@code retry/} under a due-time prefix.
 */
public final class TaskQueue {
    private static final Logger logger = LoggerFactory.getLogger(TaskQueue.class);
    private static final String SUFFIX = ".task.json";

    private final QueryMeshConfig config;

    public TaskQueue(QueryMeshConfig config) {
        this.config = config;
    }

    public void enqueue(TaskDescriptor descriptor) {
        Path target = config.inboxDir().resolve(fileName(Instant.now().toEpochMilli(), descriptor));
        try {
            writeAtomically(target, Jsons.toCompactJson(descriptor));
        } catch (IOException e) {
            throw new RuntimeException("Failed to enqueue task: " + descriptor.taskId(), e);
        }
    }

    public synchronized Optional<ClaimedTask> claimNext(String workerId) {
        Path workerDir = config.processingDir().resolve(workerId);
        for (Path candidate : listTaskFiles(config.inboxDir())) {
            Path claimed = workerDir.resolve(candidate.getFileName().toString());
            try {
                Files.createDirectories(workerDir);
                Files.move(candidate, claimed, StandardCopyOption.ATOMIC_MOVE);
            } catch (NoSuchFileException raced) {
                // Another process claimed it first.
                continue;
            } catch (IOException e) {
                throw new RuntimeException("Failed to claim task file: " + candidate, e);
            }
            try {
                // The claim time, not the enqueue time, is what reclaimStale measures.
                Files.setLastModifiedTime(claimed, FileTime.from(Instant.now()));
                String json = Files.readString(claimed, StandardCharsets.UTF_8);
                TaskDescriptor descriptor = Jsons.fromJson(json, TaskDescriptor.class);
                return Optional.of(new ClaimedTask(descriptor, claimed, workerId));
            } catch (IOException | RuntimeException e) {
                logger.error("Unreadable task file {}, moving to dead", claimed, e);
                moveToDead(claimed);
            }
        }
        return Optional.empty();
    }

    /**
     * Final acknowledgment: the delivery leaves {@code processing/} for the dated done directory.
     * A claim that {@link #reclaimStale(long)} already took back is logged and left alone; the
     * redelivery finds the task terminal and is only acknowledged.
     */
    public void acknowledge(ClaimedTask task) {
        Path dailyDoneDir = config.doneRoot().resolve(LocalDate.now().toString());
        try {
            Files.createDirectories(dailyDoneDir);
            Files.move(
                    task.processingFile(),
                    dailyDoneDir.resolve(task.processingFile().getFileName().toString()),
                    StandardCopyOption.REPLACE_EXISTING
            );
        } catch (NoSuchFileException reclaimed) {
            logger.warn("Task file {} was reclaimed before acknowledgment by {}",
                    task.processingFile().getFileName(), task.workerId());
        } catch (IOException e) {
            throw new RuntimeException("Failed to move task to done directory", e);
        }
    }

    /**
     * Marks the claim as still in progress so {@link #reclaimStale(long)} leaves it alone.
     * Returns false once the file is gone from this worker's processing directory.
     */
    public boolean heartbeat(ClaimedTask task) {
        try {
            Files.setLastModifiedTime(task.processingFile(), FileTime.from(Instant.now()));
            return true;
        } catch (NoSuchFileException gone) {
            return false;
        } catch (IOException e) {
            throw new RuntimeException("Failed to refresh task claim: " + task.processingFile(), e);
        }
    }

    public void deadLetter(ClaimedTask task) {
        moveToDead(task.processingFile());
    }

    /**
     * Parks {@code next} until {@code dueAtMs} and acknowledges the current delivery. The retry file
     * is written first, so a crash in between yields a duplicate delivery rather than a lost one.
     */
    public void scheduleRetry(ClaimedTask current, TaskDescriptor next, long dueAtMs) {
        Path target = config.retryRoot().resolve(fileName(dueAtMs, next));
        try {
            writeAtomically(target, Jsons.toCompactJson(next));
        } catch (IOException e) {
            throw new RuntimeException("Failed to schedule retry for task: " + next.taskId(), e);
        }
        acknowledge(current);
    }

    /**
     * Moves retries whose due time has passed back into the inbox.
     */
    public int promoteDueRetries(long nowMs, int limit) {
        ensureDirectory(config.inboxDir());
        int promoted = 0;
        for (Path file : listTaskFiles(config.retryRoot())) {
            if (promoted >= limit) {
                break;
            }
            long dueAt = dueAtOf(file);
            if (dueAt > nowMs) {
                // Sorted by due time; nothing later is due either.
                break;
            }
            String name = file.getFileName().toString();
            Path target = config.inboxDir().resolve(nowMs + name.substring(name.indexOf('_')));
            try {
                Files.move(file, target, StandardCopyOption.ATOMIC_MOVE);
                promoted++;
            } catch (NoSuchFileException raced) {
                // Promoted by another process.
            } catch (IOException e) {
                throw new RuntimeException("Failed to promote retry file: " + file, e);
            }
        }
        return promoted;
    }

    /**
     * Redelivers claims that were not acknowledged within {@code olderThanMs}.
     */
    public int reclaimStale(long olderThanMs) {
        ensureDirectory(config.inboxDir());
        long cutoff = Instant.now().toEpochMilli() - olderThanMs;
        int reclaimed = 0;
        for (Path workerDir : listDirectories(config.processingDir())) {
            for (Path file : listTaskFiles(workerDir)) {
                try {
                    if (Files.getLastModifiedTime(file).toMillis() > cutoff) {
                        continue;
                    }
                    Files.move(file, config.inboxDir().resolve(file.getFileName().toString()), StandardCopyOption.ATOMIC_MOVE);
                    reclaimed++;
                    logger.warn("Reclaimed unacknowledged task file {} from {}", file.getFileName(), workerDir.getFileName());
                } catch (NoSuchFileException raced) {
                    // Acknowledged meanwhile.
                } catch (IOException e) {
                    throw new RuntimeException("Failed to reclaim task file: " + file, e);
                }
            }
        }
        return reclaimed;
    }

    public QueueDepth depth() {
        int processing = 0;
        for (Path workerDir : listDirectories(config.processingDir())) {
            processing += listTaskFiles(workerDir).size();
        }
        return new QueueDepth(
                listTaskFiles(config.inboxDir()).size(),
                processing,
                listTaskFiles(config.retryRoot()).size(),
                listTaskFiles(config.deadRoot()).size()
        );
    }

    private void moveToDead(Path file) {
        try {
            Files.createDirectories(config.deadRoot());
            Files.move(file, config.deadRoot().resolve(file.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RuntimeException("Failed to move task file to dead directory: " + file, e);
        }
    }

    private static void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create queue directory: " + dir, e);
        }
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = target.resolveSibling("." + UUID.randomUUID() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
    }

    private static String fileName(long prefixMs, TaskDescriptor descriptor) {
        return prefixMs + "_" + descriptor.taskId() + "_r" + descriptor.retryCount() + SUFFIX;
    }

    private static long dueAtOf(Path file) {
        String name = file.getFileName().toString();
        int cut = name.indexOf('_');
        try {
            return Long.parseLong(cut < 0 ? name : name.substring(0, cut));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private List<Path> listTaskFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list queue directory: " + dir, e);
        }
        files.sort(Comparator.comparingLong(TaskQueue::dueAtOf)
                .thenComparing(path -> path.getFileName().toString()));
        return files;
    }

    private List<Path> listDirectories(Path dir) {
        List<Path> dirs = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return dirs;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isDirectory)) {
            for (Path path : stream) {
                dirs.add(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list queue directory: " + dir, e);
        }
        return dirs;
    }

    public record ClaimedTask(TaskDescriptor descriptor, Path processingFile, String workerId) {
    }

    public record QueueDepth(int inbox, int processing, int retry, int dead) {
        public boolean drained() {
            return inbox == 0 && processing == 0 && retry == 0;
        }
    }
}
