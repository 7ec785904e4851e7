package io.agentgw.daemon;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.agentgw.GatewayException;
import io.agentgw.util.AtomicFiles;
import io.agentgw.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * One-line PID file plus the JSON daemon record. Both files are rewritten whole.
 */
public final class DaemonStateStore {
    private static final Logger log = LoggerFactory.getLogger(DaemonStateStore.class);

    private final Path pidFile;
    private final Path stateFile;

    public DaemonStateStore(Path pidFile, Path stateFile) {
        this.pidFile = pidFile;
        this.stateFile = stateFile;
    }

    public OptionalLong readPid() {
        String raw = readQuietly(pidFile);
        if (raw == null) {
            return OptionalLong.empty();
        }
        try {
            long pid = Long.parseLong(raw.trim());
            return pid > 0 ? OptionalLong.of(pid) : OptionalLong.empty();
        } catch (NumberFormatException e) {
            log.warn("[DAEMON] Ignoring malformed PID file {}", pidFile);
            return OptionalLong.empty();
        }
    }

    public void writePid(long pid) {
        write(pidFile, pid + "\n");
    }

    public Optional<DaemonRecord> readRecord() {
        String raw = readQuietly(stateFile);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            DaemonRecord record = Jsons.mapper().readValue(raw, DaemonRecord.class);
            if (record == null || record.pid() <= 0 || record.port() <= 0) {
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (JsonProcessingException e) {
            log.warn("[DAEMON] Ignoring malformed daemon record {}: {}", stateFile, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public void writeRecord(DaemonRecord record) {
        try {
            write(stateFile, Jsons.pretty().writeValueAsString(record));
        } catch (JsonProcessingException e) {
            throw new GatewayException("Failed to serialize daemon record", e);
        }
    }

    /**
     * Removes both files. Each removal is attempted even if the other fails.
     */
    public void clear() {
        deleteQuietly(pidFile);
        deleteQuietly(stateFile);
    }

    private static void write(Path file, String content) {
        try {
            AtomicFiles.write(file, content, false);
        } catch (IOException e) {
            throw new GatewayException("Failed to write " + file, e);
        }
    }

    private static String readQuietly(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            log.warn("[DAEMON] Could not read {}: {}", file, e.toString());
            return null;
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[DAEMON] Could not remove {}: {}", file, e.toString());
        }
    }
}
