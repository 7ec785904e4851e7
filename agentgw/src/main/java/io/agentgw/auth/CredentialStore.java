package io.agentgw.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentgw.util.AtomicFiles;
import io.agentgw.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads and rewrites the credential file. No cross-process locking: a single daemon owns the file.
 */
public final class CredentialStore {
    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    private final Path file;

    public CredentialStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    /**
     * Missing file means an empty store. A corrupt file is logged and also read as empty; it is
     * replaced on the next write. Malformed records are dropped and the file is rewritten without
     * them.
     */
    public CredentialStoreFile load() {
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return CredentialStoreFile.empty();
        } catch (IOException e) {
            log.warn("[AUTH] Could not read credential file {}: {}", file, e.toString());
            return CredentialStoreFile.empty();
        }
        if (raw.isBlank()) {
            return CredentialStoreFile.empty();
        }
        try {
            JsonNode tree = Jsons.mapper().readTree(raw);
            CredentialStoreFile parsed = Jsons.mapper().treeToValue(tree, CredentialStoreFile.class);
            if (parsed == null) {
                return CredentialStoreFile.empty();
            }
            int declared = tree.path("pairingCodes").size() + tree.path("tokens").size();
            if (declared > parsed.recordCount()) {
                log.warn("[AUTH] Dropped {} malformed records from credential file {}",
                    declared - parsed.recordCount(), file);
                save(parsed);
            }
            return parsed;
        } catch (JsonProcessingException e) {
            log.warn("[AUTH] Credential file {} is not valid JSON, starting empty: {}", file, e.getOriginalMessage());
            return CredentialStoreFile.empty();
        }
    }

    public void save(CredentialStoreFile state) {
        try {
            AtomicFiles.write(file, Jsons.pretty().writeValueAsString(state), true);
        } catch (IOException e) {
            throw new CredentialStoreException(file, "Failed to persist credential store", e);
        }
    }
}
