package io.agentgw.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Pairing-code and access-token lifecycle.
 *
 * <p>The credential file is the source of truth. Every public operation reloads it, prunes dead
 * pairing codes and excess tokens, applies its change and persists before returning, all under the
 * instance monitor. Nothing about the active token set is cached between calls.
 *
 * <p>Negative outcomes (unknown, used, expired or revoked credentials) are empty results and are
 * deliberately not distinguished.
 */
public final class CredentialManager {
    private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

    public static final Duration DEFAULT_PAIRING_TTL = Duration.ofMinutes(10);
    public static final Duration MIN_PAIRING_TTL = Duration.ofSeconds(30);
    public static final int MAX_ACTIVE_TOKENS = 64;
    public static final int MAX_LABEL_LENGTH = 80;
    public static final String DEFAULT_LABEL = "gateway-client";

    private static final String PAIRING_PREFIX = "AGPAIR-";
    private static final String TOKEN_PREFIX = "agw_";

    private final CredentialStore store;
    private final Clock clock;

    public CredentialManager(CredentialStore store) {
        this(store, Clock.systemUTC());
    }

    public CredentialManager(CredentialStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // PAIRING
    // ═══════════════════════════════════════════════════════════════

    public PairingCode createPairingCode(String label) {
        return createPairingCode(label, DEFAULT_PAIRING_TTL);
    }

    /**
     * Mints a single-use pairing code. The TTL is clamped to {@link #MIN_PAIRING_TTL}; a null TTL means the default.
     */
    public synchronized PairingCode createPairingCode(String label, Duration ttl) {
        Duration effectiveTtl = ttl == null ? DEFAULT_PAIRING_TTL : ttl;
        if (effectiveTtl.compareTo(MIN_PAIRING_TTL) < 0) {
            effectiveTtl = MIN_PAIRING_TTL;
        }

        CredentialStoreFile state = loadPruned();
        Instant now = clock.instant();
        String code = PAIRING_PREFIX + SecretDigests.randomHex(5).toUpperCase(Locale.ROOT);
        String normalizedLabel = normalizeLabel(label);
        String salt = SecretDigests.newSalt();
        PairingCodeRecord record = new PairingCodeRecord(
            "pair_" + SecretDigests.randomHex(8),
            salt,
            SecretDigests.digest(salt, code),
            normalizedLabel,
            now,
            now.plus(effectiveTtl),
            null);
        state.pairingCodes().add(record);
        store.save(state);

        log.info("[AUTH] Pairing code {} created (label={}, expiresAt={})", record.id(), normalizedLabel, record.expiresAt());
        return new PairingCode(code, normalizedLabel, record.expiresAt());
    }

    /**
     * Exchanges a live pairing code for a new access token. The token carries {@code label} when
     * given, otherwise the pairing code's own label.
     */
    public synchronized Optional<IssuedToken> consumePairingCode(String code, String label) {
        String candidate = normalizeSecret(code);
        if (candidate == null) {
            return Optional.empty();
        }

        CredentialStoreFile state = loadPruned();
        Instant now = clock.instant();
        int index = findIndex(state.pairingCodes(), candidate, r -> r.salt(), r -> r.secretHash());
        if (index < 0) {
            return Optional.empty();
        }
        PairingCodeRecord record = state.pairingCodes().get(index);
        if (!record.isLive(now)) {
            return Optional.empty();
        }

        state.pairingCodes().set(index, record.withUsedAt(now));
        boolean hasLabel = label != null && !label.isBlank();
        IssuedToken issued = issueToken(state, hasLabel ? label : record.label(), now);
        enforceTokenBound(state);
        store.save(state);

        log.info("[AUTH] Pairing code {} exchanged for client {} ({})", record.id(), issued.client().id(), issued.client().label());
        return Optional.of(issued);
    }

    public Optional<IssuedToken> consumePairingCode(String code) {
        return consumePairingCode(code, null);
    }

    // ═══════════════════════════════════════════════════════════════
    // TOKENS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Resolves a bearer token to its client. Refreshes {@code lastUsedAt} on success.
     */
    public synchronized Optional<AuthClient> authenticate(String token) {
        String candidate = normalizeSecret(token);
        if (candidate == null) {
            return Optional.empty();
        }

        CredentialStoreFile state = loadPruned();
        int index = findIndex(state.tokens(), candidate, r -> r.salt(), r -> r.secretHash());
        if (index < 0 || !state.tokens().get(index).isActive()) {
            return Optional.empty();
        }

        AccessTokenRecord updated = state.tokens().get(index).withLastUsedAt(clock.instant());
        state.tokens().set(index, updated);
        store.save(state);
        return Optional.of(updated.toClient());
    }

    /**
     * Revokes the presented active token and mints a replacement with the same label.
     */
    public synchronized Optional<IssuedToken> rotateToken(String currentToken) {
        String candidate = normalizeSecret(currentToken);
        if (candidate == null) {
            return Optional.empty();
        }

        CredentialStoreFile state = loadPruned();
        int index = findIndex(state.tokens(), candidate, r -> r.salt(), r -> r.secretHash());
        if (index < 0 || !state.tokens().get(index).isActive()) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        AccessTokenRecord old = state.tokens().get(index);
        state.tokens().set(index, old.withRevokedAt(now));
        IssuedToken issued = issueToken(state, old.label(), now);
        enforceTokenBound(state);
        store.save(state);

        log.info("[AUTH] Client {} rotated to {}", old.id(), issued.client().id());
        return Optional.of(issued);
    }

    public synchronized boolean revokeClient(String clientId) {
        String id = clientId == null ? "" : clientId.trim();
        if (id.isEmpty()) {
            return false;
        }

        CredentialStoreFile state = loadPruned();
        List<AccessTokenRecord> tokens = state.tokens();
        for (int i = 0; i < tokens.size(); i++) {
            AccessTokenRecord record = tokens.get(i);
            if (record.id().equals(id) && record.isActive()) {
                tokens.set(i, record.withRevokedAt(clock.instant()));
                store.save(state);
                log.info("[AUTH] Client {} revoked", id);
                return true;
            }
        }
        return false;
    }

    // ═══════════════════════════════════════════════════════════════
    // SNAPSHOTS
    // ═══════════════════════════════════════════════════════════════

    public synchronized CredentialSummary getSummary() {
        CredentialStoreFile state = loadPruned();
        Instant now = clock.instant();
        int active = (int) state.tokens().stream().filter(AccessTokenRecord::isActive).count();
        List<PairingCodeRecord> pending = state.pairingCodes().stream().filter(r -> r.isLive(now)).toList();
        Instant latest = pending.stream()
            .map(PairingCodeRecord::expiresAt)
            .max(Comparator.naturalOrder())
            .orElse(null);
        store.save(state);
        return new CredentialSummary(active, pending.size(), latest);
    }

    public synchronized List<ClientInfo> listClients() {
        return loadPruned().tokens().stream()
            .filter(AccessTokenRecord::isActive)
            .map(r -> new ClientInfo(r.id(), r.label(), r.createdAt(), r.lastUsedAt()))
            .toList();
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNALS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Load, drop dead pairing codes, enforce the token bound. Persists when pruning changed anything,
     * so the file heals itself across restarts.
     */
    private CredentialStoreFile loadPruned() {
        CredentialStoreFile state = store.load();
        Instant now = clock.instant();
        int codesBefore = state.pairingCodes().size();
        int tokensBefore = state.tokens().size();

        state.pairingCodes().removeIf(r -> !r.isLive(now));
        enforceTokenBound(state);

        if (state.pairingCodes().size() != codesBefore || state.tokens().size() != tokensBefore) {
            log.debug("[AUTH] Pruned {} pairing codes and {} tokens",
                codesBefore - state.pairingCodes().size(), tokensBefore - state.tokens().size());
            store.save(state);
        }
        return state;
    }

    /**
     * Drops revoked tokens, then evicts the oldest active tokens (by {@code createdAt}) beyond
     * {@link #MAX_ACTIVE_TOKENS}. Evicted tokens are removed outright.
     */
    private static void enforceTokenBound(CredentialStoreFile state) {
        List<AccessTokenRecord> tokens = state.tokens();
        tokens.removeIf(r -> !r.isActive());
        if (tokens.size() <= MAX_ACTIVE_TOKENS) {
            return;
        }
        // List.sort is stable: tokens minted in the same instant keep insertion order.
        tokens.sort(Comparator.comparing(AccessTokenRecord::createdAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        int excess = tokens.size() - MAX_ACTIVE_TOKENS;
        for (int i = 0; i < excess; i++) {
            AccessTokenRecord evicted = tokens.remove(0);
            log.info("[AUTH] Evicted client {} ({}): active token limit {} reached", evicted.id(), evicted.label(), MAX_ACTIVE_TOKENS);
        }
    }

    private IssuedToken issueToken(CredentialStoreFile state, String label, Instant now) {
        String token = TOKEN_PREFIX + SecretDigests.randomUrlSafe(24);
        String salt = SecretDigests.newSalt();
        AccessTokenRecord record = new AccessTokenRecord(
            "client_" + SecretDigests.randomHex(8),
            salt,
            SecretDigests.digest(salt, token),
            normalizeLabel(label),
            now,
            null,
            null);
        state.tokens().add(record);
        return new IssuedToken(token, record.toClient());
    }

    /**
     * Index of the record whose digest matches {@code candidate}. Every record is hashed and compared,
     * so the time spent does not depend on where (or whether) the match is.
     */
    private static <T> int findIndex(List<T> records, String candidate,
                                     Function<T, String> salt, Function<T, String> hash) {
        int found = -1;
        for (int i = 0; i < records.size(); i++) {
            T record = records.get(i);
            if (SecretDigests.matches(salt.apply(record), hash.apply(record), candidate) && found < 0) {
                found = i;
            }
        }
        return found;
    }

    static String normalizeLabel(String label) {
        String value = label == null ? "" : label.trim();
        if (value.isEmpty()) {
            return DEFAULT_LABEL;
        }
        return value.length() > MAX_LABEL_LENGTH ? value.substring(0, MAX_LABEL_LENGTH) : value;
    }

    private static String normalizeSecret(String secret) {
        if (secret == null) {
            return null;
        }
        String value = secret.trim();
        return value.isEmpty() ? null : value;
    }
}
