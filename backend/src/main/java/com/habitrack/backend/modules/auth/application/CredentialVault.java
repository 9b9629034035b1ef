package com.habitrack.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;

import com.habitrack.backend.modules.auth.domain.Credential;
import com.habitrack.backend.modules.auth.domain.CredentialProvider;
import com.habitrack.backend.modules.auth.domain.HashedSecret;
import com.habitrack.backend.modules.auth.infrastructure.persistence.CredentialRepository;

import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hashes and verifies passwords and kiosk PINs with Argon2id and owns the {@code credential} table.
 */
@Service
public class CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);

    private static final int SALT_BYTES = 16;
    private static final int HASH_BYTES = 32;

    private final CredentialRepository credentialRepository;
    private final SecureRandom secureRandom;
    private final Clock clock;
    private final int iterations;
    private final int memoryKib;
    private final int parallelism;

    public CredentialVault(
            CredentialRepository credentialRepository,
            SecureRandom secureRandom,
            Clock clock,
            @Value("${habitrack.auth.argon2.iterations:3}") int iterations,
            @Value("${habitrack.auth.argon2.memory-kib:65536}") int memoryKib,
            @Value("${habitrack.auth.argon2.parallelism:1}") int parallelism
    ) {
        this.credentialRepository = credentialRepository;
        this.secureRandom = secureRandom;
        this.clock = clock;
        this.iterations = iterations;
        this.memoryKib = memoryKib;
        this.parallelism = parallelism;
    }

    public HashedSecret hash(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("secret must not be null");
        }
        byte[] salt = new byte[SALT_BYTES];
        secureRandom.nextBytes(salt);
        return new HashedSecret(salt, derive(secret, salt));
    }

    /**
     * Re-derives the hash with the stored salt and compares in constant time. Never throws.
     */
    public boolean verify(String secret, byte[] salt, byte[] storedHash) {
        if (secret == null || secret.isEmpty() || salt == null || salt.length == 0
                || storedHash == null || storedHash.length == 0) {
            return false;
        }
        try {
            return MessageDigest.isEqual(derive(secret, salt), storedHash);
        } catch (RuntimeException ex) {
            log.warn("Credential verification failed unexpectedly: {}", ex.getClass().getSimpleName());
            return false;
        }
    }

    @Transactional
    public void updateCredential(Long userId, CredentialProvider provider, String secret) {
        HashedSecret hashed = hash(secret);
        OffsetDateTime now = OffsetDateTime.now(clock);
        Credential credential = credentialRepository.findByUserIdAndProvider(userId, provider)
                .orElseGet(() -> {
                    Credential created = new Credential();
                    created.setUserId(userId);
                    created.setProvider(provider);
                    created.setCreatedAt(now);
                    return created;
                });
        credential.setAlgo(Credential.ALGO_ARGON2ID);
        credential.setSalt(hashed.salt());
        credential.setHash(hashed.hash());
        credential.setUpdatedAt(now);
        credentialRepository.save(credential);
        log.info("Stored {} credential for user {}", provider, userId);
    }

    @Transactional(readOnly = true)
    public boolean verifyCredential(Long userId, CredentialProvider provider, String secret) {
        Optional<Credential> stored = credentialRepository.findByUserIdAndProvider(userId, provider);
        if (stored.isEmpty()) {
            return false;
        }
        Credential credential = stored.get();
        if (credential.getAlgo() == null
                || !Credential.ALGO_ARGON2ID.equals(credential.getAlgo().toLowerCase(Locale.ROOT))) {
            return false;
        }
        return verify(secret, credential.getSalt(), credential.getHash());
    }

    @Transactional(readOnly = true)
    public boolean hasCredential(Long userId, CredentialProvider provider) {
        return credentialRepository.existsByUserIdAndProvider(userId, provider);
    }

    /**
     * Numeric one-time code, each digit drawn uniformly.
     */
    public String generateCode(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(secureRandom.nextInt(10));
        }
        return code.toString();
    }

    /**
     * Storage form of a reset code.
     */
    public byte[] digestCode(String code) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(code.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private byte[] derive(String secret, byte[] salt) {
        Argon2Parameters parameters = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withIterations(iterations)
                .withMemoryAsKB(memoryKib)
                .withParallelism(parallelism)
                .withSalt(salt)
                .build();
        Argon2BytesGenerator generator = new Argon2BytesGenerator();
        generator.init(parameters);
        byte[] out = new byte[HASH_BYTES];
        generator.generateBytes(secret.getBytes(StandardCharsets.UTF_8), out);
        return out;
    }
}
