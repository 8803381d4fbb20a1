package com.automagik.telemetry.client;

import com.automagik.telemetry.client.privacy.PrivacyEngine;
import com.automagik.telemetry.model.ResourceContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the per-client {@link ResourceContext}. The anonymous user id lives in {@code ~/.automagik/user_id}
 * and is created on first use; only its hash is attached to events. Each client gets a fresh session id.
 */
@Slf4j
public final class ResourceContextFactory {
    static final String USER_ID_DIR = ".automagik";
    static final String USER_ID_FILE = "user_id";

    private final Path home;

    public ResourceContextFactory(Path home) {
        this.home = home;
    }

    public ResourceContext create(TelemetryConfig config) {
        return ResourceContext.builder()
                .projectName(config.getProjectName())
                .version(config.getVersion())
                .organization(config.getOrganization())
                .environment(config.getEnvironment())
                .sessionId(UUID.randomUUID().toString())
                .userIdHash(PrivacyEngine.hash(anonymousUserId()))
                .build();
    }

    /** Reads the persisted id, creating it if missing. Falls back to an in-memory id when the file is unusable. */
    String anonymousUserId() {
        Path file = home.resolve(USER_ID_DIR).resolve(USER_ID_FILE);
        try {
            if (Files.isRegularFile(file)) {
                String existing = Files.readString(file, StandardCharsets.UTF_8).trim();
                if (!existing.isEmpty()) return existing;
            }
            String created = UUID.randomUUID().toString();
            Files.createDirectories(file.getParent());
            Files.writeString(file, created, StandardCharsets.UTF_8);
            return created;
        } catch (IOException | SecurityException e) {
            log.debug("Cannot persist anonymous user id at {}: {}", file, e.toString());
            return UUID.randomUUID().toString();
        }
    }
}
