package me.golemcore.agentloop.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentloop.domain.model.AgentState;
import me.golemcore.agentloop.port.outbound.AgentStateStorePort;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Stores each agent as {@code <agentId>.jsonl} under the base directory, with
 * characters that are unsafe in file names percent-encoded.
 *
 * <p>
 * The file holds two lines: a header with the agent id and the write time,
 * then the full state. Writes go to a temp file that is moved over the target
 * so readers never observe a partial record. Unreadable files are logged and
 * reported as absent.
 */
@Slf4j
public class FileAgentStateStore implements AgentStateStorePort {

    private static final String FILE_SUFFIX = ".jsonl";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Path basePath;

    public FileAgentStateStore(String basePath, ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.basePath = Paths.get(basePath.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.basePath);
            log.info("[Storage] Agent state directory: {}", this.basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create storage directory: " + this.basePath, e);
        }
    }

    @Override
    public CompletableFuture<Optional<AgentState>> load(String agentId) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolvePath(agentId);
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            try {
                List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                        .filter(line -> !line.isBlank())
                        .toList();
                if (lines.isEmpty()) {
                    log.error("[Storage] Empty state file for agent {}: {}", agentId, file);
                    return Optional.empty();
                }
                String stateLine = lines.get(lines.size() - 1);
                AgentState state = objectMapper.readValue(stateLine, AgentState.class);
                return Optional.of(state);
            } catch (IOException e) {
                log.error("[Storage] Corrupt state file for agent {}: {}", agentId, e.getMessage());
                return Optional.empty();
            }
        });
    }

    @Override
    public CompletableFuture<Void> save(String agentId, AgentState state) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(agentId);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
            try {
                byte[] bytes = render(agentId, state).getBytes(StandardCharsets.UTF_8);
                try (OutputStream os = Files.newOutputStream(tempPath,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.SYNC)) {
                    os.write(bytes);
                }
                try {
                    Files.move(tempPath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }
                log.debug("[Storage] Saved agent {} ({} turns)", agentId, state.getTurns().size());
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
                }
                throw new UncheckedIOException("Atomic write failed for agent " + agentId, e);
            }
        });
    }

    Path getBasePath() {
        return basePath;
    }

    /**
     * Percent-encodes every UTF-8 byte outside {@code [A-Za-z0-9._-]}, plus a
     * leading dot, so any id maps to one flat file name.
     */
    static String fileNameFor(String agentId) {
        StringBuilder name = new StringBuilder(agentId.length() + FILE_SUFFIX.length());
        byte[] bytes = agentId.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            boolean plain = (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z') || (b >= '0' && b <= '9')
                    || b == '-' || b == '_' || (b == '.' && i > 0);
            if (plain) {
                name.append((char) b);
            } else {
                name.append('%').append(HEX[b >> 4]).append(HEX[b & 0x0F]);
            }
        }
        return name.append(FILE_SUFFIX).toString();
    }

    private String render(String agentId, AgentState state) throws JsonProcessingException {
        ObjectNode header = objectMapper.createObjectNode();
        header.put("agent_id", agentId);
        header.put("updated_at", clock.instant().toString());
        JsonNode body = objectMapper.valueToTree(state);
        return objectMapper.writeValueAsString(header) + "\n" + objectMapper.writeValueAsString(body) + "\n";
    }

    private Path resolvePath(String agentId) {
        if (agentId == null || agentId.isEmpty()) {
            throw new IllegalArgumentException("Invalid agent id: " + agentId);
        }
        Path resolved = basePath.resolve(fileNameFor(agentId)).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + agentId);
        }
        return resolved;
    }
}
