package me.golemcore.agentloop.domain.cache;

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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Computes the idempotency key of a tool call: uppercase hex SHA-256 of
 * {@code tool + "|" + canonicalJson(params)}.
 *
 * <p>
 * Canonical JSON sorts object keys at every nesting level, keeps array order
 * and writes numbers as Jackson renders them, so two parameter maps that differ
 * only in key order share a fingerprint.
 */
@Component
public class ToolCallFingerprinter {

    private final ObjectMapper objectMapper;

    public ToolCallFingerprinter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String fingerprint(String toolName, Map<String, Object> params) {
        String payload = toolName + "|" + canonicalJson(params);
        return sha256Hex(payload);
    }

    /**
     * Key-sorted JSON rendering of the parameter tree; {@code null} renders as
     * {@code {}}.
     */
    public String canonicalJson(Map<String, Object> params) {
        JsonNode tree = params == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(params);
        try {
            return objectMapper.writeValueAsString(canonicalize(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render canonical parameters", e);
        }
    }

    private JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> fieldNames = node.fieldNames();
            fieldNames.forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode sorted = objectMapper.createObjectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = objectMapper.createArrayNode();
            for (JsonNode item : node) {
                array.add(canonicalize(item));
            }
            return array;
        }
        return node;
    }

    private static String sha256Hex(String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(payload.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02X", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
