package com.ryuqq.statestore.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * ProjectState의 JSON 표현과 체크섬 계산.
 *
 * <p>체크섬은 키가 정렬된 정규화 JSON의 SHA-256 값이므로,
 * extension이나 attribute의 삽입 순서가 달라도 같은 상태는 같은 체크섬을 가집니다.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public final class StateJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    // Utility class - prevent instantiation
    private StateJson() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * ProjectState를 JSON 트리로 변환.
     *
     * @param state 변환할 상태
     * @return 새 ObjectNode
     * @throws IllegalArgumentException state가 null인 경우
     */
    public static ObjectNode toTree(ProjectState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        ObjectNode root = MAPPER.createObjectNode();
        root.put("project_path", state.projectPath());
        root.put("project_name", state.projectName());

        ArrayNode classes = root.putArray("classes");
        for (ClassRecord record : state.classes()) {
            classes.add(toTree(record));
        }

        ObjectNode extensions = root.putObject("extensions");
        state.extensions().forEach(extensions::set);
        return root;
    }

    /**
     * ClassRecord를 JSON 트리로 변환.
     *
     * @param record 변환할 기록
     * @return 새 ObjectNode
     */
    public static ObjectNode toTree(ClassRecord record) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", record.name());
        node.put("file_path", record.filePath());
        node.put("last_modified", record.lastModified() == null ? null : record.lastModified().toString());
        node.set("attributes", record.attributes());
        return node;
    }

    /**
     * 정규화 JSON의 SHA-256 체크섬 계산.
     *
     * @param state 대상 상태
     * @return 64자리 소문자 16진수 문자열
     */
    public static String checksum(ProjectState state) {
        // Maps are re-serialized so ORDER_MAP_ENTRIES_BY_KEYS applies at every depth
        Object canonical = MAPPER.convertValue(toTree(state), Object.class);
        try {
            byte[] bytes = MAPPER.writeValueAsString(canonical).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state for checksum", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
