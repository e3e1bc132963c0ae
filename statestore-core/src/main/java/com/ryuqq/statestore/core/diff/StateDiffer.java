package com.ryuqq.statestore.core.diff;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.statestore.core.model.ClassRecord;
import com.ryuqq.statestore.core.model.ProjectState;
import com.ryuqq.statestore.core.model.StateJson;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 두 ProjectState 비교.
 *
 * <p><strong>비교 단위:</strong></p>
 * <ul>
 *   <li>프로젝트: project_path, project_name</li>
 *   <li>클래스: 이름 기준 추가/제거/수정</li>
 *   <li>수정된 클래스의 속성: file_path, last_modified, attributes의 최상위 키</li>
 *   <li>extension: 키 기준 추가/제거/수정</li>
 * </ul>
 *
 * <p>같은 이름의 클래스 기록이 여러 개이면 마지막 기록이 비교 대상이 됩니다.
 * 결과는 이름 순으로 정렬되어 항상 같은 순서를 가집니다.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public final class StateDiffer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    // Utility class - prevent instantiation
    private StateDiffer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 두 상태 비교.
     *
     * @param before 이전 상태
     * @param after 이후 상태
     * @return 비교 결과
     * @throws IllegalArgumentException before 또는 after가 null인 경우
     */
    public static DiffReport diff(ProjectState before, ProjectState after) {
        if (before == null || after == null) {
            throw new IllegalArgumentException("States cannot be null (before: " + before + ", after: " + after + ")");
        }

        List<DiffChange> changes = new ArrayList<>();
        diffProject(before, after, changes);
        diffClasses(before, after, changes);
        diffValues(DiffComponent.EXTENSION, "", before.extensions(), after.extensions(), changes);

        return new DiffReport(StateJson.checksum(before), StateJson.checksum(after), changes);
    }

    private static void diffProject(ProjectState before, ProjectState after, List<DiffChange> changes) {
        if (!Objects.equals(before.projectPath(), after.projectPath())) {
            changes.add(modified(DiffComponent.PROJECT, "project_path",
                text(before.projectPath()), text(after.projectPath()),
                "Project path changed from " + before.projectPath() + " to " + after.projectPath()));
        }
        if (!Objects.equals(before.projectName(), after.projectName())) {
            changes.add(modified(DiffComponent.PROJECT, "project_name",
                text(before.projectName()), text(after.projectName()),
                "Project name changed from " + before.projectName() + " to " + after.projectName()));
        }
    }

    private static void diffClasses(ProjectState before, ProjectState after, List<DiffChange> changes) {
        Map<String, ClassRecord> oldClasses = byName(before.classes());
        Map<String, ClassRecord> newClasses = byName(after.classes());

        Set<String> names = new TreeSet<>(oldClasses.keySet());
        names.addAll(newClasses.keySet());

        for (String name : names) {
            ClassRecord oldRecord = oldClasses.get(name);
            ClassRecord newRecord = newClasses.get(name);

            if (newRecord == null) {
                changes.add(new DiffChange(ChangeType.REMOVED, DiffComponent.CLASS, name,
                    StateJson.toTree(oldRecord), null, "Class " + name + " removed"));
            } else if (oldRecord == null) {
                changes.add(new DiffChange(ChangeType.ADDED, DiffComponent.CLASS, name,
                    null, StateJson.toTree(newRecord), "Class " + name + " added"));
            } else if (!oldRecord.equals(newRecord)) {
                changes.add(new DiffChange(ChangeType.MODIFIED, DiffComponent.CLASS, name,
                    null, null, "Class " + name + " modified"));
                diffClassRecord(name, oldRecord, newRecord, changes);
            }
        }
    }

    private static void diffClassRecord(String name, ClassRecord oldRecord, ClassRecord newRecord,
                                        List<DiffChange> changes) {
        if (!Objects.equals(oldRecord.filePath(), newRecord.filePath())) {
            changes.add(modified(DiffComponent.CLASS_ATTRIBUTE, name + ".file_path",
                text(oldRecord.filePath()), text(newRecord.filePath()),
                "File path of class " + name + " changed"));
        }
        if (!Objects.equals(oldRecord.lastModified(), newRecord.lastModified())) {
            changes.add(modified(DiffComponent.CLASS_ATTRIBUTE, name + ".last_modified",
                instant(oldRecord.lastModified()), instant(newRecord.lastModified()),
                "Last modified time of class " + name + " changed"));
        }
        diffValues(DiffComponent.CLASS_ATTRIBUTE, name + ".",
            fields(oldRecord.attributes()), fields(newRecord.attributes()), changes);
    }

    private static void diffValues(DiffComponent component, String prefix,
                                   Map<String, JsonNode> oldValues, Map<String, JsonNode> newValues,
                                   List<DiffChange> changes) {
        Set<String> keys = new TreeSet<>(oldValues.keySet());
        keys.addAll(newValues.keySet());

        String label = component == DiffComponent.EXTENSION ? "Extension " : "Attribute ";
        for (String key : keys) {
            JsonNode oldValue = oldValues.get(key);
            JsonNode newValue = newValues.get(key);
            String identifier = prefix + key;

            if (newValue == null) {
                changes.add(new DiffChange(ChangeType.REMOVED, component, identifier,
                    oldValue, null, label + identifier + " removed"));
            } else if (oldValue == null) {
                changes.add(new DiffChange(ChangeType.ADDED, component, identifier,
                    null, newValue, label + identifier + " added"));
            } else if (!oldValue.equals(newValue)) {
                changes.add(modified(component, identifier, oldValue, newValue, label + identifier + " modified"));
            }
        }
    }

    private static Map<String, ClassRecord> byName(List<ClassRecord> classes) {
        Map<String, ClassRecord> result = new LinkedHashMap<>();
        for (ClassRecord record : classes) {
            result.put(String.valueOf(record.name()), record);
        }
        return result;
    }

    private static Map<String, JsonNode> fields(ObjectNode node) {
        Map<String, JsonNode> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            result.put(entry.getKey(), entry.getValue());
        }
        return result;
    }

    private static DiffChange modified(DiffComponent component, String identifier,
                                       JsonNode oldValue, JsonNode newValue, String details) {
        return new DiffChange(ChangeType.MODIFIED, component, identifier, oldValue, newValue, details);
    }

    private static JsonNode text(String value) {
        return value == null ? NODES.nullNode() : NODES.textNode(value);
    }

    private static JsonNode instant(Instant value) {
        return value == null ? NODES.nullNode() : NODES.textNode(value.toString());
    }
}
