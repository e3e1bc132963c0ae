package com.ryuqq.statestore.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 프로젝트 분석 상태 (StateStore가 관리하는 payload).
 *
 * <p>StateStore는 식별 필드({@code projectPath}, {@code projectName})와
 * 일관성 검증에 쓰이는 클래스 기록만 해석합니다. 빌드 상태, 의존성 목록, 재시도 횟수 등
 * 파이프라인 단계별 필드는 {@code extensions}에 담겨 해석 없이 운반됩니다.</p>
 *
 * <p><strong>사용 패턴 (조회 → 복사본 수정 → 저장):</strong></p>
 * <pre>
 * ProjectState current = store.getState();
 * ProjectState next = current.toBuilder()
 *     .extension("build_status", "SUCCESS")
 *     .build();
 * store.setState(next);
 * </pre>
 *
 * <p><strong>불변성:</strong> 클래스 목록은 수정 불가 리스트이며, extension 값은
 * 생성 시와 조회 시 모두 깊은 복사됩니다.</p>
 *
 * <p><strong>유효성:</strong> 이 클래스는 불완전한 값(빈 경로 등)도 표현할 수 있으며,
 * 유효성 검증은 StateStore에 저장될 때 수행됩니다.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public final class ProjectState {

    private final String projectPath;
    private final String projectName;
    private final List<ClassRecord> classes;
    private final Map<String, JsonNode> extensions;

    private ProjectState(Builder builder) {
        this.projectPath = builder.projectPath;
        this.projectName = builder.projectName;
        this.classes = List.copyOf(builder.classes);
        this.extensions = Collections.unmodifiableMap(deepCopy(builder.extensions));
    }

    /**
     * 빌더 생성.
     *
     * @return Builder 인스턴스
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 클래스 기록 없는 최소 상태 생성.
     *
     * @param projectPath 프로젝트 루트 절대 경로
     * @param projectName 프로젝트 이름
     * @return ProjectState 인스턴스
     */
    public static ProjectState of(String projectPath, String projectName) {
        return builder().projectPath(projectPath).projectName(projectName).build();
    }

    /**
     * 현재 값을 가진 빌더 생성.
     *
     * @return Builder 인스턴스
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.projectPath = projectPath;
        builder.projectName = projectName;
        builder.classes.addAll(classes);
        builder.extensions.putAll(deepCopy(extensions));
        return builder;
    }

    public String projectPath() {
        return projectPath;
    }

    public String projectName() {
        return projectName;
    }

    /**
     * @return 수정 불가 클래스 기록 목록
     */
    public List<ClassRecord> classes() {
        return classes;
    }

    /**
     * 이름으로 클래스 기록 조회.
     *
     * @param className 클래스 이름
     * @return 첫 번째로 일치하는 기록 (없으면 empty)
     */
    public Optional<ClassRecord> findClass(String className) {
        return classes.stream()
            .filter(record -> Objects.equals(record.name(), className))
            .findFirst();
    }

    /**
     * extension 전체 조회.
     *
     * @return 값이 깊은 복사된 새 Map
     */
    public Map<String, JsonNode> extensions() {
        return deepCopy(extensions);
    }

    /**
     * 단일 extension 조회.
     *
     * @param key extension 이름
     * @return 값의 복사본 (없으면 empty)
     */
    public Optional<JsonNode> extension(String key) {
        JsonNode value = extensions.get(key);
        return value == null ? Optional.empty() : Optional.of(value.deepCopy());
    }

    /**
     * 구조적으로 동일한 독립 인스턴스 생성.
     *
     * @return 복사본 (equals는 true, 참조는 다름)
     */
    public ProjectState copy() {
        return toBuilder().build();
    }

    private static Map<String, JsonNode> deepCopy(Map<String, JsonNode> source) {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, value.deepCopy()));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProjectState that = (ProjectState) o;
        return Objects.equals(projectPath, that.projectPath)
            && Objects.equals(projectName, that.projectName)
            && classes.equals(that.classes)
            && extensions.equals(that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectPath, projectName, classes, extensions);
    }

    @Override
    public String toString() {
        return "ProjectState{projectPath=" + projectPath + ", projectName=" + projectName
            + ", classes=" + classes.size() + ", extensions=" + extensions.keySet() + '}';
    }

    /**
     * ProjectState 빌더.
     */
    public static final class Builder {

        private String projectPath;
        private String projectName;
        private final List<ClassRecord> classes = new ArrayList<>();
        private final Map<String, JsonNode> extensions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder projectPath(String projectPath) {
            this.projectPath = projectPath;
            return this;
        }

        public Builder projectName(String projectName) {
            this.projectName = projectName;
            return this;
        }

        /**
         * 클래스 목록 전체 교체.
         *
         * @param classes 새 클래스 목록
         * @return this
         * @throws IllegalArgumentException classes 또는 원소가 null인 경우
         */
        public Builder classes(List<ClassRecord> classes) {
            if (classes == null) {
                throw new IllegalArgumentException("classes cannot be null");
            }
            this.classes.clear();
            classes.forEach(this::addClass);
            return this;
        }

        public Builder addClass(ClassRecord record) {
            if (record == null) {
                throw new IllegalArgumentException("class record cannot be null");
            }
            this.classes.add(record);
            return this;
        }

        /**
         * 이름이 일치하는 모든 클래스 기록 제거.
         *
         * @param className 클래스 이름
         * @return this
         */
        public Builder removeClass(String className) {
            this.classes.removeIf(record -> Objects.equals(record.name(), className));
            return this;
        }

        public Builder extension(String key, JsonNode value) {
            if (key == null) {
                throw new IllegalArgumentException("extension key cannot be null");
            }
            this.extensions.put(key, value == null ? JsonNodeFactory.instance.nullNode() : value.deepCopy());
            return this;
        }

        public Builder extension(String key, String value) {
            return extension(key, JsonNodeFactory.instance.textNode(value));
        }

        public Builder extension(String key, long value) {
            return extension(key, JsonNodeFactory.instance.numberNode(value));
        }

        public Builder extension(String key, boolean value) {
            return extension(key, JsonNodeFactory.instance.booleanNode(value));
        }

        public Builder removeExtension(String key) {
            this.extensions.remove(key);
            return this;
        }

        public ProjectState build() {
            return new ProjectState(this);
        }
    }
}
