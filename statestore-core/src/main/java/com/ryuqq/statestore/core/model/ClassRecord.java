package com.ryuqq.statestore.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 분석된 클래스 하나에 대한 기록.
 *
 * <p>StateStore가 직접 해석하는 필드는 {@code name}, {@code filePath}, {@code lastModified} 뿐이며,
 * 나머지 분석 결과(필드, 메서드, import, 상태 등)는 {@code attributes}에 그대로 실려 운반됩니다.</p>
 *
 * <p><strong>필드 용도:</strong></p>
 * <ul>
 *   <li>name: 클래스 무효화(invalidate) 및 diff 시 식별자</li>
 *   <li>filePath: 일관성 검증 시 존재 여부 확인 대상 (선택)</li>
 *   <li>lastModified: 분석 시점의 파일 수정 시각 (선택)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> attributes는 생성 시와 조회 시 모두 깊은 복사되므로
 * 외부에서 내부 상태를 변경할 수 없습니다.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public final class ClassRecord {

    private final String name;
    private final String filePath;
    private final Instant lastModified;
    private final ObjectNode attributes;

    private ClassRecord(Builder builder) {
        this.name = builder.name;
        this.filePath = builder.filePath;
        this.lastModified = builder.lastModified;
        this.attributes = builder.attributes.deepCopy();
    }

    /**
     * 빌더 생성.
     *
     * @param name 클래스 이름
     * @return Builder 인스턴스
     */
    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    /**
     * 파일 정보만 가진 ClassRecord 생성.
     *
     * @param name 클래스 이름
     * @param filePath 소스 파일 경로 (null 허용)
     * @param lastModified 파일 수정 시각 (null 허용)
     * @return ClassRecord 인스턴스
     */
    public static ClassRecord of(String name, String filePath, Instant lastModified) {
        return builder(name).filePath(filePath).lastModified(lastModified).build();
    }

    /**
     * 현재 값을 가진 빌더 생성.
     *
     * @return Builder 인스턴스
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.name = name;
        builder.filePath = filePath;
        builder.lastModified = lastModified;
        builder.attributes = attributes.deepCopy();
        return builder;
    }

    public String name() {
        return name;
    }

    /**
     * @return 소스 파일 경로 (null 가능)
     */
    public String filePath() {
        return filePath;
    }

    public boolean hasFilePath() {
        return filePath != null;
    }

    /**
     * @return 분석 시점의 파일 수정 시각 (null 가능)
     */
    public Instant lastModified() {
        return lastModified;
    }

    /**
     * 추가 속성 조회.
     *
     * @return attributes의 깊은 복사본
     */
    public ObjectNode attributes() {
        return attributes.deepCopy();
    }

    /**
     * 단일 속성 조회.
     *
     * @param key 속성 이름
     * @return 속성 값의 복사본 (없으면 empty)
     */
    public Optional<JsonNode> attribute(String key) {
        JsonNode value = attributes.get(key);
        return value == null ? Optional.empty() : Optional.of(value.deepCopy());
    }

    /**
     * 구조적으로 동일한 독립 인스턴스 생성.
     *
     * @return 복사본
     */
    public ClassRecord copy() {
        return toBuilder().build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClassRecord that = (ClassRecord) o;
        return Objects.equals(name, that.name)
            && Objects.equals(filePath, that.filePath)
            && Objects.equals(lastModified, that.lastModified)
            && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, filePath, lastModified, attributes);
    }

    @Override
    public String toString() {
        return "ClassRecord{name=" + name + ", filePath=" + filePath + ", lastModified=" + lastModified
            + ", attributes=" + attributes.size() + " fields}";
    }

    /**
     * ClassRecord 빌더.
     */
    public static final class Builder {

        private String name;
        private String filePath;
        private Instant lastModified;
        private ObjectNode attributes = JsonNodeFactory.instance.objectNode();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder lastModified(Instant lastModified) {
            this.lastModified = lastModified;
            return this;
        }

        /**
         * 속성 전체 교체.
         *
         * @param attributes 새 속성 (null이면 빈 객체)
         * @return this
         */
        public Builder attributes(ObjectNode attributes) {
            this.attributes = attributes == null ? JsonNodeFactory.instance.objectNode() : attributes.deepCopy();
            return this;
        }

        public Builder attribute(String key, JsonNode value) {
            if (key == null) {
                throw new IllegalArgumentException("attribute key cannot be null");
            }
            attributes.set(key, value == null ? JsonNodeFactory.instance.nullNode() : value.deepCopy());
            return this;
        }

        public Builder attribute(String key, String value) {
            return attribute(key, JsonNodeFactory.instance.textNode(value));
        }

        public Builder removeAttribute(String key) {
            attributes.remove(key);
            return this;
        }

        public ClassRecord build() {
            return new ClassRecord(this);
        }
    }
}
