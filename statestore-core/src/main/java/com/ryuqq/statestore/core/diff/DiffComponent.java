package com.ryuqq.statestore.core.diff;

/**
 * 변경이 발생한 위치.
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public enum DiffComponent {

    /** project_path, project_name */
    PROJECT,

    /** 클래스 기록 자체 */
    CLASS,

    /** 클래스 기록의 속성 (file_path, last_modified, attributes.*) */
    CLASS_ATTRIBUTE,

    /** 프로젝트 extension */
    EXTENSION
}
