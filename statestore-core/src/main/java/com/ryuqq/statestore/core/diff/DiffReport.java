package com.ryuqq.statestore.core.diff;

import java.util.List;

/**
 * 두 상태의 비교 결과.
 *
 * @param checksumBefore 이전 상태 체크섬
 * @param checksumAfter 이후 상태 체크섬
 * @param changes 변경 목록 (수정 불가)
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public record DiffReport(String checksumBefore, String checksumAfter, List<DiffChange> changes) {

    private static final String RULE = "=".repeat(80);

    public DiffReport {
        if (checksumBefore == null || checksumAfter == null) {
            throw new IllegalArgumentException("checksums cannot be null");
        }
        if (changes == null) {
            throw new IllegalArgumentException("changes cannot be null");
        }
        changes = List.copyOf(changes);
    }

    /**
     * @return 두 상태의 체크섬이 같으면 true
     */
    public boolean identical() {
        return checksumBefore.equals(checksumAfter);
    }

    /**
     * @param type 변경 유형
     * @return 해당 유형의 변경 수
     */
    public long count(ChangeType type) {
        return changes.stream().filter(change -> change.type() == type).count();
    }

    /**
     * @param component 변경 위치
     * @return 해당 위치의 변경 목록
     */
    public List<DiffChange> changesIn(DiffComponent component) {
        return changes.stream().filter(change -> change.component() == component).toList();
    }

    /**
     * @return 변경된 클래스 수 (추가, 제거, 수정 포함)
     */
    public long classesChanged() {
        return changes.stream()
            .filter(change -> change.component() == DiffComponent.CLASS)
            .map(DiffChange::identifier)
            .distinct()
            .count();
    }

    /**
     * 사람이 읽을 수 있는 텍스트 보고서 생성.
     *
     * @return 여러 줄 문자열
     */
    public String format() {
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n')
            .append("STATE DIFF REPORT").append('\n')
            .append("Before: ").append(checksumBefore).append('\n')
            .append("After:  ").append(checksumAfter).append('\n')
            .append(RULE).append('\n')
            .append("SUMMARY:").append('\n')
            .append("  Changes: ").append(changes.size()).append('\n')
            .append("  Added: ").append(count(ChangeType.ADDED)).append('\n')
            .append("  Removed: ").append(count(ChangeType.REMOVED)).append('\n')
            .append("  Modified: ").append(count(ChangeType.MODIFIED)).append('\n')
            .append("  Classes Changed: ").append(classesChanged()).append('\n')
            .append(RULE).append('\n')
            .append("CHANGES:").append('\n');

        int index = 1;
        for (DiffChange change : changes) {
            out.append(index++).append(". [").append(change.type()).append("] ")
                .append(change.component()).append(": ").append(change.identifier()).append('\n');
            if (change.details() != null) {
                out.append("   ").append(change.details()).append('\n');
            }
            if (change.oldValue() != null) {
                out.append("   Old: ").append(change.oldValue()).append('\n');
            }
            if (change.newValue() != null) {
                out.append("   New: ").append(change.newValue()).append('\n');
            }
        }
        out.append(RULE);
        return out.toString();
    }

    @Override
    public String toString() {
        return "DiffReport{changes=" + changes.size() + ", identical=" + identical() + '}';
    }
}
