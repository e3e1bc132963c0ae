package com.ryuqq.statestore.adapter.inmemory.store;

import com.ryuqq.statestore.core.config.StateStoreConfig;
import com.ryuqq.statestore.core.exception.StateValidationException;
import com.ryuqq.statestore.core.model.ProjectState;
import com.ryuqq.statestore.core.model.StateSnapshot;
import com.ryuqq.statestore.core.model.StateTransaction;
import com.ryuqq.statestore.core.model.TransactionId;
import com.ryuqq.statestore.core.spi.FileMetadata;
import com.ryuqq.statestore.core.spi.FileMetadataProvider;
import com.ryuqq.statestore.core.statemachine.TransactionStatus;
import com.ryuqq.statestore.core.validation.StateValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * InMemoryStateStore 유닛 테스트.
 *
 * <p>계약 테스트로 확인하기 어려운 동작을 검증합니다:</p>
 * <ul>
 *   <li>commit 시 재검증 실패 (주입된 validator)</li>
 *   <li>Clock 기반 타임스탬프</li>
 *   <li>pre-image의 일련번호 사용</li>
 *   <li>생성자 인자 검증</li>
 * </ul>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InMemoryStateStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private StateValidator validator;

    private final FileMetadataProvider files = path -> FileMetadata.missing();
    private MutableClock clock;
    private InMemoryStateStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryStateStore(new StateStoreConfig(), files, validator, clock);
    }

    // ============================================================
    // 1. commit 재검증 실패
    // ============================================================

    @Test
    void commit_재검증_실패시_트랜잭션은_ACTIVE로_남는다() {
        // given
        when(validator.validate(any())).thenReturn(List.of(), List.of("classes[0].name must not be empty"));
        store.setState(ProjectState.of("/work/demo", "demo"));
        TransactionId id = store.beginTransaction("analyze");

        // when & then
        assertThatThrownBy(() -> store.commitTransaction(id))
            .isInstanceOf(StateValidationException.class)
            .hasMessageContaining("classes[0].name must not be empty");

        assertThat(store.getActiveTransaction()).map(StateTransaction::id).contains(id);
        assertThat(store.getTransactionHistory(10)).isEmpty();
        assertThat(store.getLatestSnapshot().operation()).isEqualTo("set_state");
    }

    @Test
    void commit_재검증_실패_후_rollback하면_pre_image로_복구된다() {
        // given
        when(validator.validate(any())).thenReturn(List.of(), List.of(), List.of("invalid"));
        store.setState(ProjectState.of("/work/demo", "before"));
        TransactionId id = store.beginTransaction("analyze");
        store.setState(ProjectState.of("/work/demo", "after"));
        assertThatThrownBy(() -> store.commitTransaction(id)).isInstanceOf(StateValidationException.class);

        // when
        store.rollbackTransaction(id, "commit rejected");

        // then
        assertThat(store.getState().projectName()).isEqualTo("before");
        assertThat(store.getTransactionHistory(1).get(0).status()).isEqualTo(TransactionStatus.ROLLED_BACK);
    }

    @Test
    void executeWithRollback_commit이_거부되면_롤백_후_검증_예외가_전파된다() {
        // given
        when(validator.validate(any())).thenReturn(List.of(), List.of(), List.of("invalid"));
        store.setState(ProjectState.of("/work/demo", "before"));

        // when & then
        assertThatThrownBy(() -> store.executeWithRollback("analyze", () -> {
            store.setState(ProjectState.of("/work/demo", "after"));
            return null;
        })).isInstanceOf(StateValidationException.class);

        assertThat(store.getState().projectName()).isEqualTo("before");
        assertThat(store.getActiveTransaction()).isEmpty();
        StateTransaction rolledBack = store.getTransactionHistory(1).get(0);
        assertThat(rolledBack.status()).isEqualTo(TransactionStatus.ROLLED_BACK);
        assertThat(rolledBack.error()).isEqualTo("scope closed without commit");
    }

    @Test
    void rollback은_pre_image를_재검증하지_않는다() {
        // given
        when(validator.validate(any())).thenReturn(List.of());
        store.setState(ProjectState.of("/work/demo", "demo"));
        TransactionId id = store.beginTransaction("analyze");

        // when
        store.rollbackTransaction(id);

        // then
        verify(validator, times(1)).validate(any());
    }

    @Test
    void 검증에_실패한_setState는_validator_결과를_그대로_담는다() {
        // given
        when(validator.validate(any())).thenReturn(List.of("a", "b"));

        // when & then
        assertThatThrownBy(() -> store.setState(ProjectState.of("/work/demo", "demo")))
            .isInstanceOfSatisfying(StateValidationException.class,
                e -> assertThat(e.violations()).containsExactly("a", "b"));
        assertThat(store.hasState()).isFalse();
    }

    // ============================================================
    // 2. Clock 기반 타임스탬프
    // ============================================================

    @Test
    void 스냅샷과_트랜잭션_시각은_주입된_Clock을_따른다() {
        // given
        when(validator.validate(any())).thenReturn(List.of());
        store.setState(ProjectState.of("/work/demo", "v1"));

        // when
        clock.advance(Duration.ofMinutes(1));
        TransactionId id = store.beginTransaction("step");
        clock.advance(Duration.ofMinutes(1));
        store.commitTransaction(id);

        // then
        assertThat(store.getSnapshot(1).timestamp()).isEqualTo(T0);
        StateTransaction committed = store.getTransactionHistory(1).get(0);
        assertThat(committed.startedAt()).isEqualTo(T0.plus(Duration.ofMinutes(1)));
        assertThat(committed.endedAt()).isEqualTo(T0.plus(Duration.ofMinutes(2)));
        assertThat(store.getLatestSnapshot().timestamp()).isEqualTo(T0.plus(Duration.ofMinutes(2)));
    }

    @Test
    void getSnapshotsSince는_경계_시각을_포함한다() {
        // given
        when(validator.validate(any())).thenReturn(List.of());
        store.setState(ProjectState.of("/work/demo", "v1"));
        clock.advance(Duration.ofSeconds(10));
        store.setState(ProjectState.of("/work/demo", "v2"));
        clock.advance(Duration.ofSeconds(10));
        store.setState(ProjectState.of("/work/demo", "v3"));

        // when
        List<StateSnapshot> since = store.getSnapshotsSince(T0.plusSeconds(10));

        // then
        assertThat(since).extracting(snapshot -> snapshot.state().projectName())
            .containsExactly("v2", "v3");
    }

    // ============================================================
    // 3. 일련번호
    // ============================================================

    @Test
    void pre_image도_일련번호를_소비하지만_이력에는_없다() {
        // given
        when(validator.validate(any())).thenReturn(List.of());
        store.setState(ProjectState.of("/work/demo", "demo"));

        // when
        TransactionId id = store.beginTransaction("analyze");
        StateSnapshot preImage = store.getActiveTransaction().orElseThrow().preImage();
        store.commitTransaction(id);

        // then
        assertThat(preImage.sequenceId()).isEqualTo(2);
        assertThat(preImage.operation()).isEqualTo("pre_image:analyze");
        assertThat(store.getLatestSnapshot().sequenceId()).isEqualTo(3);
        assertThat(store.getTransactionHistory(1).get(0).resultSequenceId()).isEqualTo(3L);
        assertThat(store.getSnapshotsSince(Instant.EPOCH)).extracting(StateSnapshot::sequenceId)
            .containsExactly(1L, 3L);
    }

    @Test
    void clearState_후에도_일련번호는_이어진다() {
        // given
        when(validator.validate(any())).thenReturn(List.of());
        store.setState(ProjectState.of("/work/demo", "demo"));

        // when
        store.clearState();
        store.setState(ProjectState.of("/work/demo", "demo"));

        // then
        assertThat(store.getLatestSnapshot().sequenceId()).isEqualTo(2);
    }

    // ============================================================
    // 4. 생성자 / 인자 검증
    // ============================================================

    @Test
    void 생성자_인자가_null이면_예외() {
        StateStoreConfig config = new StateStoreConfig();

        assertThatThrownBy(() -> new InMemoryStateStore(null, files, validator, clock))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("config cannot be null");
        assertThatThrownBy(() -> new InMemoryStateStore(config, null, validator, clock))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("files cannot be null");
        assertThatThrownBy(() -> new InMemoryStateStore(config, files, null, clock))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("validator cannot be null");
        assertThatThrownBy(() -> new InMemoryStateStore(config, files, validator, null))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("clock cannot be null");
    }

    @Test
    void 기본_생성자는_기본_설정을_사용한다() {
        InMemoryStateStore defaults = new InMemoryStateStore();

        assertThat(defaults.config()).isEqualTo(new StateStoreConfig());
        assertThat(defaults.hasState()).isFalse();
    }

    @Test
    void validateState는_validator에_위임한다() {
        // given
        ProjectState state = ProjectState.of("/work/demo", "demo");
        when(validator.validate(state)).thenReturn(List.of("x"));

        // when & then
        assertThat(store.validateState(state)).containsExactly("x");
        verify(validator).validate(state);
    }

    @Test
    void 인자_검증() {
        assertThatThrownBy(() -> store.invalidateClassState(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.getSnapshotsSince(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.verifyStateConsistency(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.commitTransaction(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.executeWithRollback("op", null)).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * 테스트용 수동 Clock.
     */
    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
