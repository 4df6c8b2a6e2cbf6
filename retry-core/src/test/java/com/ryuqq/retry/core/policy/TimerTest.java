package com.ryuqq.retry.core.policy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Timer 정책 유닛 테스트.
 *
 * <p>수동 시계로 마감 시각 판단을 검증합니다:</p>
 * <ul>
 *   <li>첫 결정은 항상 진행</li>
 *   <li>마감 전에는 wait만큼 대기 후 진행</li>
 *   <li>마감 후에는 포기 콜백을 정확히 1회 실행</li>
 *   <li>재사용 시 마감 시각 재설정</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("Timer 테스트")
class TimerTest {

    private ManualRetryClock clock;
    private AtomicInteger giveUps;
    private Runnable onGiveUp;

    @BeforeEach
    void setUp() {
        clock = new ManualRetryClock();
        giveUps = new AtomicInteger();
        onGiveUp = giveUps::incrementAndGet;
    }

    @Test
    @DisplayName("첫 결정은 대기 없이 true를 반환한다")
    void next_첫_호출은_대기없이_true() {
        // given
        Timer timer = new Timer(new TimerConfig(1000, 100), clock);

        // when
        boolean proceed = timer.next(onGiveUp);

        // then
        assertThat(proceed).isTrue();
        assertThat(timer.isStarted()).isTrue();
        assertThat(clock.sleeps()).isZero();
        assertThat(giveUps).hasValue(0);
    }

    @Test
    @DisplayName("마감 전 결정은 wait만큼 대기한 뒤 true를 반환한다")
    void next_마감전_wait_대기후_true() {
        // given
        Timer timer = new Timer(new TimerConfig(1000, 100), clock);
        timer.next(onGiveUp);

        // when
        boolean proceed = timer.next(onGiveUp);

        // then
        assertThat(proceed).isTrue();
        assertThat(clock.sleeps()).isEqualTo(1);
        assertThat(clock.sleptMillis()).isEqualTo(100);
    }

    @Test
    @DisplayName("마감 후 결정은 포기 콜백을 한 번 실행하고 false를 반환한다")
    void next_마감후_포기콜백_1회_false() {
        // given
        Timer timer = new Timer(new TimerConfig(1000, 100), clock);
        timer.next(onGiveUp);
        clock.advanceMillis(1001);

        // when
        boolean proceed = timer.next(onGiveUp);

        // then
        assertThat(proceed).isFalse();
        assertThat(giveUps).hasValue(1);
        assertThat(clock.sleeps()).isZero();
    }

    @Test
    @DisplayName("항상 재시도하면 floor(T/W)+1 회 진행한 뒤 포기한다")
    void next_결정횟수는_floor_T_나누기_W_더하기_1() {
        // given
        Timer timer = new Timer(new TimerConfig(1000, 100), clock);

        // when
        int proceeded = 0;
        while (timer.next(onGiveUp)) {
            proceeded++;
        }

        // then
        assertThat(proceeded).isEqualTo(11);
        assertThat(giveUps).hasValue(1);
    }

    @Test
    @DisplayName("W가 T를 나누지 못하면 마감 직전 대기 후의 시도까지 ceil(T/W)+1 회 진행한다")
    void next_나누어_떨어지지_않는_경우() {
        // given
        Timer timer = new Timer(new TimerConfig(250, 100), clock);

        // when
        int proceeded = 0;
        while (timer.next(onGiveUp)) {
            proceeded++;
        }

        // then (결정 시각 0, 0, 100, 200ms는 진행, 300ms에서 포기)
        assertThat(proceeded).isEqualTo(4);
    }

    @Test
    @DisplayName("reset() 후에는 새 마감 시각을 기록한다")
    void reset_새_마감시각_기록() {
        // given
        Timer timer = new Timer(new TimerConfig(1000, 100), clock);
        timer.next(onGiveUp);
        clock.advanceMillis(5000);

        // when
        timer.reset();
        boolean first = timer.next(onGiveUp);
        boolean second = timer.next(onGiveUp);

        // then
        assertThat(timer.isStarted()).isTrue();
        assertThat(first).isTrue();
        assertThat(second).isTrue();
        assertThat(giveUps).hasValue(0);
    }

    @Test
    @DisplayName("새 인스턴스는 이전 실행의 마감 시각을 물려받지 않는다")
    void 새_인스턴스는_상태를_공유하지_않는다() {
        // given
        Timer used = new Timer(new TimerConfig(1000, 100), clock);
        while (used.next(onGiveUp)) {
            // exhaust
        }

        // when
        Timer fresh = new Timer(new TimerConfig(1000, 100), clock);

        // then
        assertThat(fresh.isStarted()).isFalse();
        assertThat(fresh.next(onGiveUp)).isTrue();
        assertThat(fresh.next(onGiveUp)).isTrue();
        assertThat(giveUps).hasValue(1);
    }

    @Test
    void constructor_Default_UsesDefaultConfig() {
        // when
        Timer timer = new Timer();

        // then
        assertThat(timer.getConfig()).isEqualTo(new TimerConfig(2000, 25));
        assertThat(timer.isStarted()).isFalse();
    }

    @Test
    void constructor_NullConfig_ThrowsException() {
        assertThatThrownBy(() -> new Timer(null, clock))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }

    @Test
    void constructor_NullClock_ThrowsException() {
        assertThatThrownBy(() -> new Timer(new TimerConfig(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("clock cannot be null");
    }

    @Test
    void next_NullCallback_ThrowsException() {
        Timer timer = new Timer(new TimerConfig(), clock);

        assertThatThrownBy(() -> timer.next(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("onGiveUp cannot be null");
    }
}
