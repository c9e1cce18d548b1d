package com.consullo.imaging.settle;

import com.consullo.imaging.core.AdjustmentTriple;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the arm/cancel/fire settling state machine.
 *
 * @since 1.0
 */
public class AdjustmentSettlerTest {

  private final ManualSettlingScheduler scheduler = new ManualSettlingScheduler();
  private final List<AdjustmentTriple> committed = new ArrayList<>();
  private final AdjustmentSettler settler = new AdjustmentSettler(scheduler, 500L, committed::add, new Object());

  @Test
  @DisplayName("Should commit once, with the last value, after input goes quiet")
  void arm_RepeatedChanges_CommitsLastValueOnce() {
    settler.arm(AdjustmentTriple.IDENTITY.withBrightness(101));
    scheduler.advance(200);
    settler.arm(AdjustmentTriple.IDENTITY.withBrightness(102));
    scheduler.advance(200);
    settler.arm(AdjustmentTriple.IDENTITY.withBrightness(103));
    scheduler.advance(499);

    assertThat(committed).isEmpty();
    assertThat(settler.hasPending()).isTrue();

    scheduler.advance(1);

    assertThat(committed).containsExactly(AdjustmentTriple.IDENTITY.withBrightness(103));
    assertThat(settler.hasPending()).isFalse();
    assertThat(scheduler.pendingCount()).isZero();
  }

  @Test
  @DisplayName("Should never commit after cancel, even if the timer still fires")
  void cancel_ThenStaleFire_Ignored() {
    settler.arm(AdjustmentTriple.IDENTITY.withContrast(150));
    settler.cancel();
    scheduler.forceRun(0);
    scheduler.advance(1_000);

    assertThat(committed).isEmpty();
    assertThat(settler.pending()).isNull();
  }

  @Test
  @DisplayName("Should ignore a fire from a superseded arm")
  void fire_OlderGeneration_Ignored() {
    final long first = settler.arm(AdjustmentTriple.IDENTITY.withSaturation(10));
    final long second = settler.arm(AdjustmentTriple.IDENTITY.withSaturation(20));

    assertThat(second).isGreaterThan(first);
    assertThat(settler.fire(first)).isFalse();
    assertThat(committed).isEmpty();

    assertThat(settler.fire(second)).isTrue();
    assertThat(committed).containsExactly(AdjustmentTriple.IDENTITY.withSaturation(20));
    assertThat(settler.fire(second)).isFalse();
  }

  @Test
  @DisplayName("Should commit immediately on flush and then ignore the timer")
  void flush_CommitsNowAndInvalidatesTimer() {
    settler.arm(AdjustmentTriple.IDENTITY.withBrightness(150));

    assertThat(settler.flush()).isTrue();
    scheduler.forceRun(0);

    assertThat(committed).containsExactly(AdjustmentTriple.IDENTITY.withBrightness(150));
    assertThat(settler.flush()).isFalse();
  }

  @Test
  @DisplayName("Should bump the generation on every arm and cancel")
  void generation_MonotonicallyIncreases() {
    final long start = settler.generation();
    settler.arm(AdjustmentTriple.IDENTITY);
    settler.cancel();
    settler.arm(AdjustmentTriple.IDENTITY);

    assertThat(settler.generation()).isEqualTo(start + 3);
    assertThat(scheduler.scheduledCount()).isEqualTo(2);
  }
}
