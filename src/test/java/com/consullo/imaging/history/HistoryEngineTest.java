package com.consullo.imaging.history;

import com.consullo.imaging.adjust.ColorAdjuster;
import com.consullo.imaging.adjust.DefaultColorAdjuster;
import com.consullo.imaging.core.AdjustmentTriple;
import com.consullo.imaging.core.NoImageLoadedException;
import com.consullo.imaging.core.PixelBuffer;
import com.consullo.imaging.core.TestBuffers;
import com.consullo.imaging.core.events.BufferChangedEvent;
import com.consullo.imaging.core.events.BufferListener;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Replay and navigation tests for the history engine.
 *
 * @since 1.0
 */
public class HistoryEngineTest {

  private final HistoryEngine engine = new HistoryEngine(new DefaultColorAdjuster());

  @Test
  @DisplayName("Should show the loaded image unchanged")
  void load_IdentityReplay_EqualsBase() {
    final PixelBuffer base = TestBuffers.labelled(4, 3);

    engine.load(base);

    assertThat(engine.currentBuffer()).isEqualTo(base);
    assertThat(engine.operations()).containsExactly(AdjustmentSnapshot.IDENTITY);
    assertThat(engine.state().cursor()).isZero();
  }

  @Test
  @DisplayName("Should signal a missing image distinctly from an empty one")
  void currentBuffer_BeforeLoad_Throws() {
    assertThat(engine.isLoaded()).isFalse();
    assertThatThrownBy(engine::currentBuffer).isInstanceOf(NoImageLoadedException.class);
    assertThatThrownBy(() -> engine.commit(TransformOperation.rotateClockwise()))
            .isInstanceOf(NoImageLoadedException.class);
    assertThat(engine.undo()).isFalse();
    assertThat(engine.redo()).isFalse();
    assertThat(engine.isLoaded()).isFalse();

    engine.load(PixelBuffer.of(0, 0, new byte[0]));

    assertThat(engine.currentBuffer().isEmpty()).isTrue();
  }

  @Test
  @DisplayName("Should brighten a 2x1 image to exact bytes")
  void commit_Brightness120_ExactBytes() {
    engine.load(TestBuffers.of(2, 1, 10, 10, 10, 255, 250, 250, 250, 255));

    engine.commit(new AdjustmentSnapshot(new AdjustmentTriple(120, 100, 100)));

    assertThat(TestBuffers.samples(engine.currentBuffer()))
            .containsExactly(61, 61, 61, 255, 255, 255, 255, 255);
  }

  @Test
  @DisplayName("Should rotate a 3x2 image clockwise into a 2x3 image")
  void commit_Rotate90_RemapsSamples() {
    engine.load(TestBuffers.of(3, 2,
            10, 11, 12, 255, 20, 21, 22, 255, 30, 31, 32, 255,
            40, 41, 42, 255, 50, 51, 52, 255, 60, 61, 62, 255));

    engine.commit(new TransformOperation(new Rotate(90)));

    final PixelBuffer out = engine.currentBuffer();
    assertThat(out.getWidth()).isEqualTo(2);
    assertThat(out.getHeight()).isEqualTo(3);
    assertThat(TestBuffers.samples(out)).containsExactly(
            40, 41, 42, 255, 10, 11, 12, 255,
            50, 51, 52, 255, 20, 21, 22, 255,
            60, 61, 62, 255, 30, 31, 32, 255);
  }

  @Test
  @DisplayName("Should reproduce every committed buffer when undoing and redoing")
  void undoRedo_RoundTrip_ReproducesBuffers() {
    engine.load(TestBuffers.labelled(3, 2));
    final List<PixelBuffer> produced = new ArrayList<>();
    produced.add(engine.currentBuffer());

    final List<Operation> ops = List.of(
            TransformOperation.rotateClockwise(),
            new AdjustmentSnapshot(new AdjustmentTriple(130, 100, 100)),
            TransformOperation.flip(FlipAxis.HORIZONTAL),
            new AdjustmentSnapshot(new AdjustmentTriple(80, 150, 40)),
            TransformOperation.rotateCounterClockwise(),
            TransformOperation.flip(FlipAxis.VERTICAL));
    for (Operation op : ops) {
      engine.commit(op);
      produced.add(engine.currentBuffer());
    }

    for (int i = ops.size() - 1; i >= 0; i--) {
      assertThat(engine.undo()).isTrue();
      assertThat(engine.currentBuffer()).isEqualTo(produced.get(i));
    }
    assertThat(engine.undo()).isFalse();

    for (int i = 1; i <= ops.size(); i++) {
      assertThat(engine.redo()).isTrue();
      assertThat(engine.currentBuffer()).isEqualTo(produced.get(i));
    }
    assertThat(engine.redo()).isFalse();
  }

  @Test
  @DisplayName("Should permanently discard the undone branch on a new commit")
  void commit_AfterUndo_TruncatesBranch() {
    engine.load(TestBuffers.labelled(3, 2));
    final Operation a = TransformOperation.rotateClockwise();
    final Operation b = TransformOperation.flip(FlipAxis.HORIZONTAL);
    final Operation c = TransformOperation.flip(FlipAxis.VERTICAL);

    engine.commit(a);
    engine.commit(b);
    engine.undo();
    engine.commit(c);

    assertThat(engine.operations()).containsExactly(AdjustmentSnapshot.IDENTITY, a, c);
    assertThat(engine.redo()).isFalse();
    assertThat(engine.state().transform()).isEqualTo(new NetTransform(90, false, true));
  }

  @Test
  @DisplayName("Should cancel two horizontal flips")
  void commit_TwoHorizontalFlips_Cancel() {
    engine.load(TestBuffers.labelled(3, 2));
    engine.commit(TransformOperation.rotateClockwise());
    final PixelBuffer before = engine.currentBuffer();

    engine.commit(TransformOperation.flip(FlipAxis.HORIZONTAL));
    assertThat(engine.currentBuffer()).isNotEqualTo(before);
    engine.commit(TransformOperation.flip(FlipAxis.HORIZONTAL));

    assertThat(engine.currentBuffer()).isEqualTo(before);
  }

  @Test
  @DisplayName("Should restore dimensions and pixel order after four clockwise rotations")
  void commit_FourRotations_Periodic() {
    final PixelBuffer base = TestBuffers.labelled(3, 2);
    engine.load(base);

    for (int i = 0; i < 4; i++) {
      engine.commit(TransformOperation.rotateClockwise());
      assertThat(engine.currentBuffer().getWidth()).isEqualTo(i % 2 == 0 ? 2 : 3);
    }

    assertThat(engine.currentBuffer()).isEqualTo(base);
  }

  @Test
  @DisplayName("Should apply only the latest adjustment snapshot, on top of the net geometry")
  void commit_SeveralSnapshots_LatestWins() {
    final PixelBuffer base = TestBuffers.of(2, 1, 10, 10, 10, 255, 250, 250, 250, 255);
    engine.load(base);

    engine.commit(new AdjustmentSnapshot(new AdjustmentTriple(0, 100, 100)));
    engine.commit(TransformOperation.flip(FlipAxis.HORIZONTAL));
    engine.commit(new AdjustmentSnapshot(new AdjustmentTriple(120, 100, 100)));

    assertThat(TestBuffers.samples(engine.currentBuffer()))
            .containsExactly(255, 255, 255, 255, 61, 61, 61, 255);
    assertThat(engine.state().adjustment()).isEqualTo(new AdjustmentTriple(120, 100, 100));

    engine.undo();

    assertThat(TestBuffers.samples(engine.currentBuffer()))
            .containsExactly(0, 0, 0, 255, 0, 0, 0, 255);
    assertThat(engine.operations()).hasSize(4);
  }

  @Test
  @DisplayName("Should derive undo/redo availability from the cursor")
  void state_TracksCursor() {
    engine.load(TestBuffers.labelled(2, 2));
    assertThat(engine.state().canUndo()).isFalse();
    assertThat(engine.state().canRedo()).isFalse();

    engine.commit(TransformOperation.rotateCounterClockwise());
    engine.undo();

    final HistoryState state = engine.state();
    assertThat(state.canUndo()).isFalse();
    assertThat(state.canRedo()).isTrue();
    assertThat(state.size()).isEqualTo(2);
    assertThat(state.transform()).isEqualTo(NetTransform.IDENTITY);
  }

  @Test
  @DisplayName("Should preview an adjustment without touching the log")
  void preview_DoesNotCommit() {
    final PixelBuffer base = TestBuffers.of(2, 1, 10, 10, 10, 255, 250, 250, 250, 255);
    engine.load(base);

    engine.preview(new AdjustmentTriple(120, 100, 100));

    assertThat(TestBuffers.samples(engine.currentBuffer()))
            .containsExactly(61, 61, 61, 255, 255, 255, 255, 255);
    assertThat(engine.operations()).hasSize(1);
    assertThat(engine.isPreviewing()).isTrue();
    assertThat(engine.state().adjustment()).isEqualTo(AdjustmentTriple.IDENTITY);

    engine.discardPreview();

    assertThat(engine.currentBuffer()).isEqualTo(base);
    assertThat(engine.isPreviewing()).isFalse();
  }

  @Test
  @DisplayName("Should start a fresh history when a new image is loaded")
  void load_Again_ResetsHistory() {
    engine.load(TestBuffers.labelled(3, 2));
    engine.commit(TransformOperation.rotateClockwise());
    engine.preview(new AdjustmentTriple(10, 10, 10));

    final PixelBuffer next = TestBuffers.labelled(2, 2);
    engine.load(next);

    assertThat(engine.currentBuffer()).isEqualTo(next);
    assertThat(engine.operations()).containsExactly(AdjustmentSnapshot.IDENTITY);
    assertThat(engine.isPreviewing()).isFalse();
    assertThat(engine.undo()).isFalse();
  }

  @Test
  @DisplayName("Should notify listeners with the new buffer and keep going if one fails")
  void listeners_NotifiedAfterEachChange() {
    final BufferListener failing = mock(BufferListener.class);
    doThrow(new IllegalStateException("boom")).when(failing).onBufferChanged(any(), any());
    final BufferListener listener = mock(BufferListener.class);
    engine.addBufferListener(failing);
    engine.addBufferListener(listener);

    engine.load(TestBuffers.labelled(3, 2));
    engine.commit(TransformOperation.rotateClockwise());
    engine.undo();
    engine.undo();

    final ArgumentCaptor<BufferChangedEvent> events = ArgumentCaptor.forClass(BufferChangedEvent.class);
    verify(listener, times(3)).onBufferChanged(any(PixelBuffer.class), events.capture());
    assertThat(events.getAllValues())
            .extracting(BufferChangedEvent::cause)
            .containsExactly(BufferChangedEvent.Cause.LOAD, BufferChangedEvent.Cause.COMMIT,
                    BufferChangedEvent.Cause.UNDO);
    assertThat(events.getAllValues().get(1).width()).isEqualTo(2);
    assertThat(events.getAllValues().get(1).height()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should leave history and display untouched when a commit fails during replay")
  void commit_ReplayFails_LeavesHistoryUnchanged() {
    final ColorAdjuster real = new DefaultColorAdjuster();
    final AtomicBoolean failing = new AtomicBoolean();
    final ColorAdjuster adjuster = (buffer, adjustment) -> {
      if (failing.get()) {
        throw new IllegalStateException("adjuster failed");
      }
      return real.apply(buffer, adjustment);
    };
    final HistoryEngine fragile = new HistoryEngine(adjuster);
    final BufferListener listener = mock(BufferListener.class);
    fragile.load(TestBuffers.labelled(3, 2));
    fragile.commit(TransformOperation.rotateClockwise());
    fragile.undo();
    fragile.addBufferListener(listener);
    final PixelBuffer before = fragile.currentBuffer();
    final HistoryState stateBefore = fragile.state();
    final List<Operation> opsBefore = fragile.operations();

    failing.set(true);
    assertThatThrownBy(() -> fragile.commit(TransformOperation.flip(FlipAxis.VERTICAL)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("adjuster failed");
    failing.set(false);

    assertThat(fragile.operations()).isEqualTo(opsBefore);
    assertThat(fragile.state()).isEqualTo(stateBefore);
    assertThat(fragile.currentBuffer()).isSameAs(before);
    verifyNoInteractions(listener);
    assertThat(fragile.redo()).isTrue();
    assertThat(fragile.state().transform()).isEqualTo(new NetTransform(90, false, false));
  }

  @Test
  @DisplayName("Should reject a net rotation that is not a quarter-turn multiple")
  void netTransform_OffGridRotation_Rejected() {
    assertThatThrownBy(() -> NetTransform.IDENTITY.rotatedBy(45))
            .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Rotate(45)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should stop notifying a listener once it is removed")
  void removeBufferListener_StopsNotifications() {
    final BufferListener listener = mock(BufferListener.class);
    engine.addBufferListener(listener);
    engine.load(TestBuffers.labelled(2, 2));

    engine.removeBufferListener(listener);
    engine.commit(TransformOperation.rotateClockwise());
    engine.undo();

    verify(listener, times(1)).onBufferChanged(any(PixelBuffer.class), any(BufferChangedEvent.class));
  }
}
