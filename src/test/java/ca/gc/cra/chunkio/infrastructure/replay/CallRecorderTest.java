package ca.gc.cra.chunkio.infrastructure.replay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chunkio.domain.chunk.FlushMode;
import ca.gc.cra.chunkio.infrastructure.protocol.chunked.ChunkedRecordWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CallRecorderTest {
  @TempDir Path tempDir;

  @Test
  void uninitializedRecorderRejectsEveryOperation() {
    CallRecorder recorder = CallRecorder.uninitialized();

    assertThrows(RecorderNotConfiguredException.class, () -> recorder.get("x", () -> 1));
    assertThrows(RecorderNotConfiguredException.class, recorder::nextPart);
    assertThrows(RecorderNotConfiguredException.class, recorder::output);
    assertThrows(RecorderNotConfiguredException.class, recorder::stop);
  }

  @Test
  void playbackReproducesRecordedRun() throws IOException {
    Path path = tempDir.resolve("scenario.recording");
    Random random = new Random(7);

    LiveCallRecorder live = CallRecorders.record(path);
    runScenario(live, () -> random.nextInt(1000));
    live.stop();
    assertTrue(Files.size(path) > 0);
    assertEquals(2, live.partCount());

    ReplayCallRecorder replay = CallRecorders.playback(path);
    runScenario(replay, () -> {
      throw new AssertionError("suppliers are not invoked during playback");
    });
    replay.stop();
  }

  @Test
  void playbackDetectsDivergingOutput() throws IOException {
    Path path = tempDir.resolve("diverging.recording");
    LiveCallRecorder live = CallRecorders.record(path);
    runScenario(live, () -> 5);
    live.stop();

    ReplayCallRecorder replay = CallRecorders.playback(path);
    runScenario(replay, () -> 0);
    replay.output().write('!');

    RecordingMismatchException mismatch = assertThrows(RecordingMismatchException.class, replay::stop);
    assertEquals(mismatch.expectedLength() + 1, mismatch.actualLength());
    assertEquals(mismatch.expectedLength(), mismatch.firstDifference());
  }

  @Test
  void playbackRejectsExhaustedCallSite() throws IOException {
    Path path = tempDir.resolve("short.recording");
    LiveCallRecorder live = CallRecorders.record(path);
    live.get("value", () -> 1);
    live.stop();

    ReplayCallRecorder replay = CallRecorders.playback(path);
    assertEquals(1L, replay.get("value", () -> 0));

    assertThrows(IllegalStateException.class, () -> replay.get("value", () -> 0));
    assertThrows(IllegalStateException.class, replay::nextPart);
  }

  private static void runScenario(CallRecorder recorder, Supplier<Integer> source)
      throws IOException {
    ChunkedRecordWriter writer = new ChunkedRecordWriter(recorder.output(), 4);
    for (int part = 0; part < 2; part++) {
      if (part > 0) {
        recorder.nextPart();
      }
      for (int i = 0; i < 6; i++) {
        Object value = recorder.get("random_integer", source);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("_serial", part * 6 + i);
        record.put("random_integer", value);
        writer.writeRecord(record);
      }
      writer.flush(part == 1 ? FlushMode.FINISHED : FlushMode.PARTIAL);
    }
  }
}
