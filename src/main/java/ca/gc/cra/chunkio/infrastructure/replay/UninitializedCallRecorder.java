package ca.gc.cra.chunkio.infrastructure.replay;

import java.io.OutputStream;
import java.util.function.Supplier;

/**
 * Recorder with no mode selected; every operation fails with {@link RecorderNotConfiguredException}.
 *
 * @since 0.1.0
 */
public final class UninitializedCallRecorder implements CallRecorder {
  static final UninitializedCallRecorder INSTANCE = new UninitializedCallRecorder();

  private UninitializedCallRecorder() {}

  @Override
  public Object get(String callSite, Supplier<?> supplier) {
    throw notConfigured("get");
  }

  @Override
  public void nextPart() {
    throw notConfigured("nextPart");
  }

  @Override
  public OutputStream output() {
    throw notConfigured("output");
  }

  @Override
  public void stop() {
    throw notConfigured("stop");
  }

  private static RecorderNotConfiguredException notConfigured(String operation) {
    return new RecorderNotConfiguredException(
        "Recorder is not in record or playback mode; cannot call " + operation);
  }
}
