package relay;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Record factories for tests. */
public final class Records {

  private Records() {}

  public static List<TelemetryRecord> events(int count) {
    List<TelemetryRecord> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      out.add(TelemetryRecord.event(Map.of("event", "tool_used", "seq", i)));
    }
    return out;
  }

  public static TelemetryRecord snapshot(String hash, String name) {
    return TelemetryRecord.snapshot(hash, Map.of("name", name));
  }
}
