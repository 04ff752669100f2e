package relay.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a list into consecutive chunks of a bounded size.
 */
final class Chunks {

  private Chunks() {}

  /**
   * Each chunk is filled to {@code size} before the next one starts; the last may be smaller.
   *
   * @param items source list
   * @param size  maximum chunk length, &gt; 0
   * @return unmodifiable chunks in source order, empty for an empty source
   */
  static <T> List<List<T>> of(List<T> items, int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be > 0, got: " + size);
    }
    if (items.isEmpty()) {
      return List.of();
    }
    List<List<T>> chunks = new ArrayList<>((items.size() + size - 1) / size);
    for (int from = 0; from < items.size(); from += size) {
      int to = Math.min(items.size(), from + size);
      chunks.add(Collections.unmodifiableList(new ArrayList<>(items.subList(from, to))));
    }
    return chunks;
  }
}
