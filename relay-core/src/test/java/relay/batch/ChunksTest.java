package relay.batch;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChunksTest {

  @Test
  void lastChunkHoldsRemainder() {
    List<List<Integer>> chunks = Chunks.of(List.of(1, 2, 3, 4, 5), 2);

    assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), chunks);
  }

  @Test
  void emptySourceYieldsNoChunks() {
    assertTrue(Chunks.of(List.of(), 10).isEmpty());
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> Chunks.of(List.of(1), 0));
  }
}
