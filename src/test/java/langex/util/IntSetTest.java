package langex.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class IntSetTest {

  @Test
  void orderAndDuplicatesDoNotMatter() {
    final IntSet set = IntSet.of(3, 1, 2, 3);
    assertEquals(IntSet.of(1, 2, 3), set);
    assertArrayEquals(new int[] { 1, 2, 3 }, set.stream().toArray());
    assertEquals(IntSet.of(1, 2, 3).hashCode(), set.hashCode());
    assertEquals("{1,2,3}", set.toString());
  }

  @Test
  void extension() {
    final IntSet set = IntSet.of(5, 1);
    final IntSet extended = set.with(3);
    assertEquals(IntSet.of(1, 3, 5), extended);
    assertEquals(IntSet.of(1, 5), set);
    assertSame(extended, extended.with(5));
    assertEquals(IntSet.of(0), IntSet.EMPTY.with(0));
  }

  @Test
  void emptySet() {
    assertTrue(IntSet.EMPTY.isEmpty());
    assertEquals(IntSet.EMPTY, IntSet.of());
    assertEquals("{}", IntSet.EMPTY.toString());
  }

  @Test
  void usableAsHashKey() {
    final Set<IntSet> seen = new HashSet<>();
    seen.add(IntSet.of(1, 2));
    assertTrue(seen.contains(IntSet.of(2).with(1)));
    assertFalse(seen.contains(IntSet.of(1)));
  }
}
