package langex.util;

import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Immutable set of integers.
 *
 * <p>The elements are kept sorted and distinct, so two sets holding the same
 * integers are {@code equals} and hash identically no matter the order in
 * which those integers were supplied. This makes the set usable as the key of
 * a powerset state.
 */
public final class IntSet {

  public static final IntSet EMPTY = new IntSet(new int[0]);

  // Sorted and distinct elements
  private final int[] elements;

  private IntSet(int[] sortedDistinct) {
    this.elements = sortedDistinct;
  }

  public static IntSet of(int... elems) {
    return new IntSet(Arrays.stream(elems).sorted().distinct().toArray());
  }

  public IntStream stream() {
    return Arrays.stream(elements);
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  /**
   * Set with one extra element.
   *
   * @param element integer to add
   * @return this set if the element was already present, else a new set
   */
  public IntSet with(int element) {
    final int position = Arrays.binarySearch(elements, element);
    if (position >= 0) {
      return this;
    }

    final int insertAt = -position - 1;
    final int[] extended = new int[elements.length + 1];
    System.arraycopy(elements, 0, extended, 0, insertAt);
    extended[insertAt] = element;
    System.arraycopy(elements, insertAt, extended, insertAt + 1, elements.length - insertAt);
    return new IntSet(extended);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof IntSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((IntSet) obj).elements);
    }
  }

  @Override
  public String toString() {
    return Arrays
      .stream(elements)
      .mapToObj(Integer::toString)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
