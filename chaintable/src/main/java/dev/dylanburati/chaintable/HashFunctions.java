package dev.dylanburati.chaintable;

import java.util.List;
import java.util.Locale;

/**
 * Factory for the built-in {@link HashFunction} strategies.
 *
 * <ul>
 * <li> {@link #naive()}: first character modulo the table size. Keys sharing a first
 *   character always collide; kept as a baseline.
 * <li> {@link #improved()}: {@code h = 31 * h + c}, then multiplicative hashing with
 *   the golden ratio fraction {@code 0.6180339887}.
 * <li> {@link #djb2()}: {@code h = 33 * h + c} from a seed of 5381 in 64-bit arithmetic,
 *   then unsigned {@code h mod tableSize}.
 * </ul>
 */
public final class HashFunctions {
  private HashFunctions() {}

  public static HashFunction naive() {
    return NaiveHashFunction.instance();
  }

  public static HashFunction improved() {
    return GoldenRatioHashFunction.instance();
  }

  public static HashFunction djb2() {
    return Djb2HashFunction.instance();
  }

  public static List<HashFunction> all() {
    return List.of(naive(), improved(), djb2());
  }

  /** Resolves {@code naive}, {@code improved} or {@code djb2}, ignoring case. */
  public static HashFunction byName(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "naive":
        return naive();
      case "improved":
        return improved();
      case "djb2":
        return djb2();
      default:
        throw new IllegalArgumentException("unknown hash function: " + name);
    }
  }

  static void checkTableSize(int tableSize) {
    if (tableSize <= 0) {
      throw new IllegalArgumentException("expected positive tableSize");
    }
  }
}
