package dev.dylanburati.chaintable;

import java.util.Objects;

/**
 * Polynomial string hash followed by Knuth's multiplicative method: the
 * fractional part of {@code h * A} selects the bucket, where {@code A} is the
 * fractional part of the golden ratio.
 */
/* package-private */ class GoldenRatioHashFunction implements HashFunction {
  static final double GOLDEN_RATIO_FRACTION = 0.6180339887;
  private static GoldenRatioHashFunction instance = null;

  private GoldenRatioHashFunction() {}

  static GoldenRatioHashFunction instance() {
    if (instance == null) {
      instance = new GoldenRatioHashFunction();
    }
    return instance;
  }

  @Override
  public int index(int tableSize, String key) {
    HashFunctions.checkTableSize(tableSize);
    Objects.requireNonNull(key);
    int h = 0;
    for (int i = 0; i < key.length(); i++) {
      h = 31 * h + key.charAt(i);
    }
    double product = Integer.toUnsignedLong(h) * GOLDEN_RATIO_FRACTION;
    double fraction = product - Math.floor(product);
    // fraction < 1, but fraction * tableSize may still round up to tableSize
    return Math.min((int) (fraction * tableSize), tableSize - 1);
  }

  @Override
  public String toString() {
    return "improved";
  }
}
