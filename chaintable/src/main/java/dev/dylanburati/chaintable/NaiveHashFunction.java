package dev.dylanburati.chaintable;

import java.util.Objects;

/* package-private */ class NaiveHashFunction implements HashFunction {
  private static NaiveHashFunction instance = null;

  private NaiveHashFunction() {}

  static NaiveHashFunction instance() {
    if (instance == null) {
      instance = new NaiveHashFunction();
    }
    return instance;
  }

  @Override
  public int index(int tableSize, String key) {
    HashFunctions.checkTableSize(tableSize);
    Objects.requireNonNull(key);
    // an empty key behaves like a lone terminator
    int first = key.isEmpty() ? 0 : key.codePointAt(0);
    return first % tableSize;
  }

  @Override
  public String toString() {
    return "naive";
  }
}
