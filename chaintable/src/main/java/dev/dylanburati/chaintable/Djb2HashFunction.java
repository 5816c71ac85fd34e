package dev.dylanburati.chaintable;

import java.util.Objects;

// http://www.cse.yorku.ca/~oz/hash.html
/* package-private */ class Djb2HashFunction implements HashFunction {
  private static Djb2HashFunction instance = null;

  private Djb2HashFunction() {}

  static Djb2HashFunction instance() {
    if (instance == null) {
      instance = new Djb2HashFunction();
    }
    return instance;
  }

  @Override
  public int index(int tableSize, String key) {
    HashFunctions.checkTableSize(tableSize);
    Objects.requireNonNull(key);
    long h = 5381;
    for (int i = 0; i < key.length(); i++) {
      h = ((h << 5) + h) + key.charAt(i);
    }
    return (int) Long.remainderUnsigned(h, tableSize);
  }

  @Override
  public String toString() {
    return "djb2";
  }
}
