package dev.dylanburati.chaintable;

/**
 * Maps a key to a bucket of a {@link ChainedHashTable}. Implementations must be
 * deterministic and return an index in {@code [0, tableSize)} for every key.
 *
 * The table does not own a hash function; one is passed to each operation, so
 * the caller must use the same function for every call on a given table.
 */
@FunctionalInterface
public interface HashFunction {
  int index(int tableSize, String key);
}
