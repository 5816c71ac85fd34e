package dev.dylanburati.chaintable;

import java.lang.System.Logger.Level;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.ObjIntConsumer;

/**
 * Fixed-size hash table from strings to ints using separate chaining.
 *
 * The table never resizes, and it never fixes a hash function: every insertion,
 * removal and lookup is given the {@link HashFunction} that places the key. Using
 * different functions on the same table makes earlier entries unreachable.
 *
 * New entries are pushed onto the head of their chain without checking for an
 * existing entry with the same key. A duplicate shadows the older entries in
 * lookups until it is removed; {@link #remove} deletes one occurrence per call,
 * most recent first.
 *
 * After {@link #destroy()} every operation throws {@link IllegalStateException}.
 * Instances are not thread-safe.
 */
public class ChainedHashTable {
  private static final System.Logger LOGGER = System.getLogger(ChainedHashTable.class.getName());

  private final int size;
  // INVARIANT 0: buckets.length == size while live, null once destroyed
  private Entry[] buckets;
  // INVARIANT 1: total == sum of chain lengths over all buckets
  private int total;

  public ChainedHashTable(int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("expected positive size");
    }
    this.size = size;
    this.buckets = new Entry[size];
    this.total = 0;
  }

  /** Number of buckets. */
  public int size() {
    this.checkLive();
    return this.size;
  }

  /** Number of live entries, counting shadowed duplicates. */
  public int total() {
    this.checkLive();
    return this.total;
  }

  public boolean isEmpty() {
    return this.total() == 0;
  }

  public double loadFactor() {
    this.checkLive();
    return (double) this.total / this.size;
  }

  public boolean isDestroyed() {
    return this.buckets == null;
  }

  public void add(final HashFunction hashFunction, final String key, int value) {
    Objects.requireNonNull(key);
    int idx = this.bucketIndex(hashFunction, key);
    this.linkFirst(idx, new Entry(key, value));
  }

  /**
   * Removes the most recently added entry for {@code key}.
   *
   * @return false if no entry for {@code key} is in its bucket
   */
  public boolean remove(final HashFunction hashFunction, final String key) {
    Objects.requireNonNull(key);
    int idx = this.bucketIndex(hashFunction, key);
    Entry prev = null;
    for (Entry e = this.buckets[idx]; e != null; prev = e, e = e.next) {
      if (e.key.equals(key)) {
        this.unlink(idx, prev, e);
        LOGGER.log(Level.DEBUG, "Removed key {0} from bucket {1}", key, idx);
        return true;
      }
    }
    LOGGER.log(Level.DEBUG, "Key {0} not found in bucket {1}", key, idx);
    return false;
  }

  /** Value of the most recently added entry for {@code key}, or null. */
  public Integer get(final HashFunction hashFunction, final String key) {
    Entry e = this.find(hashFunction, key);
    return e != null ? e.value : null;
  }

  public int getOrDefault(final HashFunction hashFunction, final String key, int defaultValue) {
    Entry e = this.find(hashFunction, key);
    return e != null ? e.value : defaultValue;
  }

  public boolean containsKey(final HashFunction hashFunction, final String key) {
    return this.find(hashFunction, key) != null;
  }

  /** Drops every entry. The bucket count is unchanged and the table stays usable. */
  public void reset() {
    this.checkLive();
    Arrays.fill(this.buckets, null);
    // INVARIANT 1 upheld, every chain is empty
    this.total = 0;
    LOGGER.log(Level.TRACE, "Reset table of size {0}", this.size);
  }

  /** Drops every entry and the bucket array. The table is unusable afterwards. */
  public void destroy() {
    this.checkLive();
    Arrays.fill(this.buckets, null);
    this.buckets = null;
    this.total = 0;
    LOGGER.log(Level.TRACE, "Destroyed table of size {0}", this.size);
  }

  /** Sum over all buckets of {@code max(chainLength - 1, 0)}. */
  public int collisions() {
    this.checkLive();
    int count = 0;
    for (int i = 0; i < this.size; i++) {
      int len = this.chainLength(i);
      if (len > 1) {
        count += len - 1;
      }
    }
    return count;
  }

  public int chainLength(int index) {
    this.checkLive();
    Objects.checkIndex(index, this.size);
    int len = 0;
    for (Entry e = this.buckets[index]; e != null; e = e.next) {
      len++;
    }
    return len;
  }

  /** Visits every entry bucket by bucket, each chain from head to tail. */
  public void forEach(final ObjIntConsumer<String> action) {
    Objects.requireNonNull(action);
    this.checkLive();
    for (int i = 0; i < this.size; i++) {
      for (Entry e = this.buckets[i]; e != null; e = e.next) {
        action.accept(e.key, e.value);
      }
    }
  }

  /**
   * Human-readable dump of the table: a header line with size and total, then one
   * line per bucket listing its chain from head to tail.
   * <pre>
   * Hash table, size=2, total=1
   * array[0]-|
   * array[1]-&gt;(key=a,value=1)-|
   * </pre>
   */
  public String display() {
    this.checkLive();
    StringBuilder bldr = new StringBuilder();
    bldr.append("Hash table, size=").append(this.size)
      .append(", total=").append(this.total).append('\n');
    for (int i = 0; i < this.size; i++) {
      bldr.append("array[").append(i).append(']');
      for (Entry e = this.buckets[i]; e != null; e = e.next) {
        bldr.append("->(key=").append(e.key).append(",value=").append(e.value).append(')');
      }
      bldr.append("-|\n");
    }
    bldr.append('\n');
    return bldr.toString();
  }

  @Override
  public String toString() {
    if (this.isDestroyed()) {
      return "Hash table, size=" + this.size + ", destroyed";
    }
    return this.display();
  }

  private Entry find(final HashFunction hashFunction, final String key) {
    Objects.requireNonNull(key);
    int idx = this.bucketIndex(hashFunction, key);
    for (Entry e = this.buckets[idx]; e != null; e = e.next) {
      if (e.key.equals(key)) {
        return e;
      }
    }
    return null;
  }

  private int bucketIndex(final HashFunction hashFunction, final String key) {
    Objects.requireNonNull(hashFunction);
    this.checkLive();
    int idx = hashFunction.index(this.size, key);
    if (idx < 0 || idx >= this.size) {
      throw new IllegalStateException(
          String.format("hash function %s returned %d for size %d", hashFunction, idx, this.size));
    }
    return idx;
  }

  /** INVARIANT 1 upheld */
  private void linkFirst(int idx, final Entry entry) {
    entry.next = this.buckets[idx];
    this.buckets[idx] = entry;
    this.total++;
  }

  /** INVARIANT 1 upheld WHEN {@code prev} is null and {@code e} is the head, or {@code prev.next == e} */
  private void unlink(int idx, final Entry prev, final Entry e) {
    if (prev == null) {
      this.buckets[idx] = e.next;
    } else {
      prev.next = e.next;
    }
    e.next = null;
    this.total--;
  }

  private void checkLive() {
    if (this.buckets == null) {
      throw new IllegalStateException("table has been destroyed");
    }
  }
}
