package dev.dylanburati;

import dev.dylanburati.chaintable.ChainedHashTable;
import dev.dylanburati.chaintable.HashFunction;
import dev.dylanburati.chaintable.HashFunctions;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

public class App {
  private static final int DEFAULT_TABLE_SIZE = 1024;
  private static final int DEFAULT_WORD_COUNT = 10_000;
  private static final int DISPLAY_LIMIT = 16;

  private static int genWordId(double uniform) {
    // Prob of returning x is proportional to (x+3.7) ** -1.01
    // Similar distribution to English
    // cdf = 100 * const * [ (3.7) ** -0.01 - (x+3.7) ** -0.01 ], maximum of x is 2**27
    return (int) Math.pow(-0.01 * 15.768233989819334 * uniform + 0.9870018865063785, -100.0);
  }

  private static final double[] LENGTH_CDF = new double[]{
    2.55402880e-15, 3.73483535e-07, 2.06251620e-04, 4.60037401e-03,
    2.77018313e-02, 8.59221455e-02, 1.82026193e-01, 3.04121079e-01,
    4.34720260e-01, 5.58784740e-01, 6.67021855e-01, 7.55676596e-01,
    8.24886736e-01, 8.76934270e-01, 9.14931000e-01, 9.42014131e-01,
    9.60943967e-01, 9.73962076e-01, 9.82793792e-01, 9.88716864e-01,
    9.92650419e-01, 9.95240748e-01, 9.96934095e-01, 9.98034022e-01,
    9.98744497e-01, 9.99201152e-01, 9.99493382e-01, 9.99679661e-01,
    9.99797989e-01, 9.99872918e-01, 9.99920231e-01, 9.99950030e-01
  };

  private static int genWordLen(double uniform) {
    // pdf = const * exp(-(x - 8.5)**2 / 2x)
    int i = Arrays.binarySearch(LENGTH_CDF, uniform);
    // empty words are skipped by the caller
    return i >= 0 ? i : -i - 1;
  }

  /**
   * Generates up to {@code count} words from a fixed seed and returns their
   * occurrence counts. Only the distinct words end up in the hash table.
   */
  static Object2IntOpenHashMap<String> wordcount(int count) {
    byte[] alph = "pfscxkde".getBytes(StandardCharsets.US_ASCII);
    byte[] wbuf = new byte[32];
    Random r = new Random(0L);
    Object2IntOpenHashMap<String> counts = new Object2IntOpenHashMap<>();
    for (int i = 0; i < count; i++) {
      double uniform = r.nextDouble();
      int wlen = genWordLen(uniform);
      if (wlen == 0) {
        continue;
      }
      for (int wid = genWordId(uniform), j = 0; j < wlen; j++) {
        wbuf[j] = alph[(wid >> (3 * (j%9))) & 7];
      }
      String word = new String(wbuf, 0, wlen, StandardCharsets.US_ASCII);
      counts.addTo(word, 1);
    }
    return counts;
  }

  /** Loads every distinct word with its count, and prints the collision report. */
  static ChainedHashTable report(PrintStream out, HashFunction hashFunction, int tableSize,
      Object2IntOpenHashMap<String> counts) {
    ChainedHashTable table = new ChainedHashTable(tableSize);
    counts.object2IntEntrySet().fastForEach(e -> table.add(hashFunction, e.getKey(), e.getIntValue()));
    if (table.total() != counts.size()) {
      throw new IllegalStateException("expected total " + counts.size() + ", got " + table.total());
    }
    out.format("%-8s size=%d total=%d load=%.3f collisions=%d%n",
        hashFunction, table.size(), table.total(), table.loadFactor(), table.collisions());
    if (tableSize <= DISPLAY_LIMIT) {
      out.print(table.display());
    }
    return table;
  }

  private static int parsePositive(String arg, String name) {
    try {
      int v = Integer.parseInt(arg);
      if (v <= 0) {
        throw new IllegalArgumentException("expected positive " + name + ": " + arg);
      }
      return v;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("expected positive " + name + ": " + arg, e);
    }
  }

  public static void main(String[] args) {
    List<HashFunction> hashFunctions;
    switch (args.length > 0 ? args[0] : "") {
      case "":
      case "all":
        hashFunctions = HashFunctions.all();
        break;
      default:
        hashFunctions = List.of(HashFunctions.byName(args[0]));
        break;
    }
    int tableSize = args.length > 1 ? parsePositive(args[1], "tableSize") : DEFAULT_TABLE_SIZE;
    int wordCount = args.length > 2 ? parsePositive(args[2], "wordCount") : DEFAULT_WORD_COUNT;

    Object2IntOpenHashMap<String> counts = wordcount(wordCount);
    System.out.println("Distinct words: " + counts.size());
    for (HashFunction hf : hashFunctions) {
      report(System.out, hf, tableSize, counts).destroy();
    }
  }
}
