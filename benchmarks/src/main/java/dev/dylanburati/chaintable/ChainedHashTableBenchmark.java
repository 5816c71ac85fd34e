package dev.dylanburati.chaintable;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

@State(Scope.Benchmark)
public class ChainedHashTableBenchmark {
  @Param({"naive", "improved", "djb2"})
  public String hashFunctionName;

  @Param({"1024", "65536"})
  public int tableSize;

  private HashFunction hashFunction;
  private String[] words;

  @Setup
  public void setup() {
    this.hashFunction = HashFunctions.byName(this.hashFunctionName);
    byte[] alph = "pfscxkde".getBytes(StandardCharsets.US_ASCII);
    Random r = new Random(0L);
    this.words = new String[20_000];
    for (int i = 0; i < this.words.length; i++) {
      char[] wbuf = new char[4 + r.nextInt(9)];
      for (int j = 0; j < wbuf.length; j++) {
        wbuf[j] = (char) alph[r.nextInt(alph.length)];
      }
      this.words[i] = new String(wbuf);
    }
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void addThenRemove(Blackhole bh) {
    ChainedHashTable t = new ChainedHashTable(this.tableSize);
    for (int i = 0; i < this.words.length; i++) {
      t.add(this.hashFunction, this.words[i], i);
    }
    bh.consume(t.collisions());
    for (String w : this.words) {
      bh.consume(t.remove(this.hashFunction, w));
    }
  }

  @Benchmark
  @BenchmarkMode(Mode.AverageTime)
  public void index(Blackhole bh) {
    for (String w : this.words) {
      bh.consume(this.hashFunction.index(this.tableSize, w));
    }
  }
}
