package dev.dylanburati.chaintable;

/* package-private */ final class Entry {
  final String key;
  int value;
  // owned by this entry, never shared with another chain
  Entry next;

  Entry(final String key, int value) {
    this.key = key;
    this.value = value;
    this.next = null;
  }
}
