package io.dataproc.serviceclient;

import static org.junit.Assert.*;

import com.uber.m3.tally.Buckets;
import com.uber.m3.tally.Capabilities;
import com.uber.m3.tally.CapableOf;
import com.uber.m3.tally.StatsReporter;
import com.uber.m3.util.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/** Keeps reported counters and timer counts, keyed by name and sorted tags. */
final class RecordingStatsReporter implements StatsReporter {

  private final Map<String, Long> counters = new HashMap<>();
  private final Map<String, Integer> timers = new HashMap<>();

  synchronized void assertCounter(String name, Map<String, String> tags, long expected) {
    String key = key(name, tags);
    Long actual = counters.get(key);
    assertNotNull("no counter " + key + " in " + counters.keySet(), actual);
    assertEquals(key, expected, actual.longValue());
  }

  synchronized void assertNoCounter(String name, Map<String, String> tags) {
    String key = key(name, tags);
    assertFalse("unexpected counter " + key, counters.containsKey(key));
  }

  synchronized void assertTimerRecorded(String name, Map<String, String> tags) {
    String key = key(name, tags);
    assertTrue("no timer " + key + " in " + timers.keySet(), timers.containsKey(key));
  }

  @Override
  public synchronized void reportCounter(String name, Map<String, String> tags, long value) {
    counters.merge(key(name, tags), value, Long::sum);
  }

  @Override
  public void reportGauge(String name, Map<String, String> tags, double value) {}

  @Override
  public synchronized void reportTimer(String name, Map<String, String> tags, Duration interval) {
    timers.merge(key(name, tags), 1, Integer::sum);
  }

  @Override
  public void reportHistogramValueSamples(
      String name,
      Map<String, String> tags,
      Buckets buckets,
      double bucketLowerBound,
      double bucketUpperBound,
      long samples) {
    throw new UnsupportedOperationException();
  }

  @Override
  public void reportHistogramDurationSamples(
      String name,
      Map<String, String> tags,
      Buckets buckets,
      Duration bucketLowerBound,
      Duration bucketUpperBound,
      long samples) {
    throw new UnsupportedOperationException();
  }

  @Override
  public Capabilities capabilities() {
    return CapableOf.REPORTING;
  }

  @Override
  public void flush() {}

  @Override
  public void close() {}

  private static String key(String name, Map<String, String> tags) {
    return name + " " + new TreeMap<>(tags);
  }
}
