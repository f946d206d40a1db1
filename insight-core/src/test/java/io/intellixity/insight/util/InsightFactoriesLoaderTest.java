package io.intellixity.insight.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class InsightFactoriesLoaderTest {
  public interface Probe {
    String name();
  }

  public static final class FirstProbe implements Probe {
    @Override public String name() { return "first"; }
  }

  public static final class SecondProbe implements Probe {
    @Override public String name() { return "second"; }
  }

  @Test
  void loadsCommaSeparatedImplementationsInOrderWithoutDuplicates() {
    List<Probe> probes = InsightFactoriesLoader.load(Probe.class);
    assertEquals(List.of("first", "second"), probes.stream().map(Probe::name).toList());
  }

  @Test
  void unknownSpiYieldsEmptyList() {
    assertTrue(InsightFactoriesLoader.load(Runnable.class).isEmpty());
  }
}
