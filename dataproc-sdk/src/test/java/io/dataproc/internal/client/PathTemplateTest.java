package io.dataproc.internal.client;

import static org.junit.Assert.*;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

public class PathTemplateTest {
  private final PathTemplate template =
      PathTemplate.of("projects/{project}/locations/{location}/clusters/{cluster}");

  @Test
  public void testInstantiate() {
    assertEquals(
        "projects/squid/locations/clam/clusters/whelk",
        template.instantiate("squid", "clam", "whelk"));
  }

  @Test
  public void testMatch() {
    assertEquals(
        ImmutableMap.of("project", "squid", "location", "clam", "cluster", "whelk"),
        template.match("projects/squid/locations/clam/clusters/whelk"));
  }

  @Test
  public void testMismatchGivesEmptyMap() {
    assertTrue(template.match("projects/squid/regions/clam/clusters/whelk").isEmpty());
    assertTrue(template.match("projects/squid/locations/clam/clusters/").isEmpty());
    assertTrue(template.match("prefix/projects/squid/locations/clam/clusters/whelk").isEmpty());
    assertTrue(template.match(null).isEmpty());
  }

  @Test
  public void testLiteralTextIsNotARegex() {
    PathTemplate dotted = PathTemplate.of("a.b/{x}");

    assertEquals(ImmutableMap.of("x", "y"), dotted.match("a.b/y"));
    assertTrue(dotted.match("aXb/y").isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongNumberOfValues() {
    template.instantiate("squid", "clam");
  }
}
