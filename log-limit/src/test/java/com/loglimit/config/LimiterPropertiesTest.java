package com.loglimit.config;

import org.junit.Test;

import java.io.File;
import java.io.FileWriter;
import java.io.Writer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class LimiterPropertiesTest {

  @Test
  public void testTypedAccessWithDefaultsAndClamping() {
    LimiterProperties properties = new LimiterProperties();
    properties.setProperty("threshold", " 42 ");
    properties.setProperty("negative", "-5");
    properties.setProperty("huge", "1e12");
    properties.setProperty("flag", "TRUE ");

    assertEquals(42, properties.getNumber("threshold", 7).intValue());
    assertEquals(7, properties.getNumber("missing", 7).intValue());
    assertEquals(0, properties.getNumber("negative", 1, 0, null).intValue());
    assertEquals(100L, properties.getNumber("huge", 1, 0, 100).longValue());
    assertTrue(properties.getBoolean("flag", false));
    assertFalse(properties.getBoolean("missing", false));
    assertEquals("fallback", properties.getString("missing", "fallback"));
    assertNull(properties.getNumber("missing", null));
  }

  @Test(expected = NumberFormatException.class)
  public void testMalformedNumber() {
    LimiterProperties properties = new LimiterProperties();
    properties.setProperty("threshold", "lots");
    properties.getNumber("threshold", 1);
  }

  @Test
  public void testLoadFromFile() throws Exception {
    File file = File.createTempFile("limiter", ".properties");
    file.deleteOnExit();
    try (Writer writer = new FileWriter(file)) {
      writer.write("defaultThreshold=3\n");
    }
    assertEquals(3, new LimiterProperties(file.getAbsolutePath()).
        getNumber("defaultThreshold", 1).intValue());
  }

  @Test
  public void testLoadFromClasspath() throws Exception {
    LimiterProperties properties = LimiterProperties.fromClasspath("log-limit.properties");
    assertEquals(25, properties.getNumber("defaultThreshold", 1).intValue());
    assertNull(LimiterProperties.fromClasspath("no-such-resource.properties"));
  }
}
