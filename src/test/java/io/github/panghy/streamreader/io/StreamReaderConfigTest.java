package io.github.panghy.streamreader.io;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamReaderConfigTest {

  @Test
  void testDefaultConfig() {
    StreamReaderConfig config = StreamReaderConfig.DEFAULT;

    assertEquals(4096, config.getSkipBufferSize());
    assertFalse(config.isDebugLogging());
  }

  @Test
  void testCustomConfig() {
    StreamReaderConfig config = new StreamReaderConfig(16, true);

    assertEquals(16, config.getSkipBufferSize());
    assertTrue(config.isDebugLogging());
  }

  @Test
  void testInvalidSkipBufferSize() {
    assertThrows(IllegalArgumentException.class, () -> new StreamReaderConfig(0, false));
    assertThrows(IllegalArgumentException.class, () -> StreamReaderConfig.builder().skipBufferSize(-1).build());
  }

  @Test
  void testBuilderPattern() {
    StreamReaderConfig config = StreamReaderConfig.builder()
        .skipBufferSize(128)
        .skipBufferSize(256) // last value wins
        .debugLogging(true)
        .build();

    assertEquals(256, config.getSkipBufferSize());
    assertTrue(config.isDebugLogging());
  }

  @Test
  void testBuilderPatternWithDefaults() {
    StreamReaderConfig config = StreamReaderConfig.builder().build();

    assertEquals(StreamReaderConfig.DEFAULT.getSkipBufferSize(), config.getSkipBufferSize());
    assertFalse(config.isDebugLogging());
  }
}
