package com.consullo.jobs.pipe;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.apache.commons.lang3.Validate;

/**
 * Stream reader configuration values.
 *
 * @param pollInterval time the worker sleeps between read cycles
 * @param charset charset used to decode pipe bytes into text chunks
 * @param bufferSize size of the byte buffer used for each read call
 * @param threadName name given to the worker thread
 * @param blockingReads true for pipes whose {@code available()} never reports pending bytes (pty4j streams);
 *     the worker then blocks in {@code read} and {@link StreamReader#stop()} closes the pipe to release it
 * @since 1.0
 */
public record StreamReaderConfig(
    Duration pollInterval,
    Charset charset,
    int bufferSize,
    String threadName,
    boolean blockingReads) {

  /** Default sleep between read cycles. */
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(120L);

  /** Default read buffer size in bytes. */
  public static final int DEFAULT_BUFFER_SIZE = 8192;

  public StreamReaderConfig {
    Validate.notNull(pollInterval, "pollInterval must not be null");
    Validate.isTrue(!pollInterval.isNegative(), "pollInterval must not be negative");
    Validate.notNull(charset, "charset must not be null");
    Validate.isTrue(bufferSize > 0, "bufferSize must be positive");
    Validate.notBlank(threadName, "threadName must not be blank");
  }

  /**
   * Creates a configuration for pipes that report pending bytes through {@code available()}.
   *
   * @param pollInterval time the worker sleeps between read cycles
   * @param charset decoding charset
   * @param bufferSize read buffer size
   * @param threadName worker thread name
   */
  public StreamReaderConfig(
      final Duration pollInterval,
      final Charset charset,
      final int bufferSize,
      final String threadName) {
    this(pollInterval, charset, bufferSize, threadName, false);
  }

  /**
   * Creates a configuration with default interval, UTF-8 decoding and default buffer size.
   *
   * @param threadName worker thread name
   * @return configuration
   */
  public static StreamReaderConfig defaults(final String threadName) {
    return new StreamReaderConfig(DEFAULT_POLL_INTERVAL, StandardCharsets.UTF_8, DEFAULT_BUFFER_SIZE, threadName);
  }

  /**
   * Returns a copy of this configuration with another worker thread name.
   *
   * @param name worker thread name
   * @return configuration
   */
  public StreamReaderConfig withThreadName(final String name) {
    return new StreamReaderConfig(this.pollInterval, this.charset, this.bufferSize, name, this.blockingReads);
  }

  public StreamReaderConfig withBlockingReads(final boolean blocking) {
    return new StreamReaderConfig(this.pollInterval, this.charset, this.bufferSize, this.threadName, blocking);
  }
}
