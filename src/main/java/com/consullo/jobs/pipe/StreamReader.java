package com.consullo.jobs.pipe;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background reader that drains one pipe of a child process and stages the most recent chunk for a
 * non-blocking consumer.
 *
 * <p>
 * Buffering model:
 * <ul>
 * <li>a single staged chunk, handed to the consumer by {@link #read()};</li>
 * <li>an overflow list collecting chunks that arrive while the staged chunk is still unconsumed;</li>
 * <li>overflow is concatenated, in arrival order, in front of the next chunk that gets staged.</li>
 * </ul>
 * Memory stays bounded by what the consumer has not read yet and no byte is ever discarded.
 * </p>
 *
 * <p>
 * Threading: the worker thread is the only producer, one host context is the only consumer. The staged
 * chunk and the overflow list are guarded by a private monitor.
 * </p>
 *
 * <p>
 * Read modes: by default the worker only reads what {@link InputStream#available()} reports, then sleeps for
 * the poll interval. Pseudo-terminal streams always report zero, so with
 * {@link StreamReaderConfig#blockingReads()} the worker blocks in {@code read} instead and {@link #stop()}
 * closes the pipe to release it.
 * </p>
 *
 * @since 1.0
 */
public final class StreamReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamReader.class);

  private final InputStream source;
  private final StreamReaderConfig config;
  private final CharsetDecoder decoder;

  private final Object lock = new Object();
  private String stagedChunk;
  private final List<String> overflow = new ArrayList<>();

  private volatile boolean stopRequested;
  private volatile Thread worker;

  // Worker-thread state
  private final byte[] buffer;
  private ByteBuffer undecoded = ByteBuffer.allocate(0);
  private boolean endOfStream;

  /**
   * Creates a reader over the given pipe. Reading starts with {@link #start()}.
   *
   * @param source pipe to read; closed by the worker when reading stops
   * @param config reader configuration
   */
  public StreamReader(final InputStream source, final StreamReaderConfig config) {
    Validate.notNull(source, "source must not be null");
    Validate.notNull(config, "config must not be null");
    this.source = source;
    this.config = config;
    this.buffer = new byte[config.bufferSize()];
    this.decoder = config.charset().newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
  }

  /**
   * Starts the read loop on a dedicated daemon thread. Returns immediately.
   *
   * @throws IllegalStateException if the reader was already started
   */
  public void start() {
    synchronized (lock) {
      if (worker != null) {
        throw new IllegalStateException("StreamReader '" + config.threadName() + "' already started.");
      }
      final Thread t = new Thread(this::runLoop, config.threadName());
      t.setDaemon(true);
      worker = t;
    }
    worker.start();
  }

  /**
   * Returns true if a chunk is staged and not yet consumed.
   *
   * @return true if {@link #read()} would return a non-empty chunk
   */
  public boolean hasData() {
    synchronized (lock) {
      return stagedChunk != null;
    }
  }

  /**
   * Returns and clears the staged chunk. Never blocks.
   *
   * @return staged chunk, or an empty string if nothing new arrived since the last call
   */
  public String read() {
    synchronized (lock) {
      final String chunk = stagedChunk;
      stagedChunk = null;
      // Overflow moves up here as well, otherwise it would be stranded once the worker has exited.
      if (!overflow.isEmpty()) {
        stagedChunk = String.join("", overflow);
        overflow.clear();
      }
      return chunk != null ? chunk : "";
    }
  }

  /**
   * Requests the worker to stop. The worker finishes its current cycle, closes the pipe and exits; this call
   * does not wait for that. In blocking mode the pipe is closed right away, since the worker may be parked in
   * a read that only returns once the pipe is closed; bytes not yet read are then lost.
   */
  public void stop() {
    stopRequested = true;
    if (config.blockingReads()) {
      closeSource();
    }
  }

  public boolean isStopRequested() {
    return stopRequested;
  }

  /**
   * Returns true while the worker thread is running.
   *
   * @return worker liveness
   */
  public boolean isAlive() {
    final Thread t = worker;
    return t != null && t.isAlive();
  }

  /**
   * Waits for the worker thread to exit.
   *
   * @param millis maximum time to wait
   * @throws InterruptedException if interrupted while waiting
   */
  public void join(final long millis) throws InterruptedException {
    final Thread t = worker;
    if (t != null) {
      t.join(millis);
    }
  }

  private void runLoop() {
    LOGGER.debug("{}: read loop started", config.threadName());
    try {
      if (config.blockingReads()) {
        runBlocking();
      } else {
        runPolling();
      }
    } finally {
      closeSource();
      LOGGER.debug("{}: read loop exited", config.threadName());
    }
  }

  private void runPolling() {
    while (true) {
      // Runs once more after stop() so bytes already sitting in the pipe are staged before closing.
      readCycle();
      if (stopRequested || (endOfStream && !hasOverflow())) {
        break;
      }
      sleepQuietly();
    }
  }

  private void runBlocking() {
    while (!stopRequested && !endOfStream) {
      final int n;
      try {
        n = source.read(buffer, 0, buffer.length);
      } catch (final IOException e) {
        if (!stopRequested) {
          LOGGER.debug("{}: read failed, no further reads: {}", config.threadName(), e.getMessage());
        }
        endOfStream = true;
        break;
      }
      final String chunk;
      if (n < 0) {
        endOfStream = true;
        chunk = decode(0, true);
      } else {
        chunk = decode(n, false);
      }
      if (!chunk.isEmpty()) {
        stage(chunk);
      }
      promoteOverflow();
    }
    promoteOverflow();
  }

  private void readCycle() {
    if (!endOfStream) {
      final String chunk;
      try {
        chunk = drainAvailable();
      } catch (final IOException e) {
        LOGGER.debug("{}: read failed, no further reads: {}", config.threadName(), e.getMessage());
        endOfStream = true;
        promoteOverflow();
        return;
      }
      if (!chunk.isEmpty()) {
        stage(chunk);
      }
    }
    promoteOverflow();
  }

  /**
   * Reads every byte the pipe reports as available and decodes it. Bytes of an incomplete multi-byte character
   * are kept for the next cycle.
   */
  private String drainAvailable() throws IOException {
    final StringBuilder text = new StringBuilder();
    while (true) {
      final int available = source.available();
      if (available <= 0) {
        break;
      }
      final int n = source.read(buffer, 0, Math.min(available, buffer.length));
      if (n < 0) {
        endOfStream = true;
        break;
      }
      if (n == 0) {
        break;
      }
      text.append(decode(n, false));
    }
    if (endOfStream) {
      text.append(decode(0, true));
    }
    return text.toString();
  }

  private String decode(final int length, final boolean endOfInput) {
    final ByteBuffer in = ByteBuffer.allocate(undecoded.remaining() + length);
    in.put(undecoded);
    in.put(buffer, 0, length);
    in.flip();

    final CharBuffer out = CharBuffer.allocate((int) Math.ceil(in.remaining() * (double) decoder.maxCharsPerByte()) + 1);
    decoder.decode(in, out, endOfInput);
    if (endOfInput) {
      decoder.flush(out);
      decoder.reset();
    }
    undecoded = in.slice();
    out.flip();
    return out.toString();
  }

  /**
   * Places a freshly read chunk into the slot, prefixed by queued overflow, or queues it if the slot is taken.
   */
  private void stage(final String chunk) {
    synchronized (lock) {
      if (stagedChunk == null) {
        if (overflow.isEmpty()) {
          stagedChunk = chunk;
        } else {
          overflow.add(chunk);
          stagedChunk = String.join("", overflow);
          overflow.clear();
        }
      } else {
        overflow.add(chunk);
      }
    }
  }

  /**
   * Moves queued overflow into a free slot even when no new chunk arrived, so queued output is not held back
   * once the child goes quiet.
   */
  private void promoteOverflow() {
    synchronized (lock) {
      if (stagedChunk == null && !overflow.isEmpty()) {
        stagedChunk = String.join("", overflow);
        overflow.clear();
      }
    }
  }

  private boolean hasOverflow() {
    synchronized (lock) {
      return !overflow.isEmpty();
    }
  }

  private void sleepQuietly() {
    final long millis = config.pollInterval().toMillis();
    if (millis <= 0L) {
      Thread.onSpinWait();
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      stopRequested = true;
    }
  }

  private void closeSource() {
    try {
      source.close();
    } catch (final IOException e) {
      LOGGER.debug("{}: closing pipe failed: {}", config.threadName(), e.getMessage());
    }
  }
}
