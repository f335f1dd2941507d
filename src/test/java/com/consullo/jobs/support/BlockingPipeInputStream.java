package com.consullo.jobs.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory pipe that behaves like a pty4j stream: {@link #available()} is always zero and {@link #read} blocks
 * until bytes arrive, the writer ends the stream, or the pipe is closed.
 */
public final class BlockingPipeInputStream extends InputStream {

  private static final byte[] END = new byte[0];

  private final LinkedBlockingQueue<byte[]> segments = new LinkedBlockingQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicBoolean reading = new AtomicBoolean();
  private byte[] head;
  private int headPos;

  public void write(final String text) {
    segments.add(text.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Ends the stream; reads return -1 once every written byte has been consumed.
   */
  public void endOfStream() {
    segments.add(END);
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Returns true while a reader is parked in {@link #read(byte[], int, int)} waiting for bytes.
   *
   * @return true while blocked
   */
  public boolean isReaderBlocked() {
    return reading.get() && segments.isEmpty();
  }

  @Override
  public int available() {
    return 0;
  }

  @Override
  public int read() throws IOException {
    final byte[] one = new byte[1];
    final int n = read(one, 0, 1);
    return n < 0 ? -1 : one[0] & 0xFF;
  }

  @Override
  public int read(final byte[] b, final int off, final int len) throws IOException {
    if (head == null || headPos >= head.length) {
      if (closed.get()) {
        throw new IOException("Pipe closed");
      }
      reading.set(true);
      try {
        head = segments.take();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("Interrupted while reading");
      } finally {
        reading.set(false);
      }
      headPos = 0;
      if (head == END) {
        if (closed.get()) {
          throw new IOException("Pipe closed");
        }
        segments.add(END);
        head = null;
        return -1;
      }
    }
    final int n = Math.min(len, head.length - headPos);
    System.arraycopy(head, headPos, b, off, n);
    headPos += n;
    return n;
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      segments.add(END);
    }
  }
}
