package com.consullo.relay.core.jediterm;

import com.jediterm.terminal.TerminalDataStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A {@link TerminalDataStream} fed with raw PTY bytes and decoded as UTF-8.
 *
 * <p>The agent UI draws with non-ASCII glyphs (prompt arrows, bullets, box drawing, spinners), so bytes
 * cannot be mapped one-to-one to chars. A multi-byte sequence split across two reads is held back until
 * the rest arrives. Malformed input decodes to U+FFFD.
 *
 * <p>Reads never block: when nothing is queued {@link #getChar()} throws {@link TerminalDataStream.EOF},
 * which ends the emulator's current {@code hasNext()} loop until more output is fed.
 */
public final class Utf8TerminalDataStream implements TerminalDataStream {

  private final Object lock = new Object();
  private final Deque<Character> queue = new ArrayDeque<>();
  private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
      .onMalformedInput(CodingErrorAction.REPLACE)
      .onUnmappableCharacter(CodingErrorAction.REPLACE);

  private ByteBuffer pending = ByteBuffer.allocate(0);

  /**
   * Decodes and queues bytes read from the PTY.
   *
   * @param data byte array
   * @param off offset
   * @param len length
   */
  public void appendBytes(byte[] data, int off, int len) {
    if (data == null) {
      throw new IllegalArgumentException("data must not be null.");
    }
    if (off < 0 || len < 0 || off + len > data.length) {
      throw new IllegalArgumentException("Invalid off/len.");
    }
    synchronized (lock) {
      final ByteBuffer in = ByteBuffer.allocate(pending.remaining() + len);
      in.put(pending);
      in.put(data, off, len);
      in.flip();

      final CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
      decoder.decode(in, out, false);
      out.flip();
      while (out.hasRemaining()) {
        queue.addLast(out.get());
      }
      // incomplete trailing sequence, completed by the next read
      pending = in.slice();
    }
  }

  @Override
  public char getChar() throws EOF {
    synchronized (lock) {
      if (queue.isEmpty()) {
        throw new TerminalDataStream.EOF();
      }
      return queue.removeFirst();
    }
  }

  @Override
  public void pushChar(char c) {
    synchronized (lock) {
      queue.addFirst(c);
    }
  }

  @Override
  public String readNonControlCharacters(int maxChars) {
    if (maxChars <= 0) {
      return "";
    }
    final StringBuilder sb = new StringBuilder();
    synchronized (lock) {
      while (sb.length() < maxChars && !queue.isEmpty()) {
        final char c = queue.peekFirst();
        if (isControl(c)) {
          break;
        }
        queue.removeFirst();
        sb.append(c);
      }
    }
    return sb.toString();
  }

  @Override
  public void pushBackBuffer(char[] chars, int length) {
    synchronized (lock) {
      for (int i = length - 1; i >= 0; i--) {
        queue.addFirst(chars[i]);
      }
    }
  }

  @Override
  public boolean isEmpty() {
    synchronized (lock) {
      return queue.isEmpty();
    }
  }

  private static boolean isControl(char c) {
    // C0, DEL and C1
    return c <= 0x1F || (c >= 0x7F && c <= 0x9F);
  }
}
