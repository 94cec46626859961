package dev.ito.domain.audit;

import java.util.Comparator;
import java.util.Objects;

/**
 * Opaque, comparable and serializable position within one audit log.
 *
 * <p>Callers persist {@link #token()} and restore it with {@link #parse(String)}; only the log adapter
 * interprets the components. Ordering is by consumed position; cursors taken from different files (see
 * {@link #identity()}) are not meaningfully comparable.</p>
 *
 * @since 0.1.0
 */
public final class StreamCursor implements Comparable<StreamCursor> {
  private static final String PREFIX = "c1";
  private static final String NO_IDENTITY = "-";
  private static final Comparator<StreamCursor> ORDER = Comparator
      .comparingLong(StreamCursor::byteOffset)
      .thenComparingLong(StreamCursor::lineCount);

  /** Position before any content of an unknown file. */
  public static final StreamCursor START = new StreamCursor(0L, 0L, NO_IDENTITY);

  private final long byteOffset;
  private final long lineCount;
  private final String identity;

  private StreamCursor(long byteOffset, long lineCount, String identity) {
    this.byteOffset = byteOffset;
    this.lineCount = lineCount;
    this.identity = identity;
  }

  /**
   * Creates a cursor; intended for storage adapters.
   *
   * @param byteOffset bytes consumed, always at a line boundary
   * @param lineCount lines consumed
   * @param identity fingerprint of the underlying file, or {@code null} when unknown
   * @return cursor
   */
  public static StreamCursor of(long byteOffset, long lineCount, String identity) {
    if (byteOffset < 0 || lineCount < 0) {
      throw new IllegalArgumentException("cursor components must not be negative");
    }
    String id = identity == null || identity.isBlank() ? NO_IDENTITY : identity;
    if (id.indexOf('.') >= 0) {
      throw new IllegalArgumentException("cursor identity must not contain '.'");
    }
    return new StreamCursor(byteOffset, lineCount, id);
  }

  /**
   * Restores a cursor from {@link #token()}.
   *
   * @param token serialized cursor
   * @return cursor
   * @throws IllegalArgumentException when the token is not a cursor produced by this build
   */
  public static StreamCursor parse(String token) {
    Objects.requireNonNull(token, "token");
    String[] parts = token.trim().split("\\.");
    if (parts.length != 4 || !PREFIX.equals(parts[0])) {
      throw new IllegalArgumentException("Unrecognized stream cursor: " + token);
    }
    try {
      return of(Long.parseLong(parts[1]), Long.parseLong(parts[2]), parts[3]);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Unrecognized stream cursor: " + token, ex);
    }
  }

  public String token() {
    return PREFIX + "." + byteOffset + "." + lineCount + "." + identity;
  }

  public long byteOffset() {
    return byteOffset;
  }

  public long lineCount() {
    return lineCount;
  }

  /**
   * File identity fingerprint, or {@code "-"} when unknown.
   *
   * @return identity string
   */
  public String identity() {
    return identity;
  }

  public boolean hasIdentity() {
    return !NO_IDENTITY.equals(identity);
  }

  @Override
  public int compareTo(StreamCursor other) {
    return ORDER.compare(this, other);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof StreamCursor other
        && byteOffset == other.byteOffset
        && lineCount == other.lineCount
        && identity.equals(other.identity);
  }

  @Override
  public int hashCode() {
    return Objects.hash(byteOffset, lineCount, identity);
  }

  @Override
  public String toString() {
    return token();
  }
}
