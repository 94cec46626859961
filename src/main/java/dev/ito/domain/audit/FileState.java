package dev.ito.domain.audit;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Point-in-time snapshot of entity values observed in the live tracked files.
 *
 * <p>Recomputed on demand; has no persistent identity. Entries iterate in {@link EntityKey} order.</p>
 * <p>{@link #scopes()} names every scope that was scanned, including scopes whose files held no entities.
 * It always contains the non-null scope of every entry.</p>
 *
 * @since 0.1.0
 */
public final class FileState {
  private static final FileState EMPTY = new FileState(new TreeMap<>(), new TreeSet<>());

  private final Map<EntityKey, String> values;
  private final Set<String> scopes;

  private FileState(TreeMap<EntityKey, String> values, TreeSet<String> scopes) {
    this.values = Collections.unmodifiableMap(values);
    this.scopes = Collections.unmodifiableSet(scopes);
  }

  public static FileState empty() {
    return EMPTY;
  }

  /**
   * Creates a snapshot from a key/value map.
   *
   * @param values observed values; keys and values must not be {@code null}
   * @return immutable snapshot
   */
  public static FileState of(Map<EntityKey, String> values) {
    Objects.requireNonNull(values, "values");
    Builder builder = builder();
    values.forEach(builder::put);
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<String> valueOf(EntityKey key) {
    return Optional.ofNullable(values.get(key));
  }

  public Map<EntityKey, String> entries() {
    return values;
  }

  /**
   * Scopes that were scanned, in natural order.
   *
   * @return scanned scopes; empty when nothing was scanned
   */
  public Set<String> scopes() {
    return scopes;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FileState other && values.equals(other.values) && scopes.equals(other.scopes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(values, scopes);
  }

  @Override
  public String toString() {
    return "FileState" + values;
  }

  /** Accumulates observed values; a later put for the same key replaces the earlier one. */
  public static final class Builder {
    private final TreeMap<EntityKey, String> values = new TreeMap<>();
    private final TreeSet<String> scopes = new TreeSet<>();

    private Builder() {}

    public Builder put(EntityKey key, String value) {
      values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      if (key.scope() != null) {
        scopes.add(key.scope());
      }
      return this;
    }

    /**
     * Records that {@code scope} was scanned, whether or not it yields entries.
     *
     * @param scope scanned scope
     * @return this builder
     */
    public Builder scanned(String scope) {
      scopes.add(Objects.requireNonNull(scope, "scope"));
      return this;
    }

    public Builder put(String entity, String entityId, String scope, String value) {
      return put(new EntityKey(entity, entityId, scope), value);
    }

    public Builder putAll(FileState other) {
      values.putAll(other.values);
      scopes.addAll(other.scopes);
      return this;
    }

    public FileState build() {
      return values.isEmpty() && scopes.isEmpty() ? EMPTY : new FileState(new TreeMap<>(values), new TreeSet<>(scopes));
    }
  }
}
