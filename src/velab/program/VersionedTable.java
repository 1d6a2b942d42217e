package velab.program;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Insertion-ordered associative store with checkpoint/commit/undo over a batch of inserts.
 * Between {@link #checkpoint()} and the matching {@link #commit()} or {@link #undo()}, inserts form one pending batch.
 * Undo removes exactly that batch and hands every removed value to the discard hook.
 * Checkpoints do not nest.
 */
public class VersionedTable<K, V> {
  private final LinkedHashMap<K, V> entries = new LinkedHashMap<>();
  private final Consumer<? super V> onDiscard;
  private ArrayList<K> pending = null;

  public VersionedTable() { this(value -> {}); }
  /**
   * @param onDiscard called for each value removed by {@link #undo()}, most recent insert first
   */
  public VersionedTable(Consumer<? super V> onDiscard) { this.onDiscard = onDiscard; }

  /** Opens a pending batch. */
  public void checkpoint() {
    if (pending != null)
      throw new IllegalStateException("checkpoint while a previous checkpoint is unresolved");
    pending = new ArrayList<>();
  }

  /** Makes the pending batch permanent. */
  public void commit() {
    if (pending == null)
      throw new IllegalStateException("commit without checkpoint");
    pending = null;
  }

  /** Removes the pending batch, restoring the table to its state at {@link #checkpoint()}. */
  public void undo() {
    if (pending == null)
      throw new IllegalStateException("undo without checkpoint");
    for (int i = pending.size() - 1; i >= 0; --i)
      onDiscard.accept(entries.remove(pending.get(i)));
    pending = null;
  }

  public boolean isPending() { return pending != null; }

  /**
   * Inserts a new entry. Outside a checkpoint the insert is permanent immediately.
   * @throws IllegalArgumentException if the key is already present
   */
  public void insert(K key, V value) {
    if (entries.containsKey(key))
      throw new IllegalArgumentException("duplicate key " + key);
    entries.put(key, value);
    if (pending != null)
      pending.add(key);
  }

  public Optional<V> find(K key) { return Optional.ofNullable(entries.get(key)); }
  public boolean contains(K key) { return entries.containsKey(key); }
  public int size() { return entries.size(); }
  public boolean isEmpty() { return entries.isEmpty(); }

  /** The oldest entry. */
  public Optional<Map.Entry<K, V>> first() {
    if (entries.isEmpty())
      return Optional.empty();
    return Optional.of(entries.entrySet().iterator().next());
  }

  public Set<K> keys() { return Collections.unmodifiableSet(entries.keySet()); }
  public Collection<V> values() { return Collections.unmodifiableCollection(entries.values()); }
  public Map<K, V> asMap() { return Collections.unmodifiableMap(entries); }
}
