package org.gpsagents.frontier.store;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A set of puts and deletes applied atomically, guarded by preconditions on the current contents of the store.
 *
 * <p>A store first evaluates every precondition. If any fails, {@link StateStore#write(WriteBatch)} returns false
 * and nothing is changed. Otherwise all operations are applied in order as one unit.</p>
 */
public final class WriteBatch {
    private final List<Precondition> preconditions = new ArrayList<>();
    private final List<Operation> operations = new ArrayList<>();

    public WriteBatch put(byte[] key, byte[] value) {
        operations.add(new Put(key.clone(), value.clone()));
        return this;
    }

    public WriteBatch delete(byte[] key) {
        operations.add(new Delete(key.clone()));
        return this;
    }

    public WriteBatch requirePresent(byte[] key) {
        preconditions.add(new Precondition(key.clone(), Expect.PRESENT, null));
        return this;
    }

    public WriteBatch requireAbsent(byte[] key) {
        preconditions.add(new Precondition(key.clone(), Expect.ABSENT, null));
        return this;
    }

    public WriteBatch requireValue(byte[] key, byte[] value) {
        preconditions.add(new Precondition(key.clone(), Expect.VALUE, value.clone()));
        return this;
    }

    public List<Precondition> preconditions() {
        return Collections.unmodifiableList(preconditions);
    }

    public List<Operation> operations() {
        return Collections.unmodifiableList(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public sealed interface Operation permits Put, Delete {
        byte[] key();
    }

    public record Put(byte[] key, byte[] value) implements Operation {
    }

    public record Delete(byte[] key) implements Operation {
    }

    public enum Expect {
        PRESENT, ABSENT, VALUE
    }

    public record Precondition(byte[] key, Expect expect, byte @Nullable [] value) {
        public boolean test(byte @Nullable [] current) {
            return switch (expect) {
                case PRESENT -> current != null;
                case ABSENT -> current == null;
                case VALUE -> current != null && Arrays.equals(current, value);
            };
        }
    }
}
