package com.locksmith.lease;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Raw reply of a remote call: an ordered list of result tuples whose elements may be {@code null}.
 * <p>
 * Only the first tuple is consulted by the locksmith protocol.
 * </p>
 */
public final class RemoteReply {

    /**
     * Builds a reply made of a single tuple.
     *
     * @param elements the tuple elements, {@code null} elements are allowed.
     * @return the reply.
     */
    public static RemoteReply ofTuple(Object... elements) {
        return new RemoteReply(List.of(Arrays.asList(elements)));
    }

    private final List<List<Object>> tuples;

    public RemoteReply(List<? extends List<?>> tuples) {
        var copy = new ArrayList<List<Object>>(tuples.size());
        for (var tuple : tuples) {
            copy.add(tuple == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(tuple)));
        }
        this.tuples = Collections.unmodifiableList(copy);
    }

    public List<List<Object>> getTuples() {
        return tuples;
    }

    public boolean isEmpty() {
        return tuples.isEmpty();
    }

    @Override
    public String toString() {
        return tuples.toString();
    }

}
