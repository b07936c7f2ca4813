package com.questrail.intersection.core;

import java.util.*;

/**
 * LaneStateStore
 * -----------------------------------------------------------------------------
 * Registration-ordered store of {@link LaneState}s.
 *
 * <ul>
 *   <li>a list for index -> lane id (registration order)</li>
 *   <li>a map for lane id -> index</li>
 *   <li>an array of current states, addressed by index</li>
 * </ul>
 *
 * Registration order is the default iteration order and the tie-break order
 * for every selector. It never depends on hash iteration.
 *
 * <p>Not thread-safe; owned by a single controller and accessed under its
 * lock.</p>
 */
public final class LaneStateStore
{
    private List<String> idByIndex = List.of();
    private Map<String, Integer> indexById = Map.of();
    private LaneState[] states = new LaneState[0];

    /**
     * Discards all state and registers the given lanes, in order, in their
     * initial state.
     *
     * @throws IllegalArgumentException if an id is duplicated
     */
    public void register(List<String> laneIds) {
        Objects.requireNonNull(laneIds, "laneIds");

        Map<String, Integer> tmp = new HashMap<>(laneIds.size() * 2);
        LaneState[] fresh = new LaneState[laneIds.size()];
        for (int i = 0; i < laneIds.size(); i++) {
            String id = Objects.requireNonNull(laneIds.get(i), "lane id at index " + i);
            Integer prev = tmp.put(id, i);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate lane id: " + id);
            }
            fresh[i] = LaneState.initial(id);
        }

        this.idByIndex = List.copyOf(laneIds);
        this.indexById = Collections.unmodifiableMap(tmp);
        this.states = fresh;
    }

    /**
     * Returns true if exactly the given lane ids are registered, in any order.
     */
    public boolean hasLaneSet(Collection<String> laneIds) {
        Objects.requireNonNull(laneIds, "laneIds");
        return laneIds.size() == idByIndex.size() && indexById.keySet().containsAll(laneIds);
    }

    public int size() {
        return idByIndex.size();
    }

    public boolean isEmpty() {
        return idByIndex.isEmpty();
    }

    /**
     * Returns the registered lane ids in registration order.
     */
    public List<String> laneIds() {
        return idByIndex;
    }

    public boolean contains(String laneId) {
        return indexById.containsKey(laneId);
    }

    public int indexOf(String laneId) {
        Objects.requireNonNull(laneId, "laneId");
        Integer idx = indexById.get(laneId);
        if (idx == null) {
            throw new IllegalArgumentException("Unknown lane id: " + laneId);
        }
        return idx;
    }

    public String idAt(int index) {
        if (index < 0 || index >= idByIndex.size()) {
            throw new IndexOutOfBoundsException("index=" + index + ", size=" + idByIndex.size());
        }
        return idByIndex.get(index);
    }

    public LaneState get(String laneId) {
        return states[indexOf(laneId)];
    }

    public LaneState at(int index) {
        idAt(index);
        return states[index];
    }

    /**
     * Replaces the stored state of the lane identified by {@code state.laneId()}.
     */
    public void put(LaneState state) {
        Objects.requireNonNull(state, "state");
        states[indexOf(state.laneId())] = state;
    }

    /**
     * Returns all states in registration order.
     */
    public List<LaneState> inOrder() {
        return List.of(states);
    }
}
