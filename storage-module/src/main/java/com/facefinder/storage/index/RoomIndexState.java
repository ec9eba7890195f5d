package com.facefinder.storage.index;

import java.util.HashSet;
import java.util.Set;

/**
 * What readers of one room see: an immutable structure plus the ids tombstoned inside it.
 */
record RoomIndexState(SearchStructure structure, Set<Long> tombstones) {

    RoomIndexState {
        tombstones = Set.copyOf(tombstones);
    }

    static RoomIndexState of(SearchStructure structure) {
        return new RoomIndexState(structure, Set.of());
    }

    int activeCount() {
        return structure.size() - tombstones.size();
    }

    RoomIndexState withStructure(SearchStructure next) {
        return new RoomIndexState(next, tombstones);
    }

    RoomIndexState withTombstones(Set<Long> added) {
        Set<Long> merged = new HashSet<>(tombstones);
        merged.addAll(added);
        return new RoomIndexState(structure, merged);
    }
}
