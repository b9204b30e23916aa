package com.uchion.infrastructure.ai.remediation;

import com.uchion.domain.validation.model.RemediationCandidate;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded queue of repair candidates. Offers beyond the capacity are counted, not kept.
 */
public class RemediationWorklist {

    private final int capacity;
    private final List<RemediationCandidate> accepted = new ArrayList<>();
    private final List<Integer> dropped = new ArrayList<>();

    public RemediationWorklist(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Remediation budget must not be negative: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @return {@code true} if the candidate fits in the budget
     */
    public boolean offer(RemediationCandidate candidate) {
        if (accepted.size() >= capacity) {
            dropped.add(candidate.itemIndex());
            return false;
        }
        accepted.add(candidate);
        return true;
    }

    public List<RemediationCandidate> candidates() {
        return List.copyOf(accepted);
    }

    public List<Integer> droppedIndices() {
        return List.copyOf(dropped);
    }

    public int capacity() {
        return capacity;
    }

    public boolean isFull() {
        return accepted.size() >= capacity;
    }
}
