package com.docflow.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Arrivals recorded at a join for its current visit. A visit ends when the expected
 * branch count is reached; the next arrival starts visit + 1.
 *
 * A join that releases on fewer arrivals than it has incoming branches may still be owed
 * arrivals from the released visit. {@code lateArrivals} counts those; each one is retired
 * on arrival instead of opening a new visit.
 */
public record JoinProgress(int visit, List<String> arrivedFrom, int lateArrivals) {

    public JoinProgress {
        arrivedFrom = arrivedFrom == null ? List.of() : List.copyOf(arrivedFrom);
        if (lateArrivals < 0) {
            throw new IllegalArgumentException("lateArrivals must be >= 0");
        }
    }

    public static JoinProgress firstVisit() {
        return new JoinProgress(1, List.of(), 0);
    }

    public JoinProgress arrive(String fromNode) {
        List<String> arrivals = new ArrayList<>(arrivedFrom);
        arrivals.add(fromNode);
        return new JoinProgress(visit, arrivals, lateArrivals);
    }

    public JoinProgress nextVisit() {
        return nextVisit(0);
    }

    /**
     * Start the next visit, expecting {@code owed} stragglers from the one just released.
     */
    public JoinProgress nextVisit(int owed) {
        return new JoinProgress(visit + 1, List.of(), owed);
    }

    public boolean expectsLateArrival() {
        return lateArrivals > 0;
    }

    public JoinProgress absorbLateArrival() {
        return new JoinProgress(visit, arrivedFrom, lateArrivals - 1);
    }

    public int arrivals() {
        return arrivedFrom.size();
    }
}
