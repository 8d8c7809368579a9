package edu.isi.cfgtrace;

import java.util.Collections;
import java.util.List;

/**
 * Result of one {@link DerivationSearch#search} call. A derivable outcome
 * carries the path of substitutions from the starting form to the target.
 */
public class SearchOutcome {

    public enum Status { DERIVABLE, NOT_DERIVABLE, BUDGET_EXCEEDED }

    private final Status status;
    private final List<Expansion> path;
    private final int statesExplored;

    SearchOutcome(Status status, List<Expansion> path, int statesExplored) {
	this.status = status;
	this.path = path == null ? null : Collections.unmodifiableList(path);
	this.statesExplored = statesExplored;
    }

    public Status getStatus() { return status; }
    public boolean isDerivable() { return status == Status.DERIVABLE; }
    /** substitutions in derivation order; null unless derivable */
    public List<Expansion> getPath() { return path; }
    public int getStatesExplored() { return statesExplored; }

    public String toString() {
	return status+" after "+statesExplored+" states";
    }
}
