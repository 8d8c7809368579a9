package edu.isi.cfgtrace;

import java.util.Collections;
import java.util.List;

/**
 * A successful trace: the ordered derivation steps from the start symbol to
 * the target, and the expansion edges that build its parse tree.
 */
public class Derivation {
    private final String target;
    private final SearchStrategy strategy;
    private final VariableSymbol start;
    private final List<DerivationStep> steps;
    private final List<ExpansionEdge> edges;

    Derivation(String target, SearchStrategy strategy, VariableSymbol start,
	    List<DerivationStep> steps, List<ExpansionEdge> edges) {
	this.target = target;
	this.strategy = strategy;
	this.start = start;
	this.steps = Collections.unmodifiableList(steps);
	this.edges = Collections.unmodifiableList(edges);
    }

    public String getTarget() { return target; }
    public SearchStrategy getStrategy() { return strategy; }
    public VariableSymbol getStart() { return start; }
    public List<DerivationStep> getSteps() { return steps; }
    public List<ExpansionEdge> getEdges() { return edges; }

    public DerivationStep getLastStep() {
	return steps.get(steps.size()-1);
    }

    public ParseTree getParseTree() throws InconsistentEdgesException {
	return new ParseTreeBuilder().build(edges, start);
    }

    // one "=> form" line per step. an empty final form prints as epsilon
    public String toString() {
	StringBuilder sb = new StringBuilder();
	for (DerivationStep s : steps) {
	    String f = s.toString();
	    sb.append("=> ").append(f.length() == 0 ? SymbolFactory.EPSILON_TOKEN : f).append('\n');
	}
	return sb.toString();
    }
}
