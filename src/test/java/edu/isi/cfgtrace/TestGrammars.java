package edu.isi.cfgtrace;

import java.io.BufferedReader;
import java.io.StringReader;

// grammars shared by the tests, built through the reader
final class TestGrammars {

	private TestGrammars() {}

	static CFGRuleSet parse(String... lines) {
		StringBuilder sb = new StringBuilder();
		for (String l : lines)
			sb.append(l).append('\n');
		try {
			return GrammarReader.read(new BufferedReader(new StringReader(sb.toString())));
		}
		catch (Exception e) {
			throw new AssertionError("test grammar did not load: "+e.getMessage(), e);
		}
	}

	// S -> a S b | epsilon
	static CFGRuleSet anbn() {
		return parse("VARIABLES", "S", "TERMINALS", "a", "b",
				"PRODUCTIONS", "S -> a S b | epsilon", "START", "S");
	}

	// E -> E + T | T, T -> a
	static CFGRuleSet sums() {
		return parse("VARIABLES", "E", "T", "TERMINALS", "a", "+",
				"PRODUCTIONS", "E -> E + T | T", "T -> a", "START", "E");
	}

	// S -> A A, A -> a | b
	static CFGRuleSet pairs() {
		return parse("VARIABLES", "S", "A", "TERMINALS", "a", "b",
				"PRODUCTIONS", "S -> A A", "A -> a | b", "START", "S");
	}

	// S -> A, A -> A | a
	static CFGRuleSet unitCycle() {
		return parse("VARIABLES", "S", "A", "TERMINALS", "a",
				"PRODUCTIONS", "S -> A", "A -> A | a", "START", "S");
	}

	// S -> S A | b, A -> epsilon: forms grow without bound and never cycle
	static CFGRuleSet runaway() {
		return parse("VARIABLES", "S", "A", "TERMINALS", "b",
				"PRODUCTIONS", "S -> S A | b", "A -> epsilon", "START", "S");
	}
}
