package edu.isi.cfgtrace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("DerivationSearch")
class DerivationSearchTest {

	@ParameterizedTest
	@EnumSource(SearchStrategy.class)
	@DisplayName("decides membership in a^n b^n")
	void anbnMembership(SearchStrategy s) throws Exception {
		DerivationSearch ds = new DerivationSearch(TestGrammars.anbn());
		for (String yes : Arrays.asList("", "ab", "aabb", "aaabbb"))
			assertThat(ds.derives(yes, s)).as(yes).isTrue();
		for (String no : Arrays.asList("a", "b", "ba", "abab", "aab", "abb"))
			assertThat(ds.derives(no, s)).as(no).isFalse();
	}

	@Test
	@DisplayName("rejects characters outside the alphabet without searching")
	void foreignCharacters() throws Exception {
		DerivationSearch ds = new DerivationSearch(TestGrammars.anbn());
		SearchOutcome o = ds.search("ab a", SearchStrategy.LEFTMOST);
		assertThat(o.getStatus()).isEqualTo(SearchOutcome.Status.NOT_DERIVABLE);
		assertThat(o.getStatesExplored()).isZero();
		assertThat(ds.search("aacbb", SearchStrategy.RIGHTMOST).getStatesExplored()).isZero();
	}

	@Test
	@DisplayName("empty target needs an epsilon path")
	void emptyTargetWithoutEpsilon() throws Exception {
		CFGRuleSet g = TestGrammars.parse("VARIABLES", "S", "TERMINALS", "a",
				"PRODUCTIONS", "S -> a", "START", "S");
		DerivationSearch ds = new DerivationSearch(g);
		assertThat(ds.search("", SearchStrategy.LEFTMOST).getStatus()).isEqualTo(SearchOutcome.Status.NOT_DERIVABLE);
		assertThat(ds.derives("a", SearchStrategy.LEFTMOST)).isTrue();
	}

	@Test
	@DisplayName("terminates on a cyclic unit production")
	void unitCycle() throws Exception {
		DerivationSearch ds = new DerivationSearch(TestGrammars.unitCycle());
		SearchOutcome o = ds.search("a", SearchStrategy.LEFTMOST);
		assertThat(o.isDerivable()).isTrue();
		assertThat(o.getPath()).extracting(e -> e.getRule().toString()).containsExactly("S -> A", "A -> a");
		assertThat(ds.search("aa", SearchStrategy.RIGHTMOST).isDerivable()).isFalse();
	}

	@Test
	@DisplayName("terminates on left recursion")
	void leftRecursion() throws Exception {
		DerivationSearch ds = new DerivationSearch(TestGrammars.sums());
		assertThat(ds.derives("a+a+a", SearchStrategy.LEFTMOST)).isTrue();
		assertThat(ds.derives("a+a+a", SearchStrategy.RIGHTMOST)).isTrue();
		assertThat(ds.derives("a++a", SearchStrategy.LEFTMOST)).isFalse();
		assertThat(ds.derives("+", SearchStrategy.RIGHTMOST)).isFalse();
	}

	@Test
	@DisplayName("path positions follow the strategy")
	void pathPositions() throws Exception {
		DerivationSearch ds = new DerivationSearch(TestGrammars.pairs());
		assertThat(ds.search("ab", SearchStrategy.LEFTMOST).getPath())
			.extracting(Expansion::getPosition).containsExactly(0, 0, 1);
		assertThat(ds.search("ab", SearchStrategy.RIGHTMOST).getPath())
			.extracting(Expansion::getPosition).containsExactly(0, 1, 0);
	}

	@Test
	@DisplayName("first derivation found follows declaration order")
	void declarationOrder() throws Exception {
		CFGRuleSet first = TestGrammars.parse("VARIABLES", "S", "A", "B", "TERMINALS", "a", "b",
				"PRODUCTIONS", "S -> a B | A b", "A -> a", "B -> b", "START", "S");
		CFGRuleSet second = TestGrammars.parse("VARIABLES", "S", "A", "B", "TERMINALS", "a", "b",
				"PRODUCTIONS", "S -> A b | a B", "A -> a", "B -> b", "START", "S");
		assertThat(new DerivationSearch(first).search("ab", SearchStrategy.LEFTMOST).getPath().get(0).getRule().toString())
			.isEqualTo("S -> a B");
		assertThat(new DerivationSearch(second).search("ab", SearchStrategy.LEFTMOST).getPath().get(0).getRule().toString())
			.isEqualTo("S -> A b");
	}

	@Test
	@DisplayName("searches from an arbitrary starting form")
	void fromForm() throws Exception {
		CFGRuleSet g = TestGrammars.anbn();
		DerivationSearch ds = new DerivationSearch(g);
		Symbol a = SymbolFactory.getTerminal("a");
		Symbol b = SymbolFactory.getTerminal("b");
		Symbol s = SymbolFactory.getVariable("S");
		assertThat(ds.search(Arrays.asList(a, s, b), "aabb", SearchStrategy.LEFTMOST).getPath()).hasSize(2);
		assertThat(ds.search(Arrays.asList(b, s, a), "aabb", SearchStrategy.LEFTMOST).isDerivable()).isFalse();
		assertThat(ds.search(Arrays.asList(a, b), "ab", SearchStrategy.LEFTMOST).getPath()).isEmpty();
		assertThatThrownBy(() -> ds.search(Arrays.asList(Symbol.getEpsilon()), "", SearchStrategy.LEFTMOST))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("gives up when the explored-state budget runs out")
	void budget() throws Exception {
		SearchOutcome o = new DerivationSearch(TestGrammars.runaway(), 500).search("bb", SearchStrategy.LEFTMOST);
		assertThat(o.getStatus()).isEqualTo(SearchOutcome.Status.BUDGET_EXCEEDED);
		assertThat(o.getStatesExplored()).isEqualTo(500);
		assertThat(o.getPath()).isNull();

		DerivationSearch tiny = new DerivationSearch(TestGrammars.anbn(), 1);
		assertThat(tiny.search("aabb", SearchStrategy.LEFTMOST).getStatus()).isEqualTo(SearchOutcome.Status.BUDGET_EXCEEDED);
		assertThatThrownBy(() -> tiny.derives("aabb", SearchStrategy.LEFTMOST))
			.isInstanceOf(BudgetExceededException.class)
			.hasMessage("Gave up on \"aabb\" after 1 states (budget 1)");
	}

	@Test
	@DisplayName("gives up on endlessly growing forms under the default budget")
	void growingForms() throws Exception {
		SearchOutcome o = new DerivationSearch(TestGrammars.runaway()).search("bb", SearchStrategy.LEFTMOST);
		assertThat(o.getStatus()).isEqualTo(SearchOutcome.Status.BUDGET_EXCEEDED);
		assertThat(o.getStatesExplored()).isEqualTo(DerivationSearch.MAX_DEPTH);

		DerivationSearch unlimited = new DerivationSearch(TestGrammars.runaway(), 0);
		assertThat(unlimited.search("bb", SearchStrategy.LEFTMOST).getStatus()).isEqualTo(SearchOutcome.Status.BUDGET_EXCEEDED);
		assertThatThrownBy(() -> unlimited.derives("bb", SearchStrategy.LEFTMOST))
			.isInstanceOf(BudgetExceededException.class)
			.hasMessageContaining("a path reached "+DerivationSearch.MAX_DEPTH+" substitutions");

		// rightmost never grows the form here, so it answers
		assertThat(unlimited.search("bb", SearchStrategy.RIGHTMOST).getStatus()).isEqualTo(SearchOutcome.Status.NOT_DERIVABLE);
		assertThat(unlimited.search("b", SearchStrategy.RIGHTMOST).isDerivable()).isTrue();
	}

	@Test
	@DisplayName("seals the grammar it is given")
	void sealsGrammar() throws Exception {
		CFGRuleSet g = new CFGRuleSet();
		g.addVariable("S");
		g.addTerminal("a");
		g.addProduction("S", Arrays.asList("a"));
		assertThatThrownBy(() -> new DerivationSearch(g)).isInstanceOf(IncompleteGrammarException.class);
		g.setStart("S");
		new DerivationSearch(g);
		assertThat(g.isSealed()).isTrue();
	}
}
