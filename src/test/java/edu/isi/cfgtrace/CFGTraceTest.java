package edu.isi.cfgtrace;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CFGTrace command line")
class CFGTraceTest {

	private static String resource(String name) throws Exception {
		return Paths.get(CFGTraceTest.class.getResource("/"+name).toURI()).toString();
	}

	private final StringWriter out = new StringWriter();

	private int run(String... argv) throws Exception {
		return CFGTrace.run(argv, out);
	}

	@Test
	@DisplayName("prints a leftmost derivation by default")
	void leftmostByDefault() throws Exception {
		assertThat(run(resource("anbn.cfg"), "aabb")).isEqualTo(CFGTrace.OK);
		assertThat(out.toString()).isEqualTo(
			"Leftmost derivation of 'aabb':\n"+
			"=> S\n"+
			"=> a S b\n"+
			"=> a a S b b\n"+
			"=> a a b b\n");
	}

	@Test
	@DisplayName("-r switches to rightmost")
	void rightmost() throws Exception {
		assertThat(run("-r", resource("expr.cfg"), "a+a")).isEqualTo(CFGTrace.OK);
		assertThat(out.toString()).isEqualTo(
			"Rightmost derivation of 'a+a':\n"+
			"=> E\n"+
			"=> E + T\n"+
			"=> E + F\n"+
			"=> E + a\n"+
			"=> T + a\n"+
			"=> F + a\n"+
			"=> a + a\n");
	}

	@Test
	@DisplayName("-t adds the parse tree")
	void tree() throws Exception {
		assertThat(run("-t", resource("anbn.cfg"), "aabb")).isEqualTo(CFGTrace.OK);
		assertThat(out.toString()).endsWith("Parse tree: S(a S(a S(epsilon) b) b)\n");
	}

	@Test
	@DisplayName("-d adds both dot graphs")
	void dot() throws Exception {
		assertThat(run("-d", resource("anbn.cfg"), "ab")).isEqualTo(CFGTrace.OK);
		assertThat(out.toString()).contains("digraph ParseTree {", "digraph LeftmostDerivation {");
	}

	@Test
	@DisplayName("reports strings outside the language and goes on")
	void notDerivable() throws Exception {
		assertThat(run(resource("anbn.cfg"), "aab", "ab")).isEqualTo(CFGTrace.OK);
		assertThat(out.toString()).startsWith("String 'aab' is not in the language of this grammar.\n")
			.contains("Leftmost derivation of 'ab':\n");
	}

	@Test
	@DisplayName("-c summarizes the grammar")
	void check() throws Exception {
		assertThat(run("-c", resource("anbn.cfg"))).isEqualTo(CFGTrace.OK);
		assertThat(out.toString()).isEqualTo(
			"CFG info for anbn.cfg:\n"+
			"\t1 variables\n"+
			"\t2 terminals\n"+
			"\t2 productions\n"+
			"\tstart symbol S\n"+
			"VARIABLES\nS\nTERMINALS\na\nb\nPRODUCTIONS\nS -> a S b | epsilon\nSTART\nS\n");
	}

	@Test
	@DisplayName("a spent budget gives up with its own exit status")
	void budget() throws Exception {
		assertThat(run("-b", "1", resource("anbn.cfg"), "aabb")).isEqualTo(CFGTrace.ABORTED);
		assertThat(out.toString()).isEqualTo("Could not decide 'aabb': Gave up on \"aabb\" after 1 states (budget 1)\n");
	}

	@Test
	@DisplayName("endlessly growing forms give up under the default budget")
	void growingForms() throws Exception {
		assertThat(run(resource("runaway.cfg"), "bb", "b")).isEqualTo(CFGTrace.ABORTED);
		assertThat(out.toString()).isEqualTo(
			"Could not decide 'bb': Gave up on \"bb\" after "+DerivationSearch.MAX_DEPTH+" states"+
			" (a path reached "+DerivationSearch.MAX_DEPTH+" substitutions)\n"+
			"Could not decide 'b': Gave up on \"b\" after "+DerivationSearch.MAX_DEPTH+" states"+
			" (a path reached "+DerivationSearch.MAX_DEPTH+" substitutions)\n");
	}

	@Test
	@DisplayName("rightmost settles the same grammar")
	void growingFormsRightmost() throws Exception {
		assertThat(run("-r", resource("runaway.cfg"), "bb", "b")).isEqualTo(CFGTrace.OK);
		assertThat(out.toString()).isEqualTo(
			"String 'bb' is not in the language of this grammar.\n"+
			"Rightmost derivation of 'b':\n=> S\n=> b\n");
	}

	@Test
	@DisplayName("bad configurations are refused before any work")
	void badConfig() throws Exception {
		assertThat(run("-l", "-r", resource("anbn.cfg"), "ab")).isEqualTo(CFGTrace.BAD_CONFIG);
		assertThat(run(resource("anbn.cfg"))).isEqualTo(CFGTrace.BAD_CONFIG);
		assertThat(run("-c", "-t", resource("anbn.cfg"))).isEqualTo(CFGTrace.BAD_CONFIG);
		assertThat(run("no/such/grammar.cfg", "ab")).isEqualTo(CFGTrace.BAD_CONFIG);
		assertThat(run(resource("undeclared.cfg"), "a")).isEqualTo(CFGTrace.BAD_CONFIG);
		assertThat(run(resource("incomplete.cfg"), "a")).isEqualTo(CFGTrace.BAD_CONFIG);
		assertThat(out.toString()).isEmpty();
	}

	@Test
	@DisplayName("-o writes to a file instead")
	void outfile(@TempDir Path dir) throws Exception {
		Path f = dir.resolve("out.txt");
		assertThat(run("-o", f.toString(), resource("anbn.cfg"), "ab")).isEqualTo(CFGTrace.OK);
		assertThat(out.toString()).isEmpty();
		assertThat(new String(Files.readAllBytes(f), StandardCharsets.UTF_8))
			.isEqualTo("Leftmost derivation of 'ab':\n=> S\n=> a S b\n=> a b\n");
	}
}
