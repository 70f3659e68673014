package choreo.formatters;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import choreo.model.chor.ChorNode;

import static choreo.model.chor.ChorBuilder.*;

@RunWith(Parameterized.class)
public class ChorNodeFormattingVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{id("x"), "x"},
				{qid("Ana", "x"), "Ana/x"},
				{num(7), "7"},
				{str("say \"hi\""), "\"say \\\"hi\\\"\""},
				{keyword("ok"), ":ok"},
				{bool(true), "true"},
				{at("Ana", seq(id("x"), id("y"))), "(Ana (do x y))"},
				{
						let(bindings(binding(id("x"), num(1)), binding(pattern(id("a"), pattern(id("b"))), opaque("f", id("x")))),
								id("a")),
						"(let [x 1 [a [b]] (f x)] a)",
				},
				{ifexp(id("c"), qid("Ana", "t"), qid("Bob", "f")), "(if c Ana/t Bob/f)"},
				{select(choosers(keyword("ok"), id("Bob")), at("Bob", id("x"))), "(select [:ok Bob] (Bob x))"},
				{opaque("g"), "(g)"},
				{ifexp(id("c"), id("t"), null), "(if c t <missing>)"},
		});
	}

	private final ChorNode node;
	private final String expected;

	public ChorNodeFormattingVisitorTest(ChorNode node, String expected) {
		this.node = node;
		this.expected = expected;
	}

	@Test
	public void test() {
		assertEquals(expected, node.toString());
	}

}
