package choreo.trans.passes.expansion;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

import choreo.model.chor.ChorExpression;
import choreo.model.chor.ChorIf;
import choreo.model.chor.ChorQualifiedIdentifier;
import choreo.model.chor.ChorSequence;
import choreo.model.role.RoleSet;
import choreo.trans.passes.validation.MalformedFormIssue;
import choreo.trans.passes.validation.NestingTooDeepIssue;
import choreo.util.SourceLocation;

import static choreo.model.chor.ChorBuilder.*;

public class RoleExpansionIssuesTest {

	private static final RoleSet ROLES = RoleSet.of("Ana", "Bob");

	@Test
	public void testEmptySequence() {
		ChorSequence empty = seq();
		try {
			RoleExpansionPass.perform(ROLES, at("Ana", empty));
			fail("expected a MalformedFormIssue");
		} catch (MalformedFormIssue issue) {
			assertSame(empty, issue.getNode());
		}
	}

	@Test
	public void testIfWithoutElse() {
		ChorIf partial = new ChorIf(SourceLocation.unknown(), id("c"), qid("Ana", "x"), null);
		try {
			RoleExpansionPass.perform(ROLES, seq(partial));
			fail("expected a MalformedFormIssue");
		} catch (MalformedFormIssue issue) {
			assertSame(partial, issue.getNode());
			assertThat(issue.getReason(), is("missing else branch"));
		}
	}

	@Test
	public void testQualifiedIdentifierWithoutQualifier() {
		ChorQualifiedIdentifier partial = new ChorQualifiedIdentifier(SourceLocation.unknown(), null, "x");
		try {
			RoleExpansionPass.perform(ROLES, seq(partial));
			fail("expected a MalformedFormIssue");
		} catch (MalformedFormIssue issue) {
			assertSame(partial, issue.getNode());
			assertThat(issue.getReason(), is("missing qualifier"));
			assertThat(issue.getMessage(), containsString("<missing>/x"));
		}
	}

	@Test(expected = MalformedFormIssue.class)
	public void testSelectWithoutChoosers() {
		RoleExpansionPass.perform(ROLES, select(choosers(), qid("Ana", "x")));
	}

	@Test(expected = MalformedFormIssue.class)
	public void testBindingWithoutValue() {
		RoleExpansionPass.perform(ROLES, let(bindings(binding(qid("Ana", "x"), null)), id("x")));
	}

	@Test
	public void testNestingLimit() {
		ChorExpression expr = id("x");
		for (int i = 0; i < 20; ++i) {
			expr = seq(expr);
		}
		assertEquals(expr, RoleExpansionPass.perform(ROLES, expr, 20));
		try {
			RoleExpansionPass.perform(ROLES, expr, 19);
			fail("expected a NestingTooDeepIssue");
		} catch (NestingTooDeepIssue issue) {
			assertEquals(19, issue.getMaxDepth());
			assertEquals(id("x"), issue.getNode());
		}
	}

	@Test
	public void testDeepNestingWithinDefaultLimit() {
		ChorExpression expr = qid("Ana", "x");
		ChorExpression expected = at("Ana", id("x"));
		for (int i = 0; i < 500; ++i) {
			expr = seq(expr);
			expected = seq(expected);
		}
		assertEquals(expected, RoleExpansionPass.perform(ROLES, expr));
	}

}
