package choreo.trans.passes.validation;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import choreo.errors.Issue;
import choreo.errors.TopLevelIssueContext;
import choreo.model.chor.ChorDefinition;

import static choreo.model.chor.ChorBuilder.*;

@RunWith(Parameterized.class)
public class RoleDeclarationValidationPassTest {

	private static final ChorDefinition NO_ISSUES = defchor("ping", roles("Ana", "Bob"), id("x"));
	private static final ChorDefinition DUPLICATE = defchor("dup", roles("Ana", "Bob", "Ana"), id("x"));
	private static final ChorDefinition QUALIFIED = defchor("qualified", roles("Ana", "my.ns/Bob"), id("x"));
	private static final ChorDefinition EMPTY_NAME = defchor("empty", roles("", "Bob", "Bob"), id("x"));

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{NO_ISSUES, Collections.emptyList()},
				{defchor("none", roles(), id("x")), Collections.emptyList()},
				{DUPLICATE, Collections.singletonList(new DuplicateRoleIssue(DUPLICATE, "Ana"))},
				{QUALIFIED, Collections.singletonList(new InvalidRoleNameIssue(QUALIFIED, "my.ns/Bob"))},
				{
						EMPTY_NAME,
						Arrays.asList(
								new InvalidRoleNameIssue(EMPTY_NAME, ""),
								new DuplicateRoleIssue(EMPTY_NAME, "Bob")),
				},
		});
	}

	private final ChorDefinition definition;
	private final List<Issue> issues;

	public RoleDeclarationValidationPassTest(ChorDefinition definition, List<Issue> issues) {
		this.definition = definition;
		this.issues = issues;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		RoleDeclarationValidationPass.perform(ctx, definition);
		assertEquals(issues.size(), ctx.getIssues().size());
		for (int i = 0; i < issues.size(); ++i) {
			assertEquals(issues.get(i).getClass(), ctx.getIssues().get(i).getClass());
			assertEquals(issues.get(i).getMessage(), ctx.getIssues().get(i).getMessage());
		}
	}

}
