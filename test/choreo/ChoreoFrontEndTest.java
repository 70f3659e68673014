package choreo;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import choreo.errors.Issue;
import choreo.errors.IssueWithContext;
import choreo.errors.TopLevelIssueContext;
import choreo.model.annotated.AnnotatedNode;
import choreo.model.chor.ChorDefinition;
import choreo.model.role.Role;
import choreo.model.role.RoleSet;
import choreo.trans.intermediate.RoleAnalysisResult;
import choreo.trans.passes.roles.BranchOwnershipPolicy;
import choreo.trans.passes.roles.DifferingResultRolesIssue;
import choreo.trans.passes.roles.RoleAnalysisOptions;
import choreo.trans.passes.roles.UndeclaredRoleIssue;
import choreo.trans.passes.validation.DuplicateRoleIssue;

import static choreo.model.chor.ChorBuilder.*;

public class ChoreoFrontEndTest {

	private final ChoreoFrontEnd frontEnd = new ChoreoFrontEnd(RoleAnalysisOptions.defaults());

	@Test
	public void testDefinition() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ChorDefinition definition = defchor("ping", roles("Ana", "Bob"),
				at("Ana", seq(qid("Bob", "x"), id("y"))));
		Optional<RoleAnalysisResult> result = frontEnd.process(ctx, definition);

		assertFalse(ctx.format(), ctx.hasErrors());
		assertTrue(result.isPresent());
		assertEquals("ping", result.get().getName());
		assertEquals(RoleSet.of("Ana", "Bob"), result.get().getRoles());
		assertEquals(at("Ana", seq(at("Bob", id("x")), id("y"))), result.get().getExpanded());

		AnnotatedNode annotated = result.get().getAnnotated();
		assertEquals(Optional.of(Role.of("Ana")), annotated.getOwner());
		assertEquals(RoleSet.of("Ana", "Bob").getRoles(), annotated.getRoles());
	}

	@Test
	public void testQualifiedIdentifierInsideRoleForm() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Optional<RoleAnalysisResult> result = frontEnd.process(ctx,
				defchor("handoff", roles("Ana", "Bob"), at("Ana", qid("Bob", "x"))));

		assertFalse(ctx.format(), ctx.hasErrors());
		assertEquals(at("Ana", at("Bob", id("x"))), result.get().getExpanded());
		AnnotatedNode annotated = result.get().getAnnotated();
		assertEquals(Optional.of(Role.of("Ana")), annotated.getOwner());
		assertEquals("(do x@Bob)@Ana", annotated.toString());
	}

	@Test
	public void testDepthLimitSharedByBothPasses() {
		ChoreoFrontEnd shallow = new ChoreoFrontEnd(RoleAnalysisOptions.defaults().withMaxNestingDepth(3));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Optional<RoleAnalysisResult> result = shallow.process(ctx,
				defchor("deep", roles("Ana"), seq(seq(seq(qid("Ana", "x"))))));

		assertFalse(ctx.format(), ctx.hasErrors());
		assertTrue(result.isPresent());
	}

	@Test
	public void testDuplicateRoleStopsProcessing() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Optional<RoleAnalysisResult> result = frontEnd.process(ctx,
				defchor("twice", roles("Ana", "Ana"), id("x")));

		assertFalse(result.isPresent());
		List<Issue> issues = ctx.getIssues();
		assertEquals(1, issues.size());
		assertTrue(issues.get(0) instanceof IssueWithContext);
		assertTrue(((IssueWithContext) issues.get(0)).getIssue() instanceof DuplicateRoleIssue);
		assertTrue(ctx.format(), ctx.format().contains("while analyzing choreography twice"));
	}

	@Test
	public void testUndeclaredWrapperRole() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Optional<RoleAnalysisResult> result = frontEnd.process(ctx,
				defchor("lonely", roles("Ana"), at("Bob", id("x"))));

		assertFalse(result.isPresent());
		assertEquals(1, ctx.getIssues().size());
		Issue issue = ctx.getIssues().get(0);
		assertTrue(issue instanceof IssueWithContext);
		assertTrue(((IssueWithContext) issue).getIssue() instanceof UndeclaredRoleIssue);
		assertTrue(issue.getMessage(), issue.getMessage().contains("role Bob is not one of the active roles"));
	}

	@Test
	public void testProcessAllKeepsGoing() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<RoleAnalysisResult> results = frontEnd.processAll(ctx, Arrays.asList(
				defchor("broken", roles("Ana"), at("Carol", id("x"))),
				defchor("fine", roles("Ana"), qid("Ana", "x"))));

		assertEquals(1, results.size());
		assertEquals("fine", results.get(0).getName());
		assertEquals(1, ctx.getIssues().size());
		assertTrue(ctx.format().startsWith("Detected 1 issue(s):"));
		assertTrue(ctx.format(), ctx.format().contains("while analyzing choreography broken"));
	}

	@Test
	public void testExpressionUsesConfiguredRoles() {
		ChoreoFrontEnd configured = new ChoreoFrontEnd(
				new ChoreoOptions(RoleSet.of("Ana", "Bob"), RoleAnalysisOptions.defaults()));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Optional<RoleAnalysisResult> result = configured.process(ctx, qid("Bob", "x"));

		assertFalse(ctx.format(), ctx.hasErrors());
		assertTrue(result.isPresent());
		assertEquals("<expression>", result.get().getName());
		assertEquals(Optional.of(Role.of("Bob")), result.get().getAnnotated().getOwner());
	}

	@Test
	public void testStrictBranchesReported() {
		ChoreoFrontEnd strict = new ChoreoFrontEnd(RoleAnalysisOptions.defaults()
				.withBranchOwnershipPolicy(BranchOwnershipPolicy.STRICT));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Optional<RoleAnalysisResult> result = strict.process(ctx,
				defchor("choice", roles("Ana", "Bob"), ifexp(id("c"), qid("Ana", "a"), qid("Bob", "b"))));

		assertFalse(result.isPresent());
		assertEquals(1, ctx.getIssues().size());
		assertTrue(((IssueWithContext) ctx.getIssues().get(0)).getIssue() instanceof DifferingResultRolesIssue);
	}

}
