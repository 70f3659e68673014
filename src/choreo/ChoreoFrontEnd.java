package choreo;

import choreo.errors.Issue;
import choreo.errors.IssueContext;
import choreo.errors.TopLevelIssueContext;
import choreo.model.annotated.AnnotatedNode;
import choreo.model.chor.ChorDefinition;
import choreo.model.chor.ChorExpression;
import choreo.model.role.RoleSet;
import choreo.trans.intermediate.RoleAnalysisResult;
import choreo.trans.intermediate.WhileAnalyzingDefinition;
import choreo.trans.passes.expansion.RoleExpansionPass;
import choreo.trans.passes.roles.RoleAnalysisOptions;
import choreo.trans.passes.roles.RoleAnalysisPass;
import choreo.trans.passes.validation.RoleDeclarationValidationPass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Runs role expansion followed by role analysis, reporting problems to an
 * {@link IssueContext} instead of throwing them.
 */
public class ChoreoFrontEnd {
	private static final Logger logger = Logger.getLogger(ChoreoFrontEnd.class.getName());

	private final ChoreoOptions options;

	public ChoreoFrontEnd(ChoreoOptions options) {
		this.options = options;
	}

	public ChoreoFrontEnd(RoleAnalysisOptions analysisOptions) {
		this(new ChoreoOptions(RoleSet.empty(), analysisOptions));
	}

	/**
	 * Processes a choreography definition using the roles it declares.
	 *
	 * @return the result, or nothing if issues were reported to ctx
	 */
	public Optional<RoleAnalysisResult> process(IssueContext ctx, ChorDefinition definition) {
		TopLevelIssueContext local = new TopLevelIssueContext();
		IssueContext nested = local.withContext(new WhileAnalyzingDefinition(definition));

		logger.info("Validating roles of " + definition.getName());
		RoleDeclarationValidationPass.perform(nested, definition);
		Optional<RoleAnalysisResult> result = Optional.empty();
		if (!local.hasErrors()) {
			RoleSet roles = RoleDeclarationValidationPass.declaredRoles(definition);
			result = run(nested, definition.getName(), roles, definition.getBody());
		}

		for (Issue issue : local.getIssues()) {
			ctx.error(issue);
		}
		return result;
	}

	/**
	 * Processes several definitions independently of each other; a definition with
	 * issues does not prevent the others from being processed.
	 */
	public List<RoleAnalysisResult> processAll(IssueContext ctx, List<ChorDefinition> definitions) {
		List<RoleAnalysisResult> results = new ArrayList<>();
		for (ChorDefinition definition : definitions) {
			process(ctx, definition).ifPresent(results::add);
		}
		return results;
	}

	/**
	 * Processes a bare expression using the roles of the configuration.
	 */
	public Optional<RoleAnalysisResult> process(IssueContext ctx, ChorExpression expr) {
		return run(ctx, "<expression>", options.getRoles(), expr);
	}

	private Optional<RoleAnalysisResult> run(IssueContext ctx, String name, RoleSet roles, ChorExpression expr) {
		RoleAnalysisOptions analysisOptions = options.getAnalysisOptions();
		try {
			logger.info("Expanding role-qualified identifiers");
			ChorExpression expanded = RoleExpansionPass.perform(roles, expr, analysisOptions.getMaxNestingDepth());

			logger.info("Analyzing roles");
			AnnotatedNode annotated = RoleAnalysisPass.perform(roles, expanded, analysisOptions);
			return Optional.of(new RoleAnalysisResult(name, roles, expanded, annotated));
		} catch (Issue issue) {
			ctx.error(issue);
			return Optional.empty();
		}
	}
}
