package choreo.formatters;

import choreo.errors.IssueVisitor;
import choreo.errors.IssueWithContext;
import choreo.model.chor.ChorNode;
import choreo.trans.passes.roles.DifferingResultRolesIssue;
import choreo.trans.passes.roles.UndeclaredRoleIssue;
import choreo.trans.passes.roles.UnlocatedFormIssue;
import choreo.trans.passes.validation.DuplicateRoleIssue;
import choreo.trans.passes.validation.InvalidRoleNameIssue;
import choreo.trans.passes.validation.MalformedFormIssue;
import choreo.trans.passes.validation.NestingTooDeepIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeNode(ChorNode node) throws IOException {
		out.write(node.getLocation().prettyString());
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write(node.toString());
		}
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(MalformedFormIssue malformedFormIssue) throws IOException {
		out.write("malformed form: ");
		out.write(malformedFormIssue.getReason());
		out.write(" ");
		writeNode(malformedFormIssue.getNode());
		return null;
	}

	@Override
	public Void visit(UndeclaredRoleIssue undeclaredRoleIssue) throws IOException {
		out.write("role ");
		out.write(undeclaredRoleIssue.getRoleForm().getRole().getName());
		out.write(" is not one of the active roles ");
		out.write(undeclaredRoleIssue.getActiveRoles().toString());
		out.write(" ");
		writeNode(undeclaredRoleIssue.getRoleForm());
		return null;
	}

	@Override
	public Void visit(NestingTooDeepIssue nestingTooDeepIssue) throws IOException {
		out.write("forms nested deeper than ");
		out.write(Integer.toString(nestingTooDeepIssue.getMaxDepth()));
		out.write(" levels ");
		out.write(nestingTooDeepIssue.getNode().getLocation().prettyString());
		return null;
	}

	@Override
	public Void visit(DifferingResultRolesIssue differingResultRolesIssue) throws IOException {
		out.write("branches of conditional have differing result roles ");
		out.write(differingResultRolesIssue.getThenOwner().getName());
		out.write(" and ");
		out.write(differingResultRolesIssue.getElseOwner().getName());
		out.write(" ");
		writeNode(differingResultRolesIssue.getNode());
		return null;
	}

	@Override
	public Void visit(UnlocatedFormIssue unlocatedFormIssue) throws IOException {
		out.write("form is not located at any role ");
		writeNode(unlocatedFormIssue.getNode());
		return null;
	}

	@Override
	public Void visit(DuplicateRoleIssue duplicateRoleIssue) throws IOException {
		out.write("duplicate role ");
		out.write(duplicateRoleIssue.getRole());
		out.write(" declared by choreography ");
		out.write(duplicateRoleIssue.getDefinition().getName());
		return null;
	}

	@Override
	public Void visit(InvalidRoleNameIssue invalidRoleNameIssue) throws IOException {
		out.write("roles must be unqualified names, got \"");
		out.write(String.valueOf(invalidRoleNameIssue.getRole()));
		out.write("\" in choreography ");
		out.write(invalidRoleNameIssue.getDefinition().getName());
		return null;
	}
}
