package choreo.trans.passes.roles;

import choreo.model.annotated.AnnotatedNode;
import choreo.model.chor.ChorIf;
import choreo.model.role.Role;

import java.util.Optional;

/**
 * What to do with a conditional whose branches end up owned by different roles when
 * no enclosing role form decides the owner of the conditional itself.
 */
public enum BranchOwnershipPolicy {
	/**
	 * The conditional stays ownerless; projection has to deal with it.
	 */
	PERMISSIVE("permissive") {
		@Override
		public void check(ChorIf node, Optional<Role> context, AnnotatedNode thenBranch, AnnotatedNode elseBranch) {
		}
	},
	/**
	 * Reject the conditional with a {@link DifferingResultRolesIssue}.
	 */
	STRICT("strict") {
		@Override
		public void check(ChorIf node, Optional<Role> context, AnnotatedNode thenBranch, AnnotatedNode elseBranch) {
			if (context.isPresent() || !thenBranch.getOwner().isPresent() || !elseBranch.getOwner().isPresent()) {
				return;
			}
			Role thenOwner = thenBranch.getOwner().get();
			Role elseOwner = elseBranch.getOwner().get();
			if (!thenOwner.equals(elseOwner)) {
				throw new DifferingResultRolesIssue(node, thenOwner, elseOwner);
			}
		}
	};

	private final String configName;

	BranchOwnershipPolicy(String configName) {
		this.configName = configName;
	}

	public String getConfigName() {
		return configName;
	}

	public abstract void check(ChorIf node, Optional<Role> context, AnnotatedNode thenBranch, AnnotatedNode elseBranch);

	public static Optional<BranchOwnershipPolicy> fromConfigName(String name) {
		for (BranchOwnershipPolicy policy : values()) {
			if (policy.configName.equals(name)) {
				return Optional.of(policy);
			}
		}
		return Optional.empty();
	}
}
