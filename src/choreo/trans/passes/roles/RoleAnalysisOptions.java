package choreo.trans.passes.roles;

import choreo.ChoreoOptionException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Tunables of role analysis, read from the "analysis" object of the configuration
 * file. Every field is optional.
 */
public class RoleAnalysisOptions {
	public static final int DEFAULT_MAX_NESTING_DEPTH = 1000;

	public static final String MAX_NESTING_DEPTH_FIELD = "maxNestingDepth";
	public static final String BRANCH_OWNERSHIP_FIELD = "branchOwnership";
	public static final String REJECT_UNLOCATED_LEAVES_FIELD = "rejectUnlocatedLeaves";

	private final int maxNestingDepth;
	private final BranchOwnershipPolicy branchOwnershipPolicy;
	private final boolean rejectUnlocatedLeaves;

	public RoleAnalysisOptions(int maxNestingDepth, BranchOwnershipPolicy branchOwnershipPolicy,
	                           boolean rejectUnlocatedLeaves) {
		this.maxNestingDepth = maxNestingDepth;
		this.branchOwnershipPolicy = branchOwnershipPolicy;
		this.rejectUnlocatedLeaves = rejectUnlocatedLeaves;
	}

	public static RoleAnalysisOptions defaults() {
		return new RoleAnalysisOptions(DEFAULT_MAX_NESTING_DEPTH, BranchOwnershipPolicy.PERMISSIVE, false);
	}

	public static RoleAnalysisOptions fromJSON(JSONObject config) throws ChoreoOptionException {
		try {
			int maxNestingDepth = config.has(MAX_NESTING_DEPTH_FIELD) ?
					config.getInt(MAX_NESTING_DEPTH_FIELD) : DEFAULT_MAX_NESTING_DEPTH;
			if (maxNestingDepth < 1) {
				throw new ChoreoOptionException(MAX_NESTING_DEPTH_FIELD + " must be positive, got " + maxNestingDepth);
			}

			BranchOwnershipPolicy policy = BranchOwnershipPolicy.PERMISSIVE;
			if (config.has(BRANCH_OWNERSHIP_FIELD)) {
				String name = config.getString(BRANCH_OWNERSHIP_FIELD);
				Optional<BranchOwnershipPolicy> found = BranchOwnershipPolicy.fromConfigName(name);
				if (!found.isPresent()) {
					throw new ChoreoOptionException("unknown " + BRANCH_OWNERSHIP_FIELD + " policy: " + name
							+ ", expected one of " + Arrays.stream(BranchOwnershipPolicy.values())
							.map(BranchOwnershipPolicy::getConfigName)
							.collect(Collectors.joining(", ")));
				}
				policy = found.get();
			}

			boolean rejectUnlocatedLeaves = config.has(REJECT_UNLOCATED_LEAVES_FIELD) &&
					config.getBoolean(REJECT_UNLOCATED_LEAVES_FIELD);
			return new RoleAnalysisOptions(maxNestingDepth, policy, rejectUnlocatedLeaves);
		} catch (JSONException e) {
			throw new ChoreoOptionException("invalid analysis options: " + e.getMessage(), e);
		}
	}

	public int getMaxNestingDepth() {
		return maxNestingDepth;
	}

	public BranchOwnershipPolicy getBranchOwnershipPolicy() {
		return branchOwnershipPolicy;
	}

	public boolean rejectsUnlocatedLeaves() {
		return rejectUnlocatedLeaves;
	}

	public RoleAnalysisOptions withMaxNestingDepth(int maxNestingDepth) {
		return new RoleAnalysisOptions(maxNestingDepth, branchOwnershipPolicy, rejectUnlocatedLeaves);
	}

	public RoleAnalysisOptions withBranchOwnershipPolicy(BranchOwnershipPolicy branchOwnershipPolicy) {
		return new RoleAnalysisOptions(maxNestingDepth, branchOwnershipPolicy, rejectUnlocatedLeaves);
	}

	public RoleAnalysisOptions withRejectUnlocatedLeaves(boolean rejectUnlocatedLeaves) {
		return new RoleAnalysisOptions(maxNestingDepth, branchOwnershipPolicy, rejectUnlocatedLeaves);
	}
}
