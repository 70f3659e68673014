package choreo;

import choreo.model.role.Role;
import choreo.model.role.RoleSet;
import choreo.trans.passes.roles.RoleAnalysisOptions;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

// Options of a choreography front end run, as read from a JSON configuration file:
//
// {
//   "roles": ["Ana", "Bob"],
//   "analysis": {
//     "maxNestingDepth": 1000,
//     "branchOwnership": "permissive",
//     "rejectUnlocatedLeaves": false
//   }
// }
//
// "roles" is the active role set used for expressions that are not part of a
// choreography definition. Both fields may be left out.
public class ChoreoOptions {
	public static final String ROLES_FIELD = "roles";
	public static final String ANALYSIS_FIELD = "analysis";

	private final RoleSet roles;
	private final RoleAnalysisOptions analysisOptions;

	public ChoreoOptions(RoleSet roles, RoleAnalysisOptions analysisOptions) {
		this.roles = roles;
		this.analysisOptions = analysisOptions;
	}

	public static ChoreoOptions load(Path configFilePath) throws ChoreoOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(configFilePath.toFile(), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new ChoreoOptionException("Error reading configuration file: " + ex.getMessage(), ex);
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new ChoreoOptionException(configFilePath + ": parsing error: " + e.getMessage(), e);
		}
		return fromJSON(config);
	}

	public static ChoreoOptions fromJSON(JSONObject config) throws ChoreoOptionException {
		RoleSet roles = RoleSet.empty();
		if (config.has(ROLES_FIELD)) {
			roles = parseRoles(config);
		}

		RoleAnalysisOptions analysisOptions = RoleAnalysisOptions.defaults();
		if (config.has(ANALYSIS_FIELD)) {
			JSONObject analysis;
			try {
				analysis = config.getJSONObject(ANALYSIS_FIELD);
			} catch (JSONException e) {
				throw new ChoreoOptionException(ANALYSIS_FIELD + " must be an object", e);
			}
			analysisOptions = RoleAnalysisOptions.fromJSON(analysis);
		}
		return new ChoreoOptions(roles, analysisOptions);
	}

	private static RoleSet parseRoles(JSONObject config) throws ChoreoOptionException {
		List<Role> roles = new ArrayList<>();
		try {
			JSONArray names = config.getJSONArray(ROLES_FIELD);
			for (int i = 0; i < names.length(); i++) {
				String name = names.getString(i);
				if (!Role.isValidName(name)) {
					throw new ChoreoOptionException("roles must be unqualified names, got \"" + name + "\"");
				}
				Role role = Role.of(name);
				if (roles.contains(role)) {
					throw new ChoreoOptionException("duplicate role: " + name);
				}
				roles.add(role);
			}
		} catch (JSONException e) {
			throw new ChoreoOptionException(ROLES_FIELD + " must be an array of names: " + e.getMessage(), e);
		}
		return RoleSet.of(roles);
	}

	public RoleSet getRoles() {
		return roles;
	}

	public RoleAnalysisOptions getAnalysisOptions() {
		return analysisOptions;
	}
}
