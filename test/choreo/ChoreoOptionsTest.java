package choreo;

import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.json.JSONObject;
import org.junit.Test;

import choreo.model.role.RoleSet;
import choreo.trans.passes.roles.BranchOwnershipPolicy;
import choreo.trans.passes.roles.RoleAnalysisOptions;

public class ChoreoOptionsTest {

	private static final Path CONFIGS = Paths.get("test-resources", "configs");

	@Test
	public void testLoad() throws ChoreoOptionException {
		ChoreoOptions options = ChoreoOptions.load(CONFIGS.resolve("choreo.json"));
		assertEquals(RoleSet.of("Ana", "Bob"), options.getRoles());
		RoleAnalysisOptions analysis = options.getAnalysisOptions();
		assertEquals(64, analysis.getMaxNestingDepth());
		assertEquals(BranchOwnershipPolicy.STRICT, analysis.getBranchOwnershipPolicy());
		assertTrue(analysis.rejectsUnlocatedLeaves());
	}

	@Test(expected = ChoreoOptionException.class)
	public void testLoadBrokenJSON() throws ChoreoOptionException {
		ChoreoOptions.load(CONFIGS.resolve("broken.json"));
	}

	@Test(expected = ChoreoOptionException.class)
	public void testLoadMissingFile() throws ChoreoOptionException {
		ChoreoOptions.load(CONFIGS.resolve("does-not-exist.json"));
	}

	@Test
	public void testDefaults() throws ChoreoOptionException {
		ChoreoOptions options = ChoreoOptions.fromJSON(new JSONObject("{}"));
		assertTrue(options.getRoles().isEmpty());
		RoleAnalysisOptions analysis = options.getAnalysisOptions();
		assertEquals(RoleAnalysisOptions.DEFAULT_MAX_NESTING_DEPTH, analysis.getMaxNestingDepth());
		assertEquals(BranchOwnershipPolicy.PERMISSIVE, analysis.getBranchOwnershipPolicy());
		assertFalse(analysis.rejectsUnlocatedLeaves());
	}

	@Test
	public void testPartialAnalysisOptions() throws ChoreoOptionException {
		ChoreoOptions options = ChoreoOptions.fromJSON(new JSONObject(
				"{\"analysis\": {\"branchOwnership\": \"strict\"}}"));
		RoleAnalysisOptions analysis = options.getAnalysisOptions();
		assertEquals(RoleAnalysisOptions.DEFAULT_MAX_NESTING_DEPTH, analysis.getMaxNestingDepth());
		assertEquals(BranchOwnershipPolicy.STRICT, analysis.getBranchOwnershipPolicy());
	}

	private static void assertRejected(String json, String messageFragment) {
		try {
			ChoreoOptions.fromJSON(new JSONObject(json));
			fail("expected " + json + " to be rejected");
		} catch (ChoreoOptionException e) {
			assertTrue(e.getMessage(), e.getMessage().contains(messageFragment));
		}
	}

	@Test
	public void testUnknownPolicy() {
		assertRejected("{\"analysis\": {\"branchOwnership\": \"lenient\"}}", "lenient");
		assertRejected("{\"analysis\": {\"branchOwnership\": \"lenient\"}}", "expected one of permissive, strict");
	}

	@Test
	public void testNonPositiveDepth() {
		assertRejected("{\"analysis\": {\"maxNestingDepth\": 0}}", "must be positive");
	}

	@Test
	public void testDepthNotANumber() {
		assertRejected("{\"analysis\": {\"maxNestingDepth\": \"deep\"}}", "invalid analysis options");
	}

	@Test
	public void testAnalysisNotAnObject() {
		assertRejected("{\"analysis\": 3}", "must be an object");
	}

	@Test
	public void testDuplicateRole() {
		assertRejected("{\"roles\": [\"Ana\", \"Ana\"]}", "duplicate role: Ana");
	}

	@Test
	public void testQualifiedRole() {
		assertRejected("{\"roles\": [\"ns/Ana\"]}", "ns/Ana");
	}

	@Test
	public void testRolesNotAnArray() {
		assertRejected("{\"roles\": \"Ana\"}", "must be an array");
	}

}
