package choreo.trans.passes.roles;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;

import org.junit.Test;

import choreo.model.annotated.AnnotatedLiteral;
import choreo.model.annotated.AnnotatedNode;
import choreo.model.role.Role;
import choreo.model.role.RoleSet;

import static choreo.model.chor.ChorBuilder.*;

public class InvolvedRolesTest {

	private static final Role ANA = Role.of("Ana");
	private static final Role BOB = Role.of("Bob");

	@Test
	public void testLeaf() {
		assertEquals(Collections.singleton(ANA), InvolvedRoles.ofLeaf(Optional.of(ANA)));
		assertEquals(Collections.emptySet(), InvolvedRoles.ofLeaf(Optional.empty()));
	}

	@Test
	public void testChildrenUnion() {
		AnnotatedNode x = new AnnotatedLiteral(id("x"), Optional.of(ANA), Collections.singleton(ANA));
		AnnotatedNode y = new AnnotatedLiteral(id("y"), Optional.of(BOB), Collections.singleton(BOB));
		AnnotatedNode z = new AnnotatedLiteral(id("z"), Optional.empty(), Collections.emptySet());
		assertEquals(new HashSet<>(Arrays.asList(ANA, BOB)), InvolvedRoles.ofChildren(Arrays.asList(x, y, z)));
		assertEquals(Collections.emptySet(), InvolvedRoles.ofChildren(Collections.emptyList()));
	}

	@Test
	public void testSelectAnnouncesOnlyActiveRoles() {
		assertEquals(Collections.singleton(BOB), InvolvedRoles.ofSelect(
				RoleSet.of("Ana", "Bob"),
				Arrays.asList(keyword("left"), id("Bob"), id("Carol"), qid("Ana", "x")),
				Collections.emptyList()));
	}

	@Test
	public void testRoleFormAddsItsRole() {
		assertEquals(new HashSet<>(Arrays.asList(ANA, BOB)),
				InvolvedRoles.ofRoleForm(ANA, Collections.singleton(BOB)));
	}

}
