package polyc.poly;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import org.junit.Test;
import polyc.hir.UnsupportedInput;

public class RelationReaderTest {

    @Test
    public void testSet() {
        Relation r = RelationReader.readRelation("[N] -> { S[i, j] : 0 <= i < N and 0 <= j <= i }");
        Space space = r.getSpace();
        assertTrue(space.isSet());
        assertThat(space.getOutName(), is("S"));
        assertThat(space.getOutDimNames(), is(Arrays.asList("i", "j")));
        assertThat(space.getParams(), is(Arrays.asList("N")));
        assertThat(r.getBasicRelations().size(), is(1));
    }

    @Test
    public void testUndeclaredNamesBecomeParameters() {
        Relation r = RelationReader.readRelation("{ S[i] : i < M }");
        assertThat(r.getSpace().getParams(), is(Arrays.asList("M")));
    }

    @Test
    public void testMap() {
        Relation r = RelationReader.readRelation("{ S[i] -> A[i + 1] }");
        Space space = r.getSpace();
        assertFalse(space.isSet());
        assertThat(space.getInName(), is("S"));
        assertThat(space.getOutName(), is("A"));
        assertThat(space.getNumIn(), is(1));
        assertThat(space.getNumOut(), is(1));
    }

    @Test
    public void testParameterDomain() {
        Relation r = RelationReader.readRelation("[N] -> { : N >= 1 }");
        assertTrue(r.getSpace().isSet());
        assertThat(r.getSpace().getNumOut(), is(0));
    }

    @Test
    public void testDisjunction() {
        Relation r = RelationReader.readRelation("{ S[i] : i = 0 or i = 5 }");
        assertThat(r.getBasicRelations().size(), is(2));
    }

    @Test
    public void testUnionOfSpaces() {
        UnionRelation u = RelationReader.readUnion(
                "{ S1[i] -> [0, i]; S2[i] -> [1, i] }");
        assertThat(u.getNumRelations(), is(2));
        assertNotNull(u.getRelationByName("S2"));
        assertTrue(RelationReader.readUnion("{ }").isEmpty());
    }

    @Test
    public void testUnionToSingleRelation() {
        UnionRelation u = RelationReader.readUnion("[N] -> { S1[i] : 0 <= i < N }");
        Relation r = u.toRelation(null);
        assertThat(r.getSpace().getOutName(), is("S1"));
        assertFalse(r.isEmpty());
        Space space = Space.setSpace(new ArrayList<String>(), "S1", 1);
        assertTrue(UnionRelation.empty().toRelation(space).isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void testUnionOfSpacesToSingleRelation() {
        RelationReader.readUnion("{ S1[i] -> [0, i]; S2[i] -> [1, i] }")
                .toRelation(null);
    }

    @Test(expected = UnsupportedInput.class)
    public void testMalformed() {
        RelationReader.readRelation("{ S[i : }");
    }

    @Test(expected = UnsupportedInput.class)
    public void testSeveralSpacesForOneRelation() {
        RelationReader.readRelation("{ S1[i]; S2[i] }");
    }

}
