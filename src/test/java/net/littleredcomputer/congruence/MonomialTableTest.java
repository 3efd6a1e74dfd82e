package net.littleredcomputer.congruence;

import com.google.common.collect.Streams;
import net.littleredcomputer.congruence.eqs.Explanation;
import net.littleredcomputer.congruence.eqs.VarEqs;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAnd;
import static java.util.stream.Collectors.toList;
import static net.littleredcomputer.congruence.eqs.SignedVar.neg;
import static net.littleredcomputer.congruence.eqs.SignedVar.pos;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class MonomialTableTest {
    private VarEqs ve;
    private MonomialTable t;

    @Before
    public void setUp() {
        ve = new VarEqs();
        t = new MonomialTable(ve);
    }

    private static List<Integer> vars(Iterable<Monomial> ms) {
        return Streams.stream(ms).map(Monomial::var).collect(toList());
    }

    private List<Integer> canon(int v) {
        return t.canonicalFormOf(v).vars().asList();
    }

    @Test
    public void mergeAndPopRestoreCanonicalForm() {
        t.declare(3, 1, 2);
        assertThat(canon(3), contains(1, 2));
        assertThat(t.canonicalFormOf(3).sign(), is(false));
        t.pushScope();
        ve.merge(pos(1), pos(4));
        assertThat(ve.isRoot(4), is(true));
        assertThat(canon(3), contains(2, 4));
        assertThat(t.canonicalFormOf(3).sign(), is(false));
        assertThat(vars(t.useListOf(1)), contains(3));
        assertThat(vars(t.useListOf(4)), contains(3));
        t.popScope(1);
        assertThat(canon(3), contains(1, 2));
        assertThat(vars(t.useListOf(4)), is(empty()));
        assertThat(vars(t.useListOf(1)), contains(3));
        assertThat(t.find(1, 2), isPresentAnd(hasToString("v3 := v1 v2")));
        assertThat(t.find(2, 4), isEmpty());
    }

    @Test
    public void divisibility() {
        t.declare(3, 1, 2);
        t.declare(5, 1, 1, 2);
        assertThat(t.divides(3, 5), is(true));
        assertThat(t.divides(5, 3), is(false));
        assertThat(t.divides(3, 3), is(false));
        assertThat(vars(t.properFactorsOf(3)), contains(5));
        assertThat(vars(t.properFactorsOf(5)), is(empty()));
    }

    @Test
    public void congruentDeclarations() {
        t.declare(3, 1, 2);
        t.declare(6, 2, 1);
        assertThat(t.canonicalFormOf(3).vars(), is(t.canonicalFormOf(6).vars()));
        assertThat(vars(t.signEquivalentMonomials(3)), contains(3, 6));
        assertThat(vars(t.signEquivalentMonomials(6)), contains(6, 3));
        assertThat(t.find(2, 1), isPresentAnd(hasToString("v3 := v1 v2")));
        assertThat(t.representativeOf(t.canonicalFormOf(6)).var(), is(3));
        assertThat(t.signRelativeToRepresentative(t.canonicalFormOf(6)), is(1));
        // Distinct monomials with the same vars divide each other.
        assertThat(t.divides(3, 6), is(true));
        assertThat(vars(t.properFactorsOf(3)), contains(6));
    }

    @Test
    public void negatedMergeFlipsSign() {
        t.declare(3, 1, 2);
        ve.merge(pos(1), neg(4));
        assertThat(canon(3), contains(2, 4));
        assertThat(t.canonicalFormOf(3).sign(), is(true));
        assertThat(t.canonicalFormOf(3).rsign(), is(-1));
        assertThat(t.canonicalFormOf(3), hasToString("v3 := - v2 v4"));
    }

    @Test
    public void mergeMakesMonomialsCongruent() {
        t.declare(3, 1, 2);
        t.declare(6, 4, 2);
        t.pushScope();
        ve.merge(pos(1), neg(4));
        assertThat(vars(t.signEquivalentMonomials(3)), containsInAnyOrder(3, 6));
        assertThat(t.representativeOf(t.canonicalFormOf(3)).var(), is(6));
        assertThat(t.signRelativeToRepresentative(t.canonicalFormOf(3)), is(-1));
        assertThat(t.signRelativeToRepresentative(t.canonicalFormOf(6)), is(1));
        assertThat(t.find(4, 2), isPresentAnd(hasToString("v6 := v2 v4")));
        assertThat(t.find(1, 2), isEmpty());
        t.popScope(1);
        assertThat(vars(t.signEquivalentMonomials(3)), contains(3));
        assertThat(vars(t.signEquivalentMonomials(6)), contains(6));
        assertThat(t.find(1, 2), isPresentAnd(hasToString("v3 := v1 v2")));
        assertThat(t.find(2, 4), isPresentAnd(hasToString("v6 := v2 v4")));
    }

    @Test
    public void monomialOverBothMergedVariables() {
        t.declare(8, 1, 4);
        ve.merge(pos(1), neg(4));
        assertThat(canon(8), contains(4, 4));
        assertThat(t.canonicalFormOf(8).sign(), is(true));
        assertThat(vars(t.useListOf(4)), contains(8));
        assertThat(vars(t.useListOf(1)), contains(8));
    }

    @Test
    public void declarationsInScopeAreRetracted() {
        t.declare(3, 1, 2);
        t.pushScope();
        t.declare(7, 1, 3);
        assertThat(t.isMonomialVariable(7), is(true));
        assertThat(vars(t.useListOf(1)), contains(7, 3));
        t.popScope(1);
        assertThat(t.isMonomialVariable(7), is(false));
        assertThat(t.size(), is(1));
        assertThat(vars(t.useListOf(1)), contains(3));
        assertThat(vars(t.useListOf(3)), is(empty()));
        assertThat(t.find(1, 3), isEmpty());
        // The variable may be declared again.
        t.declare(7, 2, 2);
        assertThat(canon(7), contains(2, 2));
    }

    @Test
    public void declarationAfterMergeInScope() {
        t.declare(3, 1, 2);
        t.pushScope();
        ve.merge(pos(1), pos(4));
        t.declare(7, 4, 2);
        assertThat(vars(t.signEquivalentMonomials(3)), contains(3, 7));
        assertThat(vars(t.useListOf(1)), containsInAnyOrder(3, 7));
        t.popScope(1);
        assertThat(t.isMonomialVariable(7), is(false));
        assertThat(canon(3), contains(1, 2));
        assertThat(vars(t.signEquivalentMonomials(3)), contains(3));
        assertThat(vars(t.useListOf(4)), is(empty()));
        assertThat(vars(t.useListOf(2)), contains(3));
    }

    @Test
    public void declarationOverAbsorbedVariable() {
        t.declare(3, 1, 2);
        ve.merge(pos(1), pos(4));
        t.declare(7, 1, 2);
        assertThat(canon(7), contains(2, 4));
        assertThat(vars(t.useListOf(4)), containsInAnyOrder(3, 7));
        assertThat(vars(t.signEquivalentMonomials(7)), contains(7, 3));
    }

    @Test
    public void nestedScopes() {
        t.declare(3, 1, 2);
        t.declare(5, 1, 2, 6);
        t.pushScope();
        ve.merge(pos(1), pos(4));
        t.pushScope();
        ve.merge(pos(2), pos(4));
        assertThat(canon(3), contains(4, 4));
        assertThat(vars(t.properFactorsOf(3)), contains(5));
        assertThat(t.scopeDepth(), is(2));
        t.popScope(1);
        assertThat(canon(3), contains(2, 4));
        assertThat(canon(5), contains(2, 4, 6));
        t.pushScope();
        ve.merge(pos(6), pos(7));
        t.popScope(2);
        assertThat(t.scopeDepth(), is(0));
        assertThat(ve.scopeDepth(), is(0));
        assertThat(canon(3), contains(1, 2));
        assertThat(canon(5), contains(1, 2, 6));
    }

    @Test
    public void explanationsCoverFactorEqualities() {
        t.declare(3, 1, 2);
        Explanation none = new Explanation();
        t.explain(3, none);
        assertThat(none.isEmpty(), is(true));
        ve.merge(pos(1), pos(4), 7);
        ve.merge(pos(2), pos(5), 8);
        ve.merge(pos(9), pos(10), 9);
        Explanation e = new Explanation();
        t.explain(3, e);
        assertThat(e.size(), is(2));
        assertThat(e.contains(7), is(true));
        assertThat(e.contains(8), is(true));
    }

    @Test
    public void canonicalFormsAreCached() {
        t.declare(3, 2, 1);
        SignedVars c = t.canonicalFormOf(3);
        assertThat(t.canonicalFormOf(t.monomialOf(3)), is(sameInstance(c)));
        assertThat(t.monomialOf(3).factors().asList(), contains(2, 1));
        assertThat(vars(t.monomials()), contains(3));
    }

    @Test
    public void display() {
        t.declare(3, 1, 2);
        t.declare(6, 2, 1);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        t.display(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        String s = bytes.toString(StandardCharsets.UTF_8);
        assertThat(s, containsString("v3 := v1 v2"));
        assertThat(s, containsString("v6 := v2 v1"));
        assertThat(s, containsString("class [1, 2]: v3 v6"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateDeclaration() {
        t.declare(3, 1, 2);
        t.declare(3, 4, 5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyMonomial() {
        t.declare(3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownMonomial() {
        t.canonicalFormOf(99);
    }

    @Test(expected = IllegalArgumentException.class)
    public void popTooFar() {
        t.pushScope();
        t.popScope(2);
    }

    @Test(expected = IllegalStateException.class)
    public void scopesMustGoThroughTheTable() {
        ve.push();
        t.pushScope();
    }

    @Test(expected = IllegalStateException.class)
    public void oneTablePerVarEqs() {
        new MonomialTable(ve);
    }
}
