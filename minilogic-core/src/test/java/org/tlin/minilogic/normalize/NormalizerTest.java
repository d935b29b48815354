package org.tlin.minilogic.normalize;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.tlin.minilogic.ir.BinaryOp;
import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.Stmt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tlin.minilogic.ir.Ir.*;

class NormalizerTest {

    private final Normalizer normalizer = new Normalizer();

    private static Stmt nestedChain() {
        return ifElse(var("c1"), ret(intLit(1)),
                ifElse(var("c2"), ret(intLit(2)), ret(intLit(3))));
    }

    private static Stmt flatChain() {
        return seq(
                ifThen(var("c1"), ret(intLit(1))),
                ifThen(var("c2"), ret(intLit(2))),
                ret(intLit(3)));
    }

    // ── Expressions ─────────────────────────────────────────────────────

    @Test
    void constantFolding() {
        assertThat(normalizer.normalize(add(intLit(1), intLit(2)))).isEqualTo(intLit(3));
        assertThat(normalizer.normalize(lt(intLit(1), intLit(2)))).isEqualTo(boolLit(true));
        assertThat(normalizer.normalize(not(boolLit(true)))).isEqualTo(boolLit(false));
        assertThat(normalizer.normalize(add(var("x"), add(intLit(1), intLit(1)))))
                .isEqualTo(add(var("x"), intLit(2)));
    }

    @Test
    void divisionByZeroIsNotFolded() {
        Expr div = binary(BinaryOp.DIV, intLit(1), intLit(0));

        assertThat(normalizer.normalize(div)).isEqualTo(div);
    }

    @Test
    void booleanIdentities() {
        assertThat(normalizer.normalize(and(boolLit(true), var("x")))).isEqualTo(var("x"));
        assertThat(normalizer.normalize(and(var("x"), boolLit(true)))).isEqualTo(var("x"));
        assertThat(normalizer.normalize(or(boolLit(false), var("x")))).isEqualTo(var("x"));
        assertThat(normalizer.normalize(or(var("x"), boolLit(false)))).isEqualTo(var("x"));
    }

    @Test
    void absorbingLiteralOnTheLeftDropsTheRight() {
        assertThat(normalizer.normalize(and(boolLit(false), call("f")))).isEqualTo(boolLit(false));
        assertThat(normalizer.normalize(or(boolLit(true), call("f")))).isEqualTo(boolLit(true));
    }

    @Test
    void absorbingLiteralOnTheRightKeepsCalls() {
        assertThat(normalizer.normalize(and(var("x"), boolLit(false)))).isEqualTo(boolLit(false));
        assertThat(normalizer.normalize(or(var("x"), boolLit(true)))).isEqualTo(boolLit(true));
        assertThat(normalizer.normalize(and(call("f"), boolLit(false)))).isEqualTo(and(call("f"), boolLit(false)));
    }

    @Test
    void doubleNegation() {
        assertThat(normalizer.normalize(not(not(var("x"))))).isEqualTo(var("x"));
        assertThat(normalizer.normalize(not(var("x")))).isEqualTo(not(var("x")));
    }

    // ── Statements ──────────────────────────────────────────────────────

    @Test
    void noopsAreDropped() {
        assertThat(normalizer.normalize(seq(noop(), assign("x", intLit(1)), noop())))
                .isEqualTo(assign("x", intLit(1)));
        assertThat(normalizer.normalize(block(noop(), noop()))).isEqualTo(noop());
        assertThat(normalizer.normalize(block(assign("x", intLit(1))))).isEqualTo(assign("x", intLit(1)));
    }

    @Test
    void literalConditionSelectsBranch() {
        Stmt a = assign("x", intLit(1));
        Stmt b = assign("x", intLit(2));

        assertThat(normalizer.normalize(ifElse(boolLit(true), a, b))).isEqualTo(a);
        assertThat(normalizer.normalize(ifElse(not(boolLit(true)), a, b))).isEqualTo(b);
        assertThat(normalizer.normalize(ifThen(boolLit(false), a))).isEqualTo(noop());
    }

    @Test
    void literalConditionKeepsInitializerScope() {
        Stmt init = declAssign("t", intLit(1));
        Stmt then = ret(var("t"));

        assertThat(normalizer.normalize(ifInit(init, boolLit(true), then, ret(intLit(0)))))
                .isEqualTo(ifInit(init, boolLit(true), then, null));
    }

    @Test
    void literalConditionWithPlainInitializerInlinesIt() {
        Stmt init = assign("x", intLit(1));

        assertThat(normalizer.normalize(ifInit(init, boolLit(false), ret(intLit(1)), null))).isEqualTo(init);
        assertThat(normalizer.normalize(ifInit(init, boolLit(true), ret(intLit(1)), null)))
                .isEqualTo(seq(init, ret(intLit(1))));
    }

    @Test
    void normalizationIsIdempotent() {
        Stmt stmt = seq(
                ifElse(and(boolLit(true), var("c")), block(noop(), ret(add(intLit(1), intLit(1)))), noop()),
                callStmt("f", not(not(var("y")))));

        Stmt once = normalizer.normalize(stmt);

        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }

    // ── Chains ──────────────────────────────────────────────────────────

    @Test
    void flattenNestedChain() {
        assertThat(normalizer.flattenIfElseChain(nestedChain())).isEqualTo(flatChain());
    }

    @Test
    void flattenStopsAtNonTerminatingBranch() {
        Stmt chain = ifElse(var("c1"), ret(intLit(1)),
                ifElse(var("c2"), assign("x", intLit(2)), ret(intLit(3))));

        assertThat(normalizer.flattenIfElseChain(chain)).isEqualTo(seq(
                ifThen(var("c1"), ret(intLit(1))),
                ifElse(var("c2"), assign("x", intLit(2)), ret(intLit(3)))));
    }

    @Test
    void flattenLeavesOtherStatementsAlone() {
        Stmt plain = ifElse(var("c"), assign("x", intLit(1)), ret(intLit(2)));

        assertThat(normalizer.flattenIfElseChain(plain)).isSameAs(plain);
        assertThat(normalizer.flattenIfElseChain(ret(intLit(1)))).isEqualTo(ret(intLit(1)));
    }

    @Test
    void flattenKeepsElseThatUsesInitializerNames() {
        Stmt chain = ifInit(declAssign("t", call("lookup")), var("c"), ret(intLit(1)), ret(var("t")));

        assertThat(normalizer.flattenIfElseChain(chain)).isSameAs(chain);
    }

    @Test
    void unflattenFlatChain() {
        assertThat(normalizer.unflattenIfElseChain(flatChain())).isEqualTo(nestedChain());
        assertThat(normalizer.unflattenIfElseChain(normalizer.flattenIfElseChain(nestedChain())))
                .isEqualTo(nestedChain());
    }

    @Test
    void unflattenDoesNotCaptureRestIntoInitializerScope() {
        Stmt guarded = ifInit(declAssign("t", call("lookup")), var("c"), ret(intLit(1)), null);
        Stmt flat = seq(guarded, ret(var("t")));

        assertThat(normalizer.unflattenIfElseChain(flat)).isEqualTo(flat);
    }

    @Test
    void unflattenLeavesNonTerminatingIfAlone() {
        Stmt stmt = seq(ifThen(var("c"), assign("x", intLit(1))), assign("y", intLit(2)));

        assertThat(normalizer.unflattenIfElseChain(stmt)).isEqualTo(stmt);
        assertThat(normalizer.unflattenIfElseChain(seq(ifThen(var("c"), ret(intLit(1))), assign("y", intLit(2)))))
                .isEqualTo(ifElse(var("c"), ret(intLit(1)), assign("y", intLit(2))));
    }

    @Test
    void flattenAllReachesNestedChains() {
        Stmt nested = block(callStmt("log"), nestedChain());
        Stmt flat = block(callStmt("log"), flatChain());

        assertThat(normalizer.flattenAllIfElseChains(nested)).isEqualTo(normalizer.flattenAllIfElseChains(flat));
        assertThat(normalizer.flattenAllIfElseChains(nestedChain())).isEqualTo(flatChain());
    }

    @Test
    void flattenAllRebuildsSequencesRightNested() {
        Stmt leftNested = new Stmt.Seq(new Stmt.Seq(assign("a", intLit(1)), assign("b", intLit(2))), retVoid());

        assertThat(normalizer.flattenAllIfElseChains(leftNested))
                .isEqualTo(seq(assign("a", intLit(1)), assign("b", intLit(2)), retVoid()));
    }

    @Test
    void branchTermination() {
        assertThat(normalizer.branchTerminates(ret(intLit(1)))).isTrue();
        assertThat(normalizer.branchTerminates(breakLoop())).isTrue();
        assertThat(normalizer.branchTerminates(seq(assign("x", intLit(1)), continueLoop()))).isTrue();
        assertThat(normalizer.branchTerminates(block(callStmt("f"), retVoid()))).isTrue();
        assertThat(normalizer.branchTerminates(ifElse(var("c"), ret(intLit(1)), breakLoop()))).isTrue();

        assertThat(normalizer.branchTerminates(ifThen(var("c"), ret(intLit(1))))).isFalse();
        assertThat(normalizer.branchTerminates(ifElse(var("c"), ret(intLit(1)), noop()))).isFalse();
        assertThat(normalizer.branchTerminates(assign("x", intLit(1)))).isFalse();
    }

    // ── Limits ──────────────────────────────────────────────────────────

    @Test
    void deepTreeIsReturnedUnchanged() {
        Stmt stmt = ret(intLit(1));
        for (int i = 0; i < 300; i++) {
            stmt = block(noop(), stmt);
        }

        assertThat(normalizer.normalize(stmt)).isSameAs(stmt);
        assertThat(normalizer.flattenAllIfElseChains(stmt)).isSameAs(stmt);
        assertThat(normalizer.branchTerminates(stmt)).isFalse();
    }

    @Test
    void deepExpressionIsReturnedUnchanged() {
        Expr sum = intLit(0);
        for (int i = 0; i < 200_000; i++) {
            sum = add(sum, var("y"));
        }
        Stmt stmt = assign("x", sum);

        assertThat(normalizer.normalize(sum)).isSameAs(sum);
        assertThat(normalizer.normalize(stmt)).isSameAs(stmt);
    }

    @Test
    void deepLeftNestedSequenceIsReturnedUnchanged() {
        Stmt stmt = noop();
        for (int i = 0; i < 200_000; i++) {
            stmt = new Stmt.Seq(stmt, assign("x", intLit(i)));
        }

        assertThat(normalizer.normalize(stmt)).isSameAs(stmt);
        assertThat(normalizer.flattenAllIfElseChains(stmt)).isSameAs(stmt);
        assertThat(normalizer.branchTerminates(new Stmt.Seq(stmt, ret(intLit(1))))).isTrue();
        assertThat(normalizer.unflattenIfElseChain(stmt)).isInstanceOf(Stmt.Seq.class);
    }

    @Test
    void longSequenceIsNormalizedIteratively() {
        Stmt[] stmts = new Stmt[20_000];
        for (int i = 0; i < stmts.length; i++) {
            stmts[i] = i % 2 == 0 ? noop() : assign("x", intLit(i));
        }

        Stmt normalized = normalizer.normalize(seq(stmts));

        List<Stmt> parts = new ArrayList<>();
        Stmt current = normalized;
        while (current instanceof Stmt.Seq s) {
            parts.add(s.first());
            current = s.second();
        }
        parts.add(current);
        assertThat(parts).hasSize(10_000).doesNotContain(noop());
    }
}
