package org.tlin.minilogic.ir;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tlin.minilogic.ir.Ir.*;

class StmtTest {

    private static Stmt counting(int length, int last) {
        Stmt[] stmts = new Stmt[length];
        for (int i = 0; i < length; i++) {
            stmts[i] = assign("x", intLit(i == length - 1 ? last : i));
        }
        return seq(stmts);
    }

    @Test
    void longSequencesCompareWithoutDeepRecursion() {
        Stmt a = counting(200_000, -1);
        Stmt b = counting(200_000, -1);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(counting(200_000, -2));
        assertThat(a).isNotEqualTo(counting(199_999, -1));
    }

    @Test
    void sequenceEqualityIsStructural() {
        Stmt x = assign("x", intLit(1));
        Stmt y = assign("y", intLit(2));
        Stmt z = retVoid();

        assertThat(new Stmt.Seq(x, new Stmt.Seq(y, z))).isEqualTo(seq(x, y, z));
        assertThat(new Stmt.Seq(new Stmt.Seq(x, y), z)).isNotEqualTo(seq(x, y, z));
        assertThat(new Stmt.Seq(x, y)).isNotEqualTo(x).isNotEqualTo(null);
        assertThat(x).isNotEqualTo(new Stmt.Seq(x, y));
    }
}
