package org.tlin.minilogic.benchmark.domain;

import java.util.ArrayList;
import java.util.List;

import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.Ir;
import org.tlin.minilogic.ir.Stmt;

/**
 * Rewrite pairs shaped like the ones lint rules produce.
 */
public final class RewriteFixtures {

    private RewriteFixtures() {}

    public static final String NESTED_SNIPPET =
            "if (influence > 50) { return 1; } else if (atWar) { return 2; } else { log(stability); return 3; }";

    public static final String FLAT_SNIPPET =
            "if (influence > 50) { return 1; } if (atWar) { return 2; } log(stability); return 3;";

    /**
     * {@code if c0 {return 0} else if c1 {return 1} ... else {return -1}} over symbolic conditions.
     */
    public static Stmt nestedChain(int length) {
        Stmt chain = Ir.ret(Ir.intLit(-1));
        for (int i = length - 1; i >= 0; i--) {
            chain = Ir.ifElse(condition(i), Ir.ret(Ir.intLit(i)), chain);
        }
        return chain;
    }

    public static Stmt flatChain(int length) {
        List<Stmt> flat = new ArrayList<>(length + 1);
        for (int i = 0; i < length; i++) {
            flat.add(Ir.ifThen(condition(i), Ir.ret(Ir.intLit(i))));
        }
        flat.add(Ir.ret(Ir.intLit(-1)));
        return Ir.seq(flat);
    }

    /**
     * A long straight-line body: assignments interleaved with opaque calls.
     */
    public static Stmt straightLine(int statements) {
        List<Stmt> body = new ArrayList<>(statements);
        for (int i = 0; i < statements; i++) {
            body.add(i % 4 == 0
                    ? Ir.callStmt("audit", Ir.var("x"))
                    : Ir.assign("x", Ir.add(Ir.var("x"), Ir.intLit(i))));
        }
        return Ir.seq(body);
    }

    private static Expr condition(int i) {
        return Ir.gt(Ir.var("v" + i), Ir.intLit(i));
    }
}
