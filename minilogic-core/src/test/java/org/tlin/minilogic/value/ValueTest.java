package org.tlin.minilogic.value;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueTest {

    @Test
    void equality_isStructuralPerVariant() {
        assertThat(Value.of(1)).isEqualTo(Value.of(1));
        assertThat(Value.of("a")).isEqualTo(Value.of("a"));
        assertThat(Value.of(true)).isSameAs(Value.of(true));
        assertThat(Value.nil()).isEqualTo(Value.nil());
        assertThat(Value.of(1)).isNotEqualTo(Value.of(2));
        assertThat((Value) Value.of(1)).isNotEqualTo(Value.of("1"));
        assertThat((Value) Value.of(0)).isNotEqualTo(Value.of(false));
    }

    @Test
    void symbolic_equalByNameOnly() {
        assertThat(Value.symbolic("ite(c,1,2)")).isEqualTo(Value.symbolic("ite(c,1,2)"));
        assertThat(Value.symbolic("a")).isNotEqualTo(Value.symbolic("b"));
        assertThat(Value.symbolic("a").isSymbolic()).isTrue();
        assertThat(Value.of(1).isSymbolic()).isFalse();
    }

    @Test
    void render_matchesSourceForm() {
        assertThat(Value.of(-42).render()).isEqualTo("-42");
        assertThat(Value.of(true).render()).isEqualTo("true");
        assertThat(Value.of("hi \"there\"").render()).isEqualTo("\"hi \\\"there\\\"\"");
        assertThat(Value.nil().render()).isEqualTo("nil");
        assertThat(Value.symbolic("x").render()).isEqualTo("<x>");
        assertThat(Value.of(7)).hasToString("7");
    }

    @Test
    void truthiness_ofConcreteValues() {
        assertThat(Value.of(true).isTruthy()).isTrue();
        assertThat(Value.of(false).isTruthy()).isFalse();
        assertThat(Value.of(3).isTruthy()).isTrue();
        assertThat(Value.of(0).isTruthy()).isFalse();
        assertThat(Value.of("x").isTruthy()).isTrue();
        assertThat(Value.of("").isTruthy()).isFalse();
        assertThat(Value.nil().isTruthy()).isFalse();
    }

    @Test
    void nullPayloads_areRejected() {
        assertThatThrownBy(() -> Value.of((String) null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Value.symbolic(null)).isInstanceOf(NullPointerException.class);
    }
}
