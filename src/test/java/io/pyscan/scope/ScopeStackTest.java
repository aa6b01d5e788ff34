package io.pyscan.scope;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScopeStackTest {

    @Test
    void global_startsWithSingleFrame() {
        ScopeStack scope = ScopeStack.global();

        assertThat(scope.depth()).isEqualTo(1);
        assertThat(scope.isGlobal()).isTrue();
    }

    @Test
    void pop_atGlobalFrame_isNoOp() {
        ScopeStack scope = ScopeStack.global();
        scope.define("x");

        ScopeStack popped = scope.pop();

        assertThat(popped).isSameAs(scope);
        assertThat(popped.isVisible("x")).isTrue();
    }

    @Test
    void isVisible_seesOuterFrames() {
        ScopeStack global = ScopeStack.global();
        global.define("outer");
        ScopeStack inner = global.push();
        inner.define("local");

        assertThat(inner.isVisible("outer")).isTrue();
        assertThat(inner.isVisible("local")).isTrue();
        assertThat(inner.depth()).isEqualTo(2);
    }

    @Test
    void define_onlyAffectsInnermostFrame() {
        ScopeStack global = ScopeStack.global();
        ScopeStack inner = global.push();
        inner.define("local");

        assertThat(global.isVisible("local")).isFalse();
        assertThat(inner.pop()).isSameAs(global);
    }

    @Test
    void define_shadowingKeepsOuterBinding() {
        ScopeStack global = ScopeStack.global();
        global.define("x");
        ScopeStack inner = global.push();
        inner.define("x");

        assertThat(inner.definesLocally("x")).isTrue();
        assertThat(inner.pop().isVisible("x")).isTrue();
    }

    @Test
    void define_ignoresEmptyNames() {
        ScopeStack scope = ScopeStack.global();
        scope.define(null);
        scope.define("");

        assertThat(scope.isVisible("")).isFalse();
    }

    @Test
    void define_underscoreNamesAreOrdinary() {
        ScopeStack scope = ScopeStack.global();
        scope.define("_private");

        assertThat(scope.isVisible("_private")).isTrue();
    }

    @Test
    void bindingFrame_skipsComprehensionFrames() {
        ScopeStack function = ScopeStack.global().push();
        ScopeStack outer = function.pushComprehension();
        ScopeStack inner = outer.pushComprehension();

        assertThat(inner.isComprehension()).isTrue();
        assertThat(inner.bindingFrame()).isSameAs(function);
        assertThat(function.bindingFrame()).isSameAs(function);

        inner.bindingFrame().define("y");
        assertThat(function.definesLocally("y")).isTrue();
        assertThat(inner.definesLocally("y")).isFalse();
    }
}
