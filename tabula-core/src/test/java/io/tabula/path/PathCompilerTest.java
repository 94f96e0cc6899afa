package io.tabula.path;

import com.google.common.primitives.UnsignedLong;
import io.tabula.core.Cell;
import io.tabula.core.ColumnSpecException;
import io.tabula.core.ColumnSpecException.Reason;
import io.tabula.core.TabulaConfiguration;
import io.tabula.core.TabulaConfiguration.AccessStrategy;
import io.tabula.core.TabulaConfiguration.MemberVisibility;
import io.tabula.core.ValueKind;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathCompilerTest {

    private final PathCompiler compiler = new PathCompiler();

    @Test
    void shouldCompileSingleField() {
        CompiledPath path = compiler.compile(Order.class, "id");

        assertThat(path.kind()).isEqualTo(ValueKind.INTEGER);
        assertThat(path.steps()).hasSize(1);
        assertThat(path.steps().get(0)).isInstanceOf(AccessStep.FieldStep.class);
        assertThat(path.steps().get(0).nullable()).isFalse();
        assertThat(path.mayBeAbsent()).isFalse();
        assertThat(path.name()).isEqualTo("id");
    }

    @Test
    void shouldPreferFieldOverAccessorWithSameName() {
        CompiledPath path = compiler.compile(Order.class, "total");

        assertThat(path.steps().get(0)).isInstanceOf(AccessStep.FieldStep.class);
        assertThat(path.kind()).isEqualTo(ValueKind.FLOAT);
    }

    @Test
    void shouldCompileNestedPathThroughAccessorsAndOptionals() {
        CompiledPath path = compiler.compile(Order.class, "customer.nickname");

        assertThat(path.steps()).hasSize(2);
        AccessStep nickname = path.steps().get(1);
        assertThat(nickname).isInstanceOf(AccessStep.CallStep.class);
        assertThat(nickname.layers()).containsExactly(OptionalLayer.OBJECT);
        assertThat(path.kind()).isEqualTo(ValueKind.TEXT);
        assertThat(path.mayBeAbsent()).isTrue();
        assertThat(path.terminalType()).isEqualTo(String.class);
    }

    @Test
    void shouldStripNestedAndPrimitiveOptionals() {
        CompiledPath nested = compiler.compile(Order.class, "discount");
        CompiledPath primitive = compiler.compile(Order.class, "rating");

        assertThat(nested.steps().get(0).layers()).containsExactly(OptionalLayer.OBJECT, OptionalLayer.OBJECT);
        assertThat(nested.kind()).isEqualTo(ValueKind.FLOAT);
        assertThat(primitive.steps().get(0).layers()).containsExactly(OptionalLayer.INT);
        assertThat(primitive.kind()).isEqualTo(ValueKind.INTEGER);
    }

    @Test
    void shouldMarkAccessorsWithThrowsClauseAsMayFail() {
        CompiledPath path = compiler.compile(Order.class, "customer.score");

        assertThat(path.steps().get(1).mayFail()).isTrue();
        assertThat(path.steps().get(1).nullable()).isFalse();
        assertThat(path.toString()).contains("score()!");
    }

    @Test
    void shouldFlagUnsignedTerminals() {
        CompiledPath path = compiler.compile(Order.class, "checksum");

        assertThat(path.kind()).isEqualTo(ValueKind.INTEGER);
        assertThat(path.unsigned()).isTrue();
    }

    @Test
    void shouldResolveInheritedPrivateField() {
        CompiledPath path = compiler.compile(Order.class, "createdBy");

        assertThat(path.kind()).isEqualTo(ValueKind.TEXT);
        assertThat(path.steps().get(0)).isInstanceOf(AccessStep.FieldStep.class);
    }

    @Test
    void shouldUseAccessorWhenSameNamedFieldIsNotReadable() {
        Order order = new Order();
        order.items = new ArrayList<>(List.of("a", "b"));
        order.amount = new BigDecimal("12.345");

        CompiledPath size = compiler.compile(Order.class, "items.size");
        CompiledPath scale = compiler.compile(Order.class, "amount.scale");

        assertThat(size.steps().get(1)).isInstanceOf(AccessStep.CallStep.class);
        assertThat(size.kind()).isEqualTo(ValueKind.INTEGER);
        assertThat(scale.steps().get(1)).isInstanceOf(AccessStep.CallStep.class);
        assertThat(scale.kind()).isEqualTo(ValueKind.INTEGER);
        for (AccessStrategy strategy : AccessStrategy.values()) {
            assertThat(PathReader.of(size, 0, strategy).read(order)).isEqualTo(Cell.of(2L));
            assertThat(PathReader.of(scale, 0, strategy).read(order)).isEqualTo(Cell.of(3L));
        }
    }

    @Test
    void shouldFallBackToToStringForUnclassifiedTerminal() {
        CompiledPath path = compiler.compile(Order.class, "amount");

        assertThat(path.kind()).isEqualTo(ValueKind.TEXT);
        assertThat(path.steps()).hasSize(2);
        assertThat(path.steps().get(1).synthetic()).isTrue();
        assertThat(path.name()).isEqualTo("amount");
    }

    @Test
    void shouldRejectUnclassifiedTerminalWhenFallbackDisabled() {
        PathCompiler strict = new PathCompiler(TabulaConfiguration.builder().stringFallback(false).build());

        assertThatThrownBy(() -> strict.compile(Order.class, "amount"))
                .isInstanceOf(ColumnSpecException.class)
                .hasMessageContaining("Cannot use type java.math.BigDecimal as final element")
                .satisfies(e -> assertThat(((ColumnSpecException) e).reason())
                        .isEqualTo(Reason.UNSUPPORTED_TERMINAL_TYPE));
    }

    @Test
    void shouldRejectTerminalWithoutStringConversion() {
        assertThatThrownBy(() -> compiler.compile(Order.class, "customer"))
                .isInstanceOf(ColumnSpecException.class)
                .satisfies(e -> {
                    ColumnSpecException ex = (ColumnSpecException) e;
                    assertThat(ex.reason()).isEqualTo(Reason.UNSUPPORTED_TERMINAL_TYPE);
                    assertThat(ex.segment()).isEqualTo("customer");
                    assertThat(ex.rootType()).isEqualTo(Order.class);
                });
        assertThatThrownBy(() -> compiler.compile(Order.class, "tags"))
                .isInstanceOf(ColumnSpecException.class)
                .hasMessageContaining("as final element");
    }

    @Test
    void shouldRejectUnknownMember() {
        assertThatThrownBy(() -> compiler.compile(Order.class, "customer.address"))
                .isInstanceOf(ColumnSpecException.class)
                .hasMessageContaining("No field or accessor address")
                .hasMessageContaining("column 'customer.address'")
                .satisfies(e -> assertThat(((ColumnSpecException) e).segment()).isEqualTo("address"));
    }

    @Test
    void shouldRejectAccessorsTakingArgumentsOrReturningNothing() {
        assertThatThrownBy(() -> compiler.compile(Order.class, "discounted"))
                .isInstanceOf(ColumnSpecException.class)
                .satisfies(e -> assertThat(((ColumnSpecException) e).reason()).isEqualTo(Reason.ACCESSOR_SIGNATURE));
        assertThatThrownBy(() -> compiler.compile(Order.class, "touch"))
                .isInstanceOf(ColumnSpecException.class)
                .hasMessageContaining("returns no value");
    }

    @Test
    void shouldRejectMalformedSpecs() {
        for (String spec : List.of("", " ", "customer..name", ".id", "id.")) {
            assertThatThrownBy(() -> compiler.compile(Order.class, spec))
                    .as(spec)
                    .isInstanceOf(ColumnSpecException.class)
                    .satisfies(e -> assertThat(((ColumnSpecException) e).reason()).isEqualTo(Reason.MALFORMED_SPEC));
        }
    }

    @Test
    void shouldRejectTypeVariablesAndRawOptionals() {
        assertThatThrownBy(() -> compiler.compile(Box.class, "content"))
                .isInstanceOf(ColumnSpecException.class)
                .satisfies(e -> assertThat(((ColumnSpecException) e).reason()).isEqualTo(Reason.UNRESOLVABLE_TYPE));
        assertThatThrownBy(() -> compiler.compile(Box.class, "raw"))
                .isInstanceOf(ColumnSpecException.class)
                .satisfies(e -> assertThat(((ColumnSpecException) e).reason()).isEqualTo(Reason.UNRESOLVABLE_TYPE));
    }

    @Test
    void publicVisibilityShouldHidePrivateMembers() {
        PathCompiler publicOnly = new PathCompiler(TabulaConfiguration.builder()
                .memberVisibility(MemberVisibility.PUBLIC)
                .build());

        assertThat(publicOnly.compile(Order.class, "label").kind()).isEqualTo(ValueKind.TEXT);
        assertThatThrownBy(() -> publicOnly.compile(Order.class, "id"))
                .isInstanceOf(ColumnSpecException.class)
                .satisfies(e -> assertThat(((ColumnSpecException) e).reason()).isEqualTo(Reason.NO_SUCH_MEMBER));
    }

    @Test
    void compilingTwiceShouldYieldEqualPaths() {
        CompiledPath first = compiler.compile(Order.class, "customer.nickname");
        CompiledPath second = compiler.compile(Order.class, "customer.nickname");

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first).isNotEqualTo(compiler.compile(Order.class, "customer.score"));
    }

    @Test
    void shouldRequireRootType() {
        assertThatThrownBy(() -> compiler.compile(null, "id"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static class Audited {
        private String createdBy;
    }

    static class Order extends Audited {
        private long id;
        private double total;
        private Customer customer;
        private Optional<Optional<Double>> discount;
        private OptionalInt rating;
        private UnsignedLong checksum;
        private BigDecimal amount;
        private ArrayList<String> items;
        private Map<String, String> tags;
        public String label;

        double total() {
            return total * 2;
        }

        double discounted(double rate) {
            return total * rate;
        }

        void touch() {
        }
    }

    static class Customer {
        private String name;
        private Duration tenure;

        Optional<String> nickname() {
            return Optional.ofNullable(name);
        }

        int score() throws Exception {
            return 1;
        }
    }

    static class Box<T> {
        private T content;
        @SuppressWarnings("rawtypes")
        private Optional raw;
    }
}
