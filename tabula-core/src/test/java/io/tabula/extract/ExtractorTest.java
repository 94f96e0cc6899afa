package io.tabula.extract;

import io.tabula.core.Cell;
import io.tabula.core.ColumnSpecException;
import io.tabula.core.TabulaConfiguration;
import io.tabula.core.TabulaConfiguration.AccessStrategy;
import io.tabula.core.ValueKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractorTest {

    private static List<Cell> row(Extractor<?> extractor, int row) {
        List<Cell> cells = new ArrayList<>();
        for (Column column : extractor.columns()) {
            cells.add(column.valueAt(row));
        }
        return cells;
    }

    private static TabulaConfiguration with(AccessStrategy strategy) {
        return TabulaConfiguration.builder().accessStrategy(strategy).build();
    }

    @ParameterizedTest(name = "nullable reference scenario with {0}")
    @EnumSource(AccessStrategy.class)
    void shouldReadFieldsAndNullableReferences(AccessStrategy strategy) {
        List<Measurement> data = List.of(
                new Measurement(3.14, "Hello", 8),
                new Measurement(2.72, "Go", null));

        Extractor<Measurement> extractor = Extractor.create(Measurement.class, data, with(strategy),
                "value", "label", "count");

        assertThat(extractor.rowCount()).isEqualTo(2);
        assertThat(extractor.columns()).extracting(Column::name).containsExactly("value", "label", "count");
        assertThat(extractor.columns()).extracting(Column::kind)
                .containsExactly(ValueKind.FLOAT, ValueKind.TEXT, ValueKind.INTEGER);
        assertThat(row(extractor, 0)).containsExactly(Cell.of(3.14), Cell.of("Hello"), Cell.of(8L));
        assertThat(row(extractor, 1)).containsExactly(Cell.of(2.72), Cell.of("Go"), Cell.absent());
    }

    @ParameterizedTest(name = "failing accessor scenario with {0}")
    @EnumSource(AccessStrategy.class)
    void shouldTurnFailingAccessorIntoAbsentRow(AccessStrategy strategy) {
        List<Member> data = List.of(new Member(true, false), new Member(true, true));

        Extractor<Member> extractor = Extractor.create(Member.class, data, with(strategy), "group");

        Column group = extractor.columns().get(0);
        assertThat(group.kind()).isEqualTo(ValueKind.BOOLEAN);
        assertThat(group.mayBeAbsent()).isTrue();
        assertThat(group.valueAt(0)).isEqualTo(Cell.of(true));
        assertThat(group.valueAt(1)).isSameAs(Cell.absent());
    }

    @ParameterizedTest(name = "nested null scenario with {0}")
    @EnumSource(AccessStrategy.class)
    void shouldOnlyMarkRowWithNullIntermediateAbsent(AccessStrategy strategy) {
        List<Outer> data = List.of(
                new Outer(new Inner("first")),
                new Outer(null),
                new Outer(new Inner("third")));

        Extractor<Outer> extractor = Extractor.create(Outer.class, data, with(strategy), "inner.field");

        Column column = extractor.column("inner.field").orElseThrow();
        assertThat(column.valueAt(0)).isEqualTo(Cell.of("first"));
        assertThat(column.valueAt(1)).isSameAs(Cell.absent());
        assertThat(column.valueAt(2)).isEqualTo(Cell.of("third"));
    }

    @Test
    void shouldTreatNullElementsAsAbsentRows() {
        Extractor<Measurement> extractor = Extractor.create(Measurement.class,
                Arrays.asList(new Measurement(1.0, "a", 1), null), "value", "label");

        assertThat(row(extractor, 1)).containsExactly(Cell.absent(), Cell.absent());
    }

    @Test
    void shouldRejectOutOfRangeRows() {
        Extractor<Measurement> extractor = Extractor.create(Measurement.class,
                List.of(new Measurement(1.0, "a", 1)), "value");

        assertThatThrownBy(() -> extractor.columns().get(0).valueAt(1))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> extractor.columns().get(0).valueAt(-1))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void rebindingShouldNotAffectCompiledColumns() {
        Extractor<Measurement> extractor = Extractor.create(Measurement.class,
                List.of(new Measurement(1.0, "one", 1)), "label", "count");
        Column label = extractor.columns().get(0);

        extractor.bind(List.of(new Measurement(2.0, "two", null), new Measurement(3.0, "three", 3)));

        assertThat(extractor.rowCount()).isEqualTo(2);
        assertThat(extractor.columns().get(0)).isSameAs(label);
        assertThat(row(extractor, 0)).containsExactly(Cell.of("two"), Cell.absent());
        assertThat(row(extractor, 1)).containsExactly(Cell.of("three"), Cell.of(3L));

        extractor.bind(List.of());
        assertThat(extractor.rowCount()).isZero();
    }

    @Test
    void shouldRejectBindingOtherElementType() {
        Extractor<Measurement> extractor = Extractor.create(Measurement.class, List.of(), "value");

        assertThatThrownBy(() -> extractor.bind(ElementType.of(Member.class), List.of(new Member(true, false))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Cannot bind extractor for")
                .hasMessageContaining("Member");

        extractor.bind(ElementType.of(Measurement.class), List.of(new Measurement(5.0, "x", 5)));
        assertThat(extractor.rowCount()).isEqualTo(1);
    }

    @Test
    void shouldExtractFromOptionalElements() {
        ElementType<Optional<Measurement>> type = new ElementType<>() { };
        List<Optional<Measurement>> data = List.of(Optional.of(new Measurement(1.5, "a", 1)), Optional.empty());

        Extractor<Optional<Measurement>> extractor = Extractor.create(type, data, "value");

        assertThat(extractor.recordType()).isEqualTo(Measurement.class);
        assertThat(extractor.primaryIndirection()).isEqualTo(1);
        assertThat(row(extractor, 0)).containsExactly(Cell.of(1.5));
        assertThat(row(extractor, 1)).containsExactly(Cell.absent());
    }

    @Test
    void shouldFailWholeConstructionOnFirstBadSpec() {
        assertThatThrownBy(() -> Extractor.create(Measurement.class, List.of(), "value", "nope", "label"))
                .isInstanceOf(ColumnSpecException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void columnsShouldSupportRenameReorderAndRemove() {
        Extractor<Measurement> extractor = Extractor.create(Measurement.class,
                List.of(new Measurement(1.0, "a", 2)), "value", "label", "count");
        List<Column> columns = extractor.columns();

        columns.get(0).rename("v");
        Column label = columns.get(1);
        columns.set(1, columns.get(2));
        columns.set(2, label);
        columns.remove(0);

        assertThat(columns).extracting(Column::name).containsExactly("count", "label");
        assertThat(columns.get(0).path().spec()).isEqualTo("count");
        assertThat(row(extractor, 0)).containsExactly(Cell.of(2L), Cell.of("a"));
        assertThat(extractor.column("v")).isEmpty();
        assertThat(extractor.column("label")).contains(label);
    }

    @Test
    void columnsShouldRejectForeignColumnsAndAdditions() {
        Extractor<Measurement> first = Extractor.create(Measurement.class, List.of(), "value");
        Extractor<Measurement> second = Extractor.create(Measurement.class, List.of(), "value");

        assertThatThrownBy(() -> first.columns().set(0, second.columns().get(0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> first.columns().add(second.columns().get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> first.columns().get(0).rename(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectPrimitiveOptionalElements() {
        ElementType<OptionalInt> type = ElementType.of(OptionalInt.class);

        assertThatThrownBy(() -> Extractor.create(type, List.of(), "value"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static class Measurement {
        private final double value;
        private final String label;
        private final Integer count;

        Measurement(double value, String label, Integer count) {
            this.value = value;
            this.label = label;
            this.count = count;
        }
    }

    static class Member {
        private final boolean grouped;
        private final boolean failing;

        Member(boolean grouped, boolean failing) {
            this.grouped = grouped;
            this.failing = failing;
        }

        boolean group() throws Exception {
            if (failing) {
                throw new Exception("no group");
            }
            return grouped;
        }
    }

    static class Outer {
        private final Inner inner;

        Outer(Inner inner) {
            this.inner = inner;
        }
    }

    static class Inner {
        private final String field;

        Inner(String field) {
            this.field = field;
        }
    }
}
