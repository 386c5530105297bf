package io.memcsv.frame;

import io.memcsv.core.ArityMismatchException;
import io.memcsv.core.ConversionException;
import io.memcsv.core.MemcsvConfiguration;
import io.memcsv.core.converter.ConversionPolicy;
import io.memcsv.kernel.CsvTable;
import io.memcsv.kernel.Predicate;
import io.memcsv.testutil.TestTables;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataFrameComparisonTest {

    private final DataFrame abc = DataFrame.of(TestTables.abc());
    private final DataFrame fixture = DataFrame.read(TestTables.fixture());

    static Stream<Arguments> operators() {
        return Stream.of(
                Arguments.of(Predicate.Operator.EQ, new int[]{1}),
                Arguments.of(Predicate.Operator.NEQ, new int[]{0, 2}),
                Arguments.of(Predicate.Operator.LT, new int[]{0}),
                Arguments.of(Predicate.Operator.LTE, new int[]{0, 1}),
                Arguments.of(Predicate.Operator.GT, new int[]{2}),
                Arguments.of(Predicate.Operator.GTE, new int[]{1, 2}));
    }

    @ParameterizedTest
    @MethodSource("operators")
    void shouldFilterWithEveryOperator(Predicate.Operator operator, int[] expectedRows) {
        var filtered = abc.select("b").compare(operator, 20);

        assertThat(filtered.rowMask().toIntArray()).containsExactly(expectedRows);
        assertThat(filtered.arity()).hasValue(1);
    }

    @Test
    void shorthandMethodsShouldMatchOperators() {
        var b = abc.select("b");

        assertThat(b.eq(20).rowMask()).isEqualTo(b.compare(Predicate.Operator.EQ, 20).rowMask());
        assertThat(b.neq(20).rowMask()).isEqualTo(b.compare(Predicate.Operator.NEQ, 20).rowMask());
        assertThat(b.lt(20).rowMask()).isEqualTo(b.compare(Predicate.Operator.LT, 20).rowMask());
        assertThat(b.le(20).rowMask()).isEqualTo(b.compare(Predicate.Operator.LTE, 20).rowMask());
        assertThat(b.gt(20).rowMask()).isEqualTo(b.compare(Predicate.Operator.GT, 20).rowMask());
        assertThat(b.ge(20).rowMask()).isEqualTo(b.compare(Predicate.Operator.GTE, 20).rowMask());
    }

    @Test
    @DisplayName("A row passes a multi-column comparison only if every column passes")
    void multiColumnComparisonShouldRequireAllColumns() {
        var filtered = abc.select("a", "c").eq(2, "y");

        assertThat(filtered.rowMask().toIntArray()).containsExactly(1);
        assertThat(filtered.arity()).hasValue(2);
    }

    @Test
    @DisplayName("!= keeps every row where at least one column differs")
    void neqShouldNegateWholeRowEquality() {
        var filtered = abc.select("a", "c").neq(1, "y");

        // no row has both a == 1 and c == "y", so every row survives
        assertThat(filtered.rows()).isEqualTo(3);
        assertThat(abc.select("a", "c").neq(1, "x").rowMask().toIntArray()).containsExactly(1, 2);
    }

    @Test
    void neqShouldKeepExcludedRowsExcluded() {
        var filtered = abc.select("a").gt(1).neq(3);

        assertThat(filtered.rowMask().toIntArray()).containsExactly(1);
    }

    @Test
    void chainedFiltersShouldNarrowRows() {
        var filtered = abc.select("b").gt(10).lt(30);

        assertThat(filtered.rowMask().toIntArray()).containsExactly(1);
    }

    @Test
    void shouldCompareStrings() {
        assertThat(abc.select("c").ge("y").rowMask().toIntArray()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Reference tuple length must match the active column count")
    void shouldRejectMismatchedReferenceCount() {
        assertThatThrownBy(() -> abc.select("a", "b").lt(1))
                .isInstanceOf(ArityMismatchException.class);
        assertThatThrownBy(() -> abc.eq(1))
                .isInstanceOf(ArityMismatchException.class);
        assertThatThrownBy(() -> abc.select("a").eq(1, 2))
                .isInstanceOf(ArityMismatchException.class);
    }

    @Test
    void shouldRejectComparisonAgainstPinnedArity() {
        var pinned = abc.expectCols(3);

        assertThatThrownBy(() -> pinned.eq(1, 2))
                .isInstanceOf(ArityMismatchException.class)
                .hasMessageContaining("expected 3 column(s) but got 2");
    }

    @Test
    void emptyNumericCellsCompareAsZero() {
        assertThat(fixture.select("col2").lt(10).rowMask().toIntArray()).containsExactly(0, 2, 4);
    }

    @Test
    void doubleReferencesShouldConvertCellsToDouble() {
        assertThat(fixture.select("col3").gt(200.0).rowMask().toIntArray()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Strict conversion rejects decimal cells compared with an integer")
    void strictConversionShouldFail() {
        assertThatThrownBy(() -> fixture.select("col3").gt(200))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("'100.5'");
    }

    @Test
    void lenientConversionShouldTreatUnparseableCellsAsZero() {
        var lenient = DataFrame.read(TestTables.fixture(),
                MemcsvConfiguration.builder().conversionPolicy(ConversionPolicy.LENIENT).build());

        assertThat(lenient.select("col3").gt(200).rows()).isZero();
        assertThat(lenient.select("col3").eq(0).rows()).isEqualTo(5);
    }

    @Test
    void orOfTwoFiltersShouldSelectRowsOfFullFrame() {
        var selected = fixture.selectRows(
                fixture.select("col2").lt(10).or(fixture.select("col3").gt(200.0)));

        assertThat(selected.cols()).isEqualTo(4);
        assertThat(selected.select("col1").colToList(Integer.class)).containsExactly(1, 2, 3, 4);
    }

    @Test
    void isInShouldKeepRowsWithMemberValues() {
        var filtered = fixture.select("col1").isIn(Set.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));

        assertThat(filtered.rowMask().toIntArray()).containsExactly(0, 1, 2, 4);
        assertThat(filtered.arity()).hasValue(1);
    }

    @Test
    void isInWithEmptyCollectionKeepsNothing() {
        assertThat(fixture.select("col1").isIn(List.of()).rows()).isZero();
    }

    @Test
    void isInShouldRequireSingleColumn() {
        assertThatThrownBy(() -> fixture.select("col1", "col2").isIn(Set.of(1)))
                .isInstanceOf(ArityMismatchException.class);
    }

    @Test
    void isInShouldRejectMixedValueTypes() {
        assertThatThrownBy(() -> fixture.select("col1").isIn(List.of(1, "2")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("share one type");
    }

    @Test
    @DisplayName("An empty reference tuple is a column count mismatch like any other")
    void emptyReferencesShouldFailWithArityMismatch() {
        assertThatThrownBy(() -> abc.select("a", "b").eq())
                .isInstanceOf(ArityMismatchException.class)
                .hasMessageContaining("expected 2 column(s) but got 0");
    }

    @Test
    void zeroColumnFrameShouldKeepIncludedRowsForEmptyReferences() {
        var upper = abc.selectRows(abc.select("a").ge(2)).select();

        var filtered = upper.eq();

        assertThat(filtered.cols()).isZero();
        assertThat(filtered.rowMask().toIntArray()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Floating-point membership matches the way equality does")
    void isInShouldCompareFloatingPointLikeEq() {
        var frame = DataFrame.of(CsvTable.of("floats", List.of("x"),
                List.of(List.of("0.0"), List.of("NaN"), List.of("1.5"))));

        assertThat(frame.isIn(Set.of(-0.0)).rowMask().toIntArray())
                .containsExactly(frame.eq(-0.0).rowMask().toIntArray())
                .containsExactly(0);
        assertThat(frame.isIn(List.of(Double.NaN)).rows()).isZero();
        assertThat(frame.eq(Double.NaN).rows()).isZero();
        assertThat(frame.isIn(List.of(1.5f)).rowMask().toIntArray()).containsExactly(2);
    }

    @Test
    void orderingShouldRequireComparableReferences() {
        assertThatThrownBy(() -> abc.select("a").lt(new Object()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
