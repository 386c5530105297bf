package io.memcsv.frame;

import io.memcsv.core.ArityMismatchException;
import io.memcsv.core.CrossTableException;
import io.memcsv.core.UnknownColumnException;
import io.memcsv.kernel.Mask;
import io.memcsv.testutil.TestTables;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataFrameTest {

    private final DataFrame df = DataFrame.of(TestTables.abc());

    @Test
    void readShouldSelectEverything() {
        var frame = DataFrame.read(TestTables.fixture());

        assertThat(frame.rows()).isEqualTo(5);
        assertThat(frame.cols()).isEqualTo(4);
        assertThat(frame.arity()).isEmpty();
        assertThat(frame.header()).containsExactly("col1", "col2", "col3", "col4");
    }

    @Test
    void readWithExpectedColumnsShouldPinArity() {
        assertThat(DataFrame.read(TestTables.fixture(), 4).arity()).hasValue(4);
        assertThatThrownBy(() -> DataFrame.read(TestTables.fixture(), 3))
                .isInstanceOf(ArityMismatchException.class);
    }

    @Test
    @DisplayName("Filtering b < 25 keeps two rows whose a values are 1 and 2")
    void endToEndScenario() {
        var filtered = df.select("b").lt(25);

        assertThat(filtered.rows()).isEqualTo(2);
        assertThat(df.select("a").selectRows(filtered).colToList(Integer.class)).containsExactly(1, 2);
    }

    @Test
    void selectShouldProjectNamedColumns() {
        var projected = df.select("c", "a");

        assertThat(projected.cols()).isEqualTo(2);
        assertThat(projected.rows()).isEqualTo(3);
        assertThat(projected.arity()).hasValue(2);
        assertThat(projected.columnNames()).containsExactly("a", "c");
        assertThat(projected.colMask()).isEqualTo(Mask.of(3, 0, 2));
    }

    @Test
    void selectShouldRejectUnknownColumn() {
        assertThatThrownBy(() -> df.select("a", "nope"))
                .isInstanceOf(UnknownColumnException.class)
                .hasMessageContaining("'nope'");
    }

    @Test
    void duplicateNamesShouldCollapseToOneColumn() {
        var projected = df.select("b", "b");

        assertThat(projected.cols()).isEqualTo(1);
        assertThat(projected.arity()).hasValue(1);
    }

    @Test
    void projectionShouldBeIdempotent() {
        var once = df.select("a", "b");
        var twice = once.select("a", "b");

        assertThat(twice.colMask()).isEqualTo(once.colMask());
        assertThat(twice.cols()).isEqualTo(once.cols());
        assertThat(twice.rowMask()).isEqualTo(once.rowMask());
    }

    @Test
    @DisplayName("Transforms never change the receiver and always share the table")
    void transformsShouldNotMutateReceiver() {
        var rowMask = df.rowMask();
        var colMask = df.colMask();

        var derived = List.of(
                df.select("a"),
                df.select("b").gt(10),
                df.select("a").eq(1).or(df.select("a").eq(3)),
                df.selectCols(df.select("c")),
                df.expectCols(3));

        assertThat(df.rowMask()).isSameAs(rowMask).isEqualTo(Mask.allSet(3));
        assertThat(df.colMask()).isSameAs(colMask).isEqualTo(Mask.allSet(3));
        assertThat(df.rows()).isEqualTo(3);
        assertThat(df.cols()).isEqualTo(3);
        assertThat(derived).allSatisfy(frame -> assertThat(frame.table()).isSameAs(df.table()));
    }

    @Test
    void andOrShouldCombineRowMasksElementWise() {
        var a = df.select("a").gt(1);
        var b = df.select("a").lt(3);

        var and = a.and(b);
        var or = a.or(b);

        for (int i = 0; i < 3; i++) {
            assertThat(and.rowMask().get(i)).isEqualTo(a.rowMask().get(i) && b.rowMask().get(i));
            assertThat(or.rowMask().get(i)).isEqualTo(a.rowMask().get(i) || b.rowMask().get(i));
        }
        assertThat(and.rowMask().toIntArray()).containsExactly(1);
        assertThat(or.rowMask().toIntArray()).containsExactly(0, 1, 2);
    }

    @Test
    void combinationShouldKeepColumnsOfLeftFrame() {
        var combined = df.select("a").gt(1).and(df.select("b").lt(25));

        assertThat(combined.columnNames()).containsExactly("a");
        assertThat(combined.rowMask().toIntArray()).containsExactly(1);
    }

    @Test
    void combinationShouldRejectMismatchedArity() {
        var one = df.select("a").gt(1);
        var two = df.select("a", "b").lt(5, 25);

        assertThatThrownBy(() -> one.and(two)).isInstanceOf(ArityMismatchException.class);
        assertThatThrownBy(() -> one.or(two)).isInstanceOf(ArityMismatchException.class);
    }

    @Test
    @DisplayName("A pinned column count cannot be combined with an unpinned one, in either order")
    void combinationShouldRejectPinnedWithUnpinned() {
        var pinned = df.select("b").lt(25);

        assertThatThrownBy(() -> pinned.and(df))
                .isInstanceOf(ArityMismatchException.class)
                .hasMessageContaining("pinned to 1")
                .hasMessageContaining("unpinned");
        assertThatThrownBy(() -> df.or(pinned))
                .isInstanceOf(ArityMismatchException.class)
                .hasMessageContaining("unpinned");
    }

    @Test
    void combinationShouldAcceptTwoUnpinnedFrames() {
        var upper = df.selectRows(df.select("a").ge(2));

        assertThat(df.and(upper).rowMask().toIntArray()).containsExactly(1, 2);
        assertThat(df.and(upper).arity()).isEmpty();
    }

    @Test
    @DisplayName("Frames over different tables cannot be combined")
    void crossTableOperationsShouldFail() {
        var other = DataFrame.of(TestTables.abc());

        assertThatThrownBy(() -> df.and(other)).isInstanceOf(CrossTableException.class);
        assertThatThrownBy(() -> df.or(other)).isInstanceOf(CrossTableException.class);
        assertThatThrownBy(() -> df.selectRows(other)).isInstanceOf(CrossTableException.class);
        assertThatThrownBy(() -> df.selectCols(other)).isInstanceOf(CrossTableException.class);
    }

    @Test
    void selectRowsShouldTakeRowsFromOtherFrame() {
        var filtered = df.select("c").eq("z");

        var selected = df.selectRows(filtered);

        assertThat(selected.rowMask()).isEqualTo(filtered.rowMask());
        assertThat(selected.colMask()).isEqualTo(df.colMask());
    }

    @Test
    @DisplayName("Rows filtered on one column subset apply to a different column subset")
    void selectRowsShouldIgnoreArityOfOtherFrame() {
        var filtered = df.select("a", "c").selectRows(df.select("b").gt(10));

        assertThat(filtered.columnNames()).containsExactly("a", "c");
        assertThat(filtered.arity()).hasValue(2);
        assertThat(filtered.rowMask().toIntArray()).containsExactly(1, 2);
    }

    @Test
    void selectColsShouldTakeColumnsFromOtherFrame() {
        var filtered = df.selectRows(df.select("a").ge(2));

        var selected = filtered.selectCols(df.select("b", "c"));

        assertThat(selected.rowMask()).isEqualTo(filtered.rowMask());
        assertThat(selected.columnNames()).containsExactly("b", "c");
    }

    @Test
    void selectColsShouldRecheckPinnedArity() {
        assertThatThrownBy(() -> df.select("a").selectCols(df.select("b", "c")))
                .isInstanceOf(ArityMismatchException.class)
                .hasMessageContaining("expected 1 column(s) but got 2");
    }

    @Test
    void expectColsShouldValidateActiveColumns() {
        assertThat(df.select("a", "b").expectCols(2).arity()).hasValue(2);
        assertThatThrownBy(() -> df.expectCols(2)).isInstanceOf(ArityMismatchException.class);
        assertThatThrownBy(() -> df.expectCols(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNullArguments() {
        assertThatThrownBy(() -> df.and(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> df.select((String[]) null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DataFrame.of(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
