package com.dbprobe.repositories.oracle;

import com.dbprobe.core.catalog.ObjectType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceMatchAccumulatorTest {
    private static final SourceObjectKey PKG = new SourceObjectKey("APP", "PKG_LOAD", ObjectType.PACKAGE_BODY);
    private static final SourceObjectKey PRC = new SourceObjectKey("APP", "PRC_LOAD", ObjectType.PROCEDURE);

    @Test
    void bothCriteriaMayBeSatisfiedOnDifferentLines() {
        SourceMatchAccumulator accumulator = new SourceMatchAccumulator("DIM_CUSTOMER", "COMMIT", false);
        accumulator.accept(PKG, 40, "INSERT INTO dim_customer");
        accumulator.accept(PKG, 12, "commit;");
        accumulator.accept(PRC, 5, "SELECT * FROM DIM_CUSTOMER");

        assertEquals(List.of(PKG), accumulator.selected(10));
        assertEquals(List.of(12, 40), accumulator.matchingLines(PKG));
        assertEquals(2, accumulator.matchCount(PKG));
    }

    @Test
    void singleCriterionSelectsEveryObjectThatMatchesIt() {
        SourceMatchAccumulator accumulator = new SourceMatchAccumulator(null, "^\\s*commit", true);
        accumulator.accept(PRC, 9, "   COMMIT;");
        accumulator.accept(PKG, 3, "-- no commit here");

        assertEquals(List.of(PRC), accumulator.selected(10));
    }

    @Test
    void matchingLineNumbersAreCapped() {
        SourceMatchAccumulator accumulator = new SourceMatchAccumulator("T", null, false);
        for (int line = 150; line >= 1; line--) {
            accumulator.accept(PRC, line, "t");
        }

        assertEquals(150, accumulator.matchCount(PRC));
        assertEquals(SourceMatchAccumulator.MAX_LINE_NUMBERS, accumulator.matchingLines(PRC).size());
        assertEquals(1, accumulator.matchingLines(PRC).get(0));
    }

    @Test
    void selectionIsOrderedAndLimited() {
        SourceMatchAccumulator accumulator = new SourceMatchAccumulator("X", null, false);
        SourceObjectKey spec = new SourceObjectKey("APP", "PKG_LOAD", ObjectType.PACKAGE);
        accumulator.accept(PRC, 1, "x");
        accumulator.accept(PKG, 1, "x");
        accumulator.accept(spec, 1, "x");

        assertEquals(List.of(spec, PKG), accumulator.selected(2));
    }
}
