package dhcore.engine;

import static org.junit.jupiter.api.Assertions.*;

import dhcore.model.Season;
import org.junit.jupiter.api.Test;

class SeasonClassifierTest {

    @Test
    void boundariesAreInclusive() {
        assertEquals(Season.WINTER, SeasonClassifier.classify(3, 20));
        assertEquals(Season.SPRING, SeasonClassifier.classify(3, 21));
        assertEquals(Season.SPRING, SeasonClassifier.classify(6, 20));
        assertEquals(Season.SUMMER, SeasonClassifier.classify(6, 21));
        assertEquals(Season.SUMMER, SeasonClassifier.classify(9, 20));
        assertEquals(Season.FALL, SeasonClassifier.classify(9, 21));
        assertEquals(Season.FALL, SeasonClassifier.classify(12, 20));
        assertEquals(Season.WINTER, SeasonClassifier.classify(12, 21));
    }

    @Test
    void yearEdges() {
        assertEquals(Season.WINTER, SeasonClassifier.classify(1, 1));
        assertEquals(Season.WINTER, SeasonClassifier.classify(12, 31));
        assertEquals(Season.WINTER, SeasonClassifier.classify(2, 29));
    }

    @Test
    void singleDigitMonthsOrderByCalendar() {
        // "1010" < "921" как строки, но 10 октября позже 21 сентября
        assertEquals(Season.FALL, SeasonClassifier.classify(10, 10));
        assertEquals(Season.SPRING, SeasonClassifier.classify(4, 1));
        assertEquals(Season.SUMMER, SeasonClassifier.classify(8, 31));
    }
}
