package buaa.docindex.service.annotation;

import buaa.docindex.common.consts.IndexingConstants;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class KeywordExtractorTest {

    private final KeywordExtractor extractor = new KeywordExtractor();

    @Test
    void ranksWordsByFrequencyThenAppendsBigrams() {
        String text = "The data pipeline processes data quickly and the pipeline scales with data.";

        List<String> keywords = extractor.extract(text);

        assertEquals(List.of(
            "data", "pipeline", "processes", "quickly", "scales",
            "data pipeline", "pipeline processes", "processes data", "data quickly", "pipeline scales"
        ), keywords);
    }

    @Test
    void neverEmitsStopWordsOrShortTokens() {
        String text = "Page 3 of the report: the key result was that all of the 12% growth came in Q4. "
            + "Many teams did more work than most, and some did very little.";

        for (String keyword : extractor.extract(text)) {
            if (keyword.contains(" ")) {
                for (String part : keyword.split(" ")) {
                    assertFalse(IndexingConstants.STOP_WORDS.contains(part), keyword);
                }
            } else {
                assertTrue(keyword.length() >= 4, keyword);
                assertFalse(IndexingConstants.STOP_WORDS.contains(keyword), keyword);
            }
        }
    }

    @Test
    void capsOutputAtTwentyWithoutDuplicates() {
        String text = IntStream.range(0, 60)
            .mapToObj(i -> "keyword" + i + " extra" + i)
            .collect(Collectors.joining(" "));

        List<String> keywords = extractor.extract(text);

        assertEquals(20, keywords.size());
        assertEquals(keywords.size(), new HashSet<>(keywords).size());
    }

    @Test
    void keepsNumbersAndPercentages() {
        List<String> keywords = extractor.extract("Growth hit 12.5% while 2023 closed at 1500 units");
        assertTrue(keywords.contains("2023"));
        assertTrue(keywords.contains("1500"));
    }

    @Test
    void blankTextHasNoKeywords() {
        assertTrue(extractor.extract("   ").isEmpty());
    }

    @Test
    void lowercasingIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            List<String> keywords = extractor.extract("INDEX LIMIT INDEX. THIS IS IT.");
            assertEquals("index", keywords.get(0));
            assertTrue(keywords.contains("limit"));
            assertFalse(keywords.contains("this"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
