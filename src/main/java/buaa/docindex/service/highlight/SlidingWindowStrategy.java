package buaa.docindex.service.highlight;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 长句分段匹配
 * 超过5个词的句子按8词窗口、每次前移5词切分，汇总各窗口的匹配结果
 */
@Component
@Order(3)
public class SlidingWindowStrategy implements RegionMatchStrategy {

    static final int MIN_WORDS = 6;
    static final int WINDOW_WORDS = 8;
    static final int STEP_WORDS = 5;
    static final int MIN_WINDOW_CHARS = 21;

    @Override
    public MatchResult match(PageTextLayer page, String span) {
        String[] words = span.split(" ");
        if (words.length < MIN_WORDS) {
            return MatchResult.none();
        }
        List<TextRegion> regions = new ArrayList<>();
        for (String window : windows(words)) {
            regions.addAll(page.search(window));
        }
        return MatchResult.found(name(), regions);
    }

    /**
     * 切分出长度足够的窗口
     */
    static List<String> windows(String[] words) {
        List<String> windows = new ArrayList<>();
        for (int start = 0; start < words.length; start += STEP_WORDS) {
            int end = Math.min(start + WINDOW_WORDS, words.length);
            String window = String.join(" ", Arrays.copyOfRange(words, start, end)).strip();
            if (window.length() >= MIN_WINDOW_CHARS) {
                windows.add(window);
            }
        }
        return windows;
    }

    @Override
    public String name() {
        return "sliding-window";
    }
}
