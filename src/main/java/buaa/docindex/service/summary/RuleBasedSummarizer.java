package buaa.docindex.service.summary;

import buaa.docindex.common.consts.IndexingConstants;
import buaa.docindex.common.toolkit.TextTruncator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 基于规则的抽取式摘要
 *
 * <p>按数字、重要词、首尾位置、专有名词数量与句长给句子打分，
 * 再按分数从高到低贪心选取直到达到长度上限。输出句序为分数顺序而非原文顺序。
 * 纯函数实现：相同输入总是得到相同输出。</p>
 */
public class RuleBasedSummarizer implements Summarizer, SummaryStrategy {

    private static final int SEPARATOR_ALLOWANCE = 3;
    private static final int LONG_SENTENCE_WORDS = 10;

    @Override
    public String summarize(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }

        List<String> sentences = splitIntoSentences(text);
        if (sentences.size() < 2) {
            return truncate(text, maxLength);
        }

        List<ScoredSentence> ranked = new ArrayList<>(sentences.size());
        for (int i = 0; i < sentences.size(); i++) {
            ranked.add(new ScoredSentence(sentences.get(i), i, scoreSentence(sentences, i)));
        }
        ranked.sort(Comparator.comparingDouble(ScoredSentence::score).reversed()
            .thenComparingInt(ScoredSentence::position));

        List<String> summaryParts = new ArrayList<>();
        int currentLength = 0;
        for (ScoredSentence candidate : ranked) {
            int length = candidate.text().length();
            if (currentLength + length + SEPARATOR_ALLOWANCE <= maxLength) {
                summaryParts.add(candidate.text());
                currentLength += length + 1;
            } else if (currentLength == 0) {
                // 最高分句子本身超长，截断后结束
                int keep = Math.max(0, maxLength - IndexingConstants.ELLIPSIS.length());
                return TextTruncator.abbreviate(candidate.text(), keep);
            }
        }

        if (summaryParts.isEmpty()) {
            return truncate(text, maxLength);
        }

        String summary = String.join(" ", summaryParts);
        if (currentLength < maxLength && text.length() > currentLength) {
            summary += IndexingConstants.ELLIPSIS;
        }
        return summary;
    }

    @Override
    public Optional<String> attempt(String text, int maxLength) {
        return Optional.of(summarize(text, maxLength));
    }

    @Override
    public String name() {
        return "rule-based";
    }

    /**
     * 在句末标点之后及换行处断句
     */
    static List<String> splitIntoSentences(String text) {
        String marked = text.replace(".", ".\n").replace("!", "!\n").replace("?", "?\n");
        List<String> sentences = new ArrayList<>();
        for (String candidate : marked.split("\n")) {
            String trimmed = candidate.strip();
            if (!trimmed.isEmpty()) {
                sentences.add(trimmed);
            }
        }
        return sentences;
    }

    /**
     * 句子打分
     */
    static double scoreSentence(List<String> sentences, int index) {
        String sentence = sentences.get(index);
        String lower = sentence.toLowerCase(Locale.ROOT);
        double score = 0;

        if (sentence.chars().anyMatch(Character::isDigit)) {
            score += 2;
        }
        for (String term : IndexingConstants.IMPORTANT_TERMS) {
            if (lower.contains(term)) {
                score += 3;
            }
        }
        if (index == 0 || index == sentences.size() - 1) {
            score += 1;
        }

        String[] words = sentence.split("\\s+");
        int capitalized = 0;
        for (String word : words) {
            if (word.length() > 1 && Character.isUpperCase(word.charAt(0))) {
                capitalized++;
            }
        }
        score += capitalized * 0.5;

        if (words.length > LONG_SENTENCE_WORDS) {
            score += 1;
        }
        return score;
    }

    private static String truncate(String text, int maxLength) {
        return TextTruncator.abbreviate(text, maxLength);
    }

    private record ScoredSentence(String text, int position, double score) {
    }
}
