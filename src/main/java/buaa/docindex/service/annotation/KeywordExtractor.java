package buaa.docindex.service.annotation;

import buaa.docindex.common.consts.IndexingConstants;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 页面关键词抽取
 *
 * <p>单词按词频排序取前15个（词频相同按首次出现顺序），
 * 再追加句内相邻词组成的二元词组最多10个，总数不超过20。</p>
 */
@Component
public class KeywordExtractor {

    private static final Pattern TOKEN_PATTERN =
        Pattern.compile("\\b[A-Za-z][A-Za-z0-9]*\\b|\\b\\d+(?:\\.\\d+)?%?\\b");
    private static final Pattern WORD_PATTERN = Pattern.compile("\\b[A-Za-z][A-Za-z0-9]*\\b");
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?]+");

    private static final int MIN_TOKEN_LENGTH = 4;
    private static final int MIN_BIGRAM_LENGTH = 9;
    private static final int TOP_WORDS = 15;
    private static final int TOP_BIGRAMS = 10;
    private static final int MAX_KEYWORDS = 20;

    public List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return new ArrayList<>();
        }
        String lower = text.toLowerCase(Locale.ROOT);

        Set<String> keywords = new LinkedHashSet<>();
        keywords.addAll(topWords(lower));
        keywords.addAll(bigrams(lower));

        return keywords.stream()
            .limit(MAX_KEYWORDS)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    private List<String> topWords(String lower) {
        // LinkedHashMap 保留首次出现顺序，稳定排序后即为词频相同时的次序
        Map<String, Integer> frequency = new LinkedHashMap<>();
        Matcher matcher = TOKEN_PATTERN.matcher(lower);
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() >= MIN_TOKEN_LENGTH && !IndexingConstants.STOP_WORDS.contains(token)) {
                frequency.merge(token, 1, Integer::sum);
            }
        }
        return frequency.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
            .limit(TOP_WORDS)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    private List<String> bigrams(String lower) {
        Set<String> compounds = new LinkedHashSet<>();
        for (String sentence : SENTENCE_BOUNDARY.split(lower)) {
            List<String> words = new ArrayList<>();
            Matcher matcher = WORD_PATTERN.matcher(sentence);
            while (matcher.find()) {
                words.add(matcher.group());
            }
            for (int i = 0; i < words.size() - 1; i++) {
                String first = words.get(i);
                String second = words.get(i + 1);
                if (IndexingConstants.STOP_WORDS.contains(first) || IndexingConstants.STOP_WORDS.contains(second)) {
                    continue;
                }
                String compound = first + " " + second;
                if (compound.length() >= MIN_BIGRAM_LENGTH) {
                    compounds.add(compound);
                }
            }
        }
        return compounds.stream().limit(TOP_BIGRAMS).collect(Collectors.toList());
    }
}
