package buaa.docindex.service.annotation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 关系短语抽取
 * 依次匹配数值变化、因果、比较、时间四类模式，结果去重后保留10到150个字符的短语，最多15条
 */
@Component
public class RelationExtractor {

    private static final int MIN_LENGTH = 10;
    private static final int MAX_LENGTH = 150;
    private static final int MAX_RELATIONS = 15;

    private static final List<Pattern> NUMERICAL_PATTERNS = compile(
        "\\b\\d+(?:\\.\\d+)?\\s*(?:percent|%|times|fold|increase|decrease|ratio|rate)\\b",
        "\\b(?:increased|decreased|reduced|improved|enhanced)\\s+by\\s+\\d+(?:\\.\\d+)?\\s*(?:percent|%)?\\b",
        "\\b(?:from|between)\\s+\\d+(?:\\.\\d+)?\\s+(?:to|and)\\s+\\d+(?:\\.\\d+)?\\b"
    );

    private static final List<Pattern> CAUSAL_PATTERNS = compile(
        "\\b\\w+\\s+(?:causes?|leads?\\s+to|results?\\s+in|due\\s+to|because\\s+of)\\s+\\w+\\b",
        "\\b(?:if|when|while|since)\\s+\\w+.*?\\s+then\\s+\\w+\\b",
        "\\b\\w+\\s+(?:affects?|influences?|impacts?)\\s+\\w+\\b"
    );

    private static final List<Pattern> COMPARATIVE_PATTERNS = compile(
        "\\b\\w+\\s+(?:is|are|was|were)\\s+(?:higher|lower|greater|less|better|worse)\\s+than\\s+\\w+\\b",
        "\\b(?:compared\\s+to|versus|vs\\.?)\\s+\\w+\\b",
        "\\b(?:more|less)\\s+\\w+\\s+than\\s+\\w+\\b"
    );

    private static final List<Pattern> TEMPORAL_PATTERNS = compile(
        "\\b(?:before|after|during|while|when|since|until)\\s+\\w+.*?\\w+\\b",
        "\\b(?:in|at|on)\\s+\\d{4}\\b|\\b(?:january|february|march|april|may|june|july|august"
            + "|september|october|november|december)\\s+\\d{4}\\b"
    );

    private static final List<List<Pattern>> PATTERN_FAMILIES =
        List.of(NUMERICAL_PATTERNS, CAUSAL_PATTERNS, COMPARATIVE_PATTERNS, TEMPORAL_PATTERNS);

    public List<String> extract(String text) {
        Set<String> relations = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return new ArrayList<>();
        }
        for (List<Pattern> family : PATTERN_FAMILIES) {
            for (Pattern pattern : family) {
                Matcher matcher = pattern.matcher(text);
                while (matcher.find()) {
                    String relation = matcher.group().strip();
                    if (relation.length() >= MIN_LENGTH && relation.length() <= MAX_LENGTH) {
                        relations.add(relation);
                    }
                }
            }
        }
        List<String> result = new ArrayList<>(relations);
        return result.size() > MAX_RELATIONS ? new ArrayList<>(result.subList(0, MAX_RELATIONS)) : result;
    }

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.length);
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }
}
