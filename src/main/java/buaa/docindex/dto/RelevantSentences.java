package buaa.docindex.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 大模型从文本中抽取的相关句子
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelevantSentences {

    private String query;

    private List<String> sentences;
}
