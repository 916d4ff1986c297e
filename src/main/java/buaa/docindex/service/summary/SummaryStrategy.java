package buaa.docindex.service.summary;

import java.util.Optional;

/**
 * 单个摘要策略，失败时返回空结果交由下一个策略处理
 */
public interface SummaryStrategy {

    /**
     * 尝试生成摘要
     *
     * @return 成功时的摘要；失败、超时或结果不可用时为空
     */
    Optional<String> attempt(String text, int maxLength);

    /**
     * 策略名称，用于日志
     */
    String name();
}
