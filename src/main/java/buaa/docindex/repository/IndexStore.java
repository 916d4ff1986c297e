package buaa.docindex.repository;

import buaa.docindex.model.IndexEntry;

import java.util.Map;

/**
 * 文档索引表存储
 *
 * <p>单写者约定：一次索引构建开始时读取一次、结束时整体写入一次。
 * 多个构建任务并发写同一存储是不安全的，需由调用方串行化。</p>
 */
public interface IndexStore {

    /**
     * 加载索引表
     *
     * @return 文件名到索引条目的映射；文件不存在或无法解析时返回空映射
     */
    Map<String, IndexEntry> load();

    /**
     * 原子替换整个索引表
     *
     * @param index 新的索引表
     */
    void replaceAll(Map<String, IndexEntry> index);
}
