package buaa.docindex.service.highlight;

import java.util.List;

/**
 * 单页文本层：文本检索与区域标注
 */
public interface PageTextLayer {

    /**
     * 页码，从1开始
     */
    int getPageNumber();

    /**
     * 在页面文本中查找目标文本的所有出现位置
     * 匹配忽略大小写，连续空白视为单个空格
     *
     * @param text 目标文本
     * @return 每次出现对应一个区域；未找到时返回空列表
     */
    List<TextRegion> search(String text);

    /**
     * 以固定样式高亮区域，重复调用会叠加标注
     */
    void mark(TextRegion region);
}
