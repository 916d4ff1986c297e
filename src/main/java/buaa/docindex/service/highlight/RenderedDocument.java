package buaa.docindex.service.highlight;

import java.io.Closeable;
import java.io.IOException;

/**
 * 可检索、可标注的渲染文档
 */
public interface RenderedDocument extends Closeable {

    int getPageCount();

    /**
     * 获取页面文本层
     *
     * @param pageIndex 页序号，从0开始
     */
    PageTextLayer getPage(int pageIndex);

    /**
     * 序列化当前文档（含已添加的标注）
     */
    byte[] toBytes() throws IOException;
}
