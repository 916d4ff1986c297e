package buaa.docindex.repository;

import buaa.docindex.model.Annotation;
import buaa.docindex.model.ContentCache;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 文档内容缓存与页面注释存储，均以文件名为键
 */
public interface ContentStore {

    /**
     * 整体保存文档内容缓存
     *
     * @return 缓存文件位置
     */
    Path saveContent(ContentCache contentCache);

    Optional<ContentCache> loadContent(String filename);

    /**
     * 计算文档内容缓存的位置
     */
    Path contentPath(String filename);

    /**
     * 保存页面注释，同一文件名重复保存会覆盖
     */
    Path saveAnnotation(Annotation annotation);

    Optional<Annotation> loadAnnotation(String filename);

    /**
     * 加载全部注释文件
     */
    List<Annotation> loadAllAnnotations();
}
