package buaa.docindex.repository;

import buaa.docindex.model.Annotation;
import buaa.docindex.model.ContentCache;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 基于目录的内容缓存存储
 *
 * <p>内容缓存命名为 {@code <文件名>_content.json}，
 * 注释文件命名为 {@code <sha256(文件名)>_chatbot_summary.json}。</p>
 */
public class FileContentStore extends AbstractJsonFileStore implements ContentStore {

    private static final Logger log = LoggerFactory.getLogger(FileContentStore.class);

    static final String CONTENT_SUFFIX = "_content.json";
    static final String ANNOTATION_SUFFIX = "_chatbot_summary.json";

    private final Path cacheDir;

    public FileContentStore(Path cacheDir) {
        this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir");
    }

    @Override
    public Path saveContent(ContentCache contentCache) {
        Path target = contentPath(contentCache.getFilename());
        writeAtomically(target, contentCache);
        log.debug("内容缓存已保存: {}", target);
        return target;
    }

    @Override
    public Optional<ContentCache> loadContent(String filename) {
        return read(contentPath(filename), ContentCache.class);
    }

    @Override
    public Path contentPath(String filename) {
        return cacheDir.resolve(filename + CONTENT_SUFFIX);
    }

    @Override
    public Path saveAnnotation(Annotation annotation) {
        Path target = annotationPath(annotation.getFilename());
        writeAtomically(target, annotation);
        log.info("注释文件已保存: {}", target.getFileName());
        return target;
    }

    @Override
    public Optional<Annotation> loadAnnotation(String filename) {
        return read(annotationPath(filename), Annotation.class);
    }

    @Override
    public List<Annotation> loadAllAnnotations() {
        if (!Files.isDirectory(cacheDir)) {
            return new ArrayList<>();
        }
        List<Annotation> annotations = new ArrayList<>();
        try (Stream<Path> files = Files.list(cacheDir)) {
            files.filter(file -> file.getFileName().toString().endsWith(ANNOTATION_SUFFIX))
                .sorted(Comparator.comparing(Path::getFileName))
                .forEach(file -> read(file, Annotation.class).ifPresent(annotations::add));
        } catch (IOException e) {
            log.warn("注释目录读取失败: {}", cacheDir, e);
        }
        return annotations;
    }

    /**
     * 注释文件位置，由文件名的SHA-256摘要决定，重跑时覆盖而不会重复
     */
    public Path annotationPath(String filename) {
        return cacheDir.resolve(DigestUtils.sha256Hex(filename) + ANNOTATION_SUFFIX);
    }

    private <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(jsonMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            log.warn("缓存文件解析失败: {}", file, e);
            return Optional.empty();
        }
    }
}
