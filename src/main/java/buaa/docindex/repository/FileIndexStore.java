package buaa.docindex.repository;

import buaa.docindex.model.IndexEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 基于JSON文件的索引表存储
 */
public class FileIndexStore extends AbstractJsonFileStore implements IndexStore {

    private static final Logger log = LoggerFactory.getLogger(FileIndexStore.class);

    private static final TypeReference<LinkedHashMap<String, IndexEntry>> INDEX_TYPE = new TypeReference<>() {
    };

    private final Path indexFile;

    public FileIndexStore(Path indexFile) {
        this.indexFile = Objects.requireNonNull(indexFile, "indexFile");
    }

    @Override
    public Map<String, IndexEntry> load() {
        if (!Files.isRegularFile(indexFile)) {
            log.debug("索引文件不存在: {}", indexFile);
            return new LinkedHashMap<>();
        }
        try {
            Map<String, IndexEntry> index = jsonMapper.readValue(indexFile.toFile(), INDEX_TYPE);
            return index != null ? index : new LinkedHashMap<>();
        } catch (IOException e) {
            log.warn("索引文件解析失败，按空索引处理: {}", indexFile, e);
            return new LinkedHashMap<>();
        }
    }

    @Override
    public void replaceAll(Map<String, IndexEntry> index) {
        Objects.requireNonNull(index, "index");
        writeAtomically(indexFile, Collections.unmodifiableMap(index));
        log.info("索引已保存，文档数: {}", index.size());
    }

    public Path getIndexFile() {
        return indexFile;
    }
}
