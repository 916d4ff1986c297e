package buaa.docindex.repository;

import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.exception.ServiceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON文件存储基类
 * 写入先落到临时文件再整体替换，写入中途失败不会破坏已提交的文件
 */
public abstract class AbstractJsonFileStore {

    private static final Logger log = LoggerFactory.getLogger(AbstractJsonFileStore.class);

    protected final ObjectMapper jsonMapper;

    protected AbstractJsonFileStore() {
        this.jsonMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * 原子写入JSON文件
     *
     * @param target 目标文件
     * @param value 待序列化对象
     */
    protected void writeAtomically(Path target, Object value) {
        Path tempFile = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(tempFile, jsonMapper.writeValueAsString(value), StandardCharsets.UTF_8);
            moveIntoPlace(tempFile, target);
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new ServiceException("写入文件失败: " + target, e, DocIndexErrorCode.STORAGE_SERVICE_ERROR);
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("文件系统不支持原子移动，退化为覆盖替换: {}", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("清理临时文件失败: {}", file, e);
        }
    }
}
