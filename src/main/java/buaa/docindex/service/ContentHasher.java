package buaa.docindex.service;

import buaa.docindex.common.consts.IndexingConstants;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 文件内容哈希
 * 以流的方式分块读取文件计算MD5，避免大文件整体载入内存
 */
@Component
public class ContentHasher {

    private static final Logger log = LoggerFactory.getLogger(ContentHasher.class);

    /**
     * 计算文件MD5
     *
     * @param file 文件路径
     * @return 十六进制摘要；文件不可读时返回 {@link IndexingConstants#UNKNOWN_HASH}
     */
    public String hash(Path file) {
        try (InputStream inputStream = Files.newInputStream(file)) {
            return DigestUtils.md5Hex(inputStream);
        } catch (IOException e) {
            log.warn("文件哈希计算失败，强制重新处理: {}", file, e);
            return IndexingConstants.UNKNOWN_HASH;
        }
    }

    /**
     * 判断哈希是否为有效摘要
     */
    public boolean isKnown(String hash) {
        return hash != null && !IndexingConstants.UNKNOWN_HASH.equals(hash);
    }
}
