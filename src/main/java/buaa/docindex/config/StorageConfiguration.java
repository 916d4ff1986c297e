package buaa.docindex.config;

import buaa.docindex.repository.ContentStore;
import buaa.docindex.repository.FileContentStore;
import buaa.docindex.repository.FileIndexStore;
import buaa.docindex.repository.IndexStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * 索引与内容缓存存储配置
 */
@Configuration
public class StorageConfiguration {

    @Bean
    public IndexStore indexStore(IndexingConfiguration indexingConfiguration) {
        return new FileIndexStore(Path.of(indexingConfiguration.getIndexFile()));
    }

    @Bean
    public ContentStore contentStore(IndexingConfiguration indexingConfiguration) {
        return new FileContentStore(Path.of(indexingConfiguration.getContentCacheDir()));
    }

    /**
     * 索引时间戳使用的时钟
     */
    @Bean
    public Clock indexingClock() {
        return Clock.systemDefaultZone();
    }
}
