package buaa.docindex.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 页面处理线程池配置
 * 单个文档内的页面摘要与注释在该线程池中并行执行
 */
@Configuration
public class AsyncConfig {

    /**
     * 页面处理线程池，线程数固定为 indexing.max-workers
     *
     * @return 线程池执行器
     */
    @Bean(name = "pageProcessingExecutor")
    public ThreadPoolTaskExecutor pageProcessingExecutor(IndexingConfiguration indexingConfiguration) {
        int workers = Math.max(1, indexingConfiguration.getMaxWorkers());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("page-processing-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
