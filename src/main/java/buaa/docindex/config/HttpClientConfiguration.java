package buaa.docindex.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP客户端配置, 用于大模型API调用
 */
@Configuration
public class HttpClientConfiguration {

    /**
     * 创建用于大模型调用的WebClient
     * 配置了较大的内存缓冲区以容纳长文本响应
     *
     * @return WebClient实例
     */
    @Bean
    public WebClient llmWebClient(LlmConfiguration llmConfiguration) {
        // 配置16MB内存缓冲区
        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(codecConfigurer -> codecConfigurer
                .defaultCodecs()
                .maxInMemorySize(calculateMaxBufferSize()))
            .build();

        WebClient.Builder clientBuilder = WebClient.builder()
            .baseUrl(llmConfiguration.getApi().getUrl())
            .exchangeStrategies(exchangeStrategies)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);

        String apiKey = llmConfiguration.getApi().getKey();
        if (apiKey != null && !apiKey.isBlank()) {
            clientBuilder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return clientBuilder.build();
    }

    /**
     * 计算最大缓冲区大小（16MB）
     */
    private int calculateMaxBufferSize() {
        return 16 * 1024 * 1024;
    }
}
