package com.lumina.agent.config;

import com.lumina.agent.llm.CancellableRequestFactory;
import com.lumina.agent.llm.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient behind the RestClient used for model calls.
 *
 * The response timeout is a hard transport ceiling only. The agent's own
 * slow-request signal fires much earlier and leaves the call running; an abort
 * or timeout retry cancels the exchange through {@link CancellableRequestFactory}.
 * Waiting for a pooled connection is capped by the connect timeout.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean("llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder(LlmProperties llmProperties) {
        Timeout connect = Timeout.ofMilliseconds(llmProperties.getConnectTimeout().toMillis());
        Timeout response = Timeout.ofMilliseconds(llmProperties.getResponseTimeout().toMillis());

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(connect)
                                        .setSocketTimeout(response)
                                        .build())
                                .setMaxConnTotal(20)
                                .setMaxConnPerRoute(10)
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(response)
                        .setConnectionRequestTimeout(connect)
                        .build())
                .build();

        log.info("LLM HttpClient configured [connectTimeout={}, responseTimeout={}]",
                llmProperties.getConnectTimeout(), llmProperties.getResponseTimeout());
        return RestClient.builder().requestFactory(new CancellableRequestFactory(httpClient));
    }
}
