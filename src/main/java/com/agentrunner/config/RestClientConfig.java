package com.agentrunner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.http.client.ClientHttpRequestFactoryBuilder;
import org.springframework.boot.http.client.ClientHttpRequestFactorySettings;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * Applies a logging interceptor to every {@code RestClient} built from the shared builder:
 * the chat model starters and the automation engine both go through it.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
    }

    /**
     * Client for automation endpoints. A call never outlives the execution timeout, so a hung
     * endpoint cannot hold a worker thread after its caller has stopped waiting.
     */
    @Bean
    public RestClient automationRestClient(RestClient.Builder restClientBuilder, AgentRunnerProperties properties) {
        return restClientBuilder
                .requestFactory(ClientHttpRequestFactoryBuilder.detect().build(timeouts(properties.getExecutionTimeout())))
                .build();
    }

    static ClientHttpRequestFactorySettings timeouts(Duration timeout) {
        return ClientHttpRequestFactorySettings.defaults()
                .withConnectTimeout(timeout)
                .withReadTimeout(timeout);
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final Logger httpLogger = LoggerFactory.getLogger("com.agentrunner.http.logging");
        private static final Set<String> SECRET_HEADERS = Set.of("authorization", "x-api-key", "x-goog-api-key");
        private static final String MASK = "****";

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            long start = System.currentTimeMillis();
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("HTTP {} {} headers={} bodyBytes={}", request.getMethod(), request.getURI(),
                        redact(request.getHeaders()), body.length);
            }
            ClientHttpResponse response = execution.execute(request, body);
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("HTTP {} {} -> {} in {} ms", request.getMethod(), request.getURI(),
                        response.getStatusCode().value(), System.currentTimeMillis() - start);
            }
            return response;
        }

        static TreeMap<String, List<String>> redact(HttpHeaders headers) {
            TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            headers.forEach((name, values) -> copy.put(name,
                    SECRET_HEADERS.contains(name.toLowerCase()) ? List.of(MASK) : List.copyOf(values)));
            return copy;
        }
    }
}
