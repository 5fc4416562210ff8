package com.sagarmitra.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Configuration
@Slf4j
public class WebClientConfig {

    /**
     * Client for the weather tool. The API key travels as a query parameter per request,
     * so only the base URL is fixed here.
     */
    @Bean
    public WebClient weatherWebClient(AgentProperties properties) {
        WebClient.Builder builder = WebClient.builder().baseUrl(properties.getWeather().getBaseUrl());

        builder.filter(ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            if (log.isDebugEnabled()) {
                // the query string carries the api key
                log.debug("[WEATHER-HTTP] {} {}", clientRequest.method(), clientRequest.url().getPath());
            }
            return Mono.just(clientRequest);
        }));

        return builder.build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }
}
