package com.demo.groupchat.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Arrays;
import java.util.List;

/**
 * RestTemplate Configuration
 * RestTemplate used by the push gateway, with timeouts and a JSON converter that also
 * accepts the provider's non-JSON error content types.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate pushRestTemplate(
            ObjectMapper objectMapper,
            @Value("${chat.push.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${chat.push.read-timeout-ms:10000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        RestTemplate restTemplate = new RestTemplate(requestFactory);

        MappingJackson2HttpMessageConverter jsonConverter = new MappingJackson2HttpMessageConverter(objectMapper);
        List<MediaType> supportedMediaTypes = Arrays.asList(
            MediaType.APPLICATION_JSON,
            MediaType.TEXT_PLAIN,
            new MediaType("application", "*+json")
        );
        jsonConverter.setSupportedMediaTypes(supportedMediaTypes);

        // Place it at the beginning so it takes precedence
        restTemplate.getMessageConverters().add(0, jsonConverter);

        return restTemplate;
    }
}
