package com.liveroom.servicebackend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liveroom.servicebackend.admission.AdmissionGateway;
import com.liveroom.servicebackend.admission.DirectAdmissionGateway;
import com.liveroom.servicebackend.admission.RestAdmissionGateway;
import com.liveroom.servicebackend.ice.IceConfigProvider;
import com.liveroom.servicebackend.room.RoomRegistry;
import com.liveroom.servicebackend.signaling.SignalingCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Spring configuration for the call core.
 * Registers the room registry, the signaling codec and the clients of the
 * admission and ICE configuration services as singleton beans.
 */
@Configuration
@EnableConfigurationProperties(CallProperties.class)
public class CallConfig {
    private static final Logger log = LoggerFactory.getLogger(CallConfig.class);

    @Bean(destroyMethod = "shutdown")
    public RoomRegistry roomRegistry(CallProperties properties) {
        return new RoomRegistry(properties.rooms());
    }

    @Bean
    public SignalingCodec signalingCodec(ObjectMapper objectMapper) {
        return new SignalingCodec(objectMapper);
    }

    @Bean
    public IceConfigProvider iceConfigProvider(CallProperties properties, RestClient.Builder restClientBuilder,
            ObjectMapper objectMapper) {
        return new IceConfigProvider(properties.ice(), withTimeouts(restClientBuilder, properties), objectMapper);
    }

    @Bean
    public AdmissionGateway admissionGateway(CallProperties properties, RestClient.Builder restClientBuilder) {
        String baseUrl = properties.admission().baseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            log.info("No admission service configured, rooms are admitted directly");
            return new DirectAdmissionGateway();
        }
        log.info("Admission through scheduling service at {}", baseUrl);
        return new RestAdmissionGateway(baseUrl, withTimeouts(restClientBuilder, properties));
    }

    private static RestClient.Builder withTimeouts(RestClient.Builder builder, CallProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.admission().timeout());
        requestFactory.setReadTimeout(properties.admission().timeout());
        return builder.clone().requestFactory(requestFactory);
    }
}
