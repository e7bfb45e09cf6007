package com.vigil.service.core.config;

import com.vigil.client.transport.BackendTransport;
import com.vigil.client.transport.okhttp.OkHttpBackendTransport;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnClass(OkHttpBackendTransport.class)
public class TransportAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(BackendTransport.class)
    public BackendTransport okHttpBackendTransport(FederationProperties properties) {
        return new OkHttpBackendTransport(properties.getTransport().getUrl());
    }
}
