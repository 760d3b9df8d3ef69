package com.community.kolokwa.config;

import com.community.kolokwa.filter.ReconciliationLockFilter;
import com.community.kolokwa.util.ReconciliationStatusManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FilterConfig {

    @Bean
    public FilterRegistrationBean<ReconciliationLockFilter> reconciliationLockFilterBean(
            ReconciliationStatusManager statusManager, ObjectMapper objectMapper) {
        FilterRegistrationBean<ReconciliationLockFilter> registrationBean =
                new FilterRegistrationBean<>(new ReconciliationLockFilter(statusManager, objectMapper));

        // API requests only
        registrationBean.addUrlPatterns("/api/*");
        registrationBean.setOrder(1);

        return registrationBean;
    }
}
