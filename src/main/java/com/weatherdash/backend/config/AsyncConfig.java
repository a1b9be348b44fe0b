package com.weatherdash.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String OTP_DELIVERY_EXECUTOR = "otpDeliveryExecutor";

    // the test profile supplies a synchronous executor under the same name
    @Bean(OTP_DELIVERY_EXECUTOR)
    @Profile("!test")
    public TaskExecutor otpDeliveryExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(2);
        ex.setMaxPoolSize(4);
        ex.setQueueCapacity(200);
        ex.setThreadNamePrefix("otp-delivery-");
        ex.initialize();
        return ex;
    }
}
