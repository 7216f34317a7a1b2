package com.lpradar.monitor.config;

import com.lpradar.monitor.notify.LoggingNotificationSink;
import com.lpradar.monitor.notify.NotificationSink;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
public class MonitorConfig {

    @Bean
    @ConditionalOnMissingBean(NotificationSink.class)
    public NotificationSink notificationSink() {
        return new LoggingNotificationSink();
    }

    @Bean
    public Clock monitorClock(MonitorProperties properties) {
        return Clock.system(ZoneId.of(properties.getTimezone()));
    }
}
