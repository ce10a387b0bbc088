package com.qf2.trader.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "qf2.scheduler")
@Data
@Validated
public class SchedulerProperties {

    private boolean enabled = true;

    @Positive
    private long intervalMs = 14_400_000L;

    @PositiveOrZero
    private long initialDelayMs = 60_000L;
}
