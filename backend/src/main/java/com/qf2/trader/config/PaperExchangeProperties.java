package com.qf2.trader.config;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "qf2.paper")
@Data
@Validated
public class PaperExchangeProperties {

    @PositiveOrZero
    private double startingCash = 50_000;

    @PositiveOrZero
    private double commissionRate = 0.001;
}
