package com.qf2.trader.config;

import com.qf2.trader.compliance.ComplianceConfig;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

@Configuration
@ConfigurationProperties(prefix = "qf2.compliance")
@Data
@Validated
public class ComplianceProperties {

    @PositiveOrZero
    private double minHoldHours = 24;

    private double minNetProfit = 0.001;

    @Min(1)
    private int maxDailyTradesPerAsset = 2;

    @Min(1)
    private int maxDailyTotalTrades = 20;

    @PositiveOrZero
    private double minTradeValue = 10.0;

    @PositiveOrZero
    private double commissionRate = 0.001;

    @PositiveOrZero
    private double cooldownHoursAfterSell = 12;

    @NotBlank
    private String zone = "UTC";

    public ComplianceConfig toConfig() {
        return ComplianceConfig.ofHours(minHoldHours, minNetProfit, maxDailyTradesPerAsset, maxDailyTotalTrades,
                minTradeValue, commissionRate, cooldownHoursAfterSell, ZoneId.of(zone));
    }
}
