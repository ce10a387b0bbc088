package com.qf2.trader.config;

import com.qf2.trader.selection.UniverseConfig;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "qf2.universe")
@Data
@Validated
public class UniverseProperties {

    @NotEmpty
    private List<String> assets = new ArrayList<>(List.of(
            "BTCUSDT", "ETHUSDT", "BNBUSDT", "SOLUSDT", "XRPUSDT",
            "ADAUSDT", "DOGEUSDT", "AVAXUSDT", "DOTUSDT", "LINKUSDT",
            "MATICUSDT", "LTCUSDT", "TRXUSDT", "ATOMUSDT", "UNIUSDT",
            "XLMUSDT", "NEARUSDT", "APTUSDT", "FILUSDT", "ARBUSDT"));

    private List<String> referenceAssets = new ArrayList<>();

    private String barInterval = "1h";

    @Min(2)
    private int lookbackBars = 100;

    @Min(2)
    private int minBars = 73;

    @Min(1)
    private int minEligibleAssets = 2;

    public UniverseConfig toConfig() {
        return new UniverseConfig(assets, referenceAssets, lookbackBars, minBars, minEligibleAssets);
    }
}
