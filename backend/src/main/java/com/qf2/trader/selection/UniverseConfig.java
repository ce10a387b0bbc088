package com.qf2.trader.selection;

import java.util.List;

/**
 * @param referenceAssets assets driving regime detection; empty means the whole eligible universe
 */
public record UniverseConfig(
        List<String> assets,
        List<String> referenceAssets,
        int lookbackBars,
        int minBars,
        int minEligibleAssets
) {
    public UniverseConfig {
        assets = List.copyOf(assets);
        referenceAssets = referenceAssets == null ? List.of() : List.copyOf(referenceAssets);
    }
}
