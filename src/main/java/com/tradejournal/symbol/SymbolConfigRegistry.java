package com.tradejournal.symbol;

import com.tradejournal.config.SymbolConfigProperties;
import com.tradejournal.config.SymbolConfigProperties.AssetTypeSettings;
import com.tradejournal.config.SymbolConfigProperties.SymbolOverride;
import com.tradejournal.domain.enums.ExpirationPattern;
import com.tradejournal.domain.model.SymbolSettings;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the trading parameters the position editor needs for a symbol: strike
 * increment, default and minimum width, strike range, expiration pattern and spot key.
 *
 * <p>Resolution order, first non-null value wins per field:
 * <ol>
 *   <li>symbol override</li>
 *   <li>defaults of the symbol's asset type</li>
 *   <li>fallback (increment 1, width 5, min width 1, range 100, weekly)</li>
 * </ol>
 * Built-in overrides and asset types cover the index options the journal is used with;
 * {@link SymbolConfigProperties} entries replace them field by field.
 */
@Component
public class SymbolConfigRegistry {

    private static final Logger log = LoggerFactory.getLogger(SymbolConfigRegistry.class);

    static final String INDEX_OPTION = "index_option";
    static final String ETF_OPTION = "etf_option";
    static final String STOCK = "stock";
    static final String FUTURE = "future";

    private static final AssetTypeSettings FALLBACK = assetType(1, 5, 1, 100, ExpirationPattern.WEEKLY);

    private final Map<String, AssetTypeSettings> assetTypes;
    private final Map<String, SymbolOverride> overrides;
    private final Map<String, String> assetTypeBySymbol;

    public SymbolConfigRegistry(SymbolConfigProperties properties) {
        this.assetTypes = merge(
                builtInAssetTypes(), properties.getAssetTypes(), key -> key.trim().toLowerCase(Locale.ROOT));
        this.overrides = merge(builtInOverrides(), properties.getOverrides(), SymbolConfigRegistry::normalize);
        this.assetTypeBySymbol = new LinkedHashMap<>(builtInAssetTypeBySymbol());
        properties.getAssetTypeBySymbol()
                .forEach((symbol, type) -> assetTypeBySymbol.put(normalize(symbol), type.trim().toLowerCase(Locale.ROOT)));
        log.info("Symbol registry loaded: {} asset types, {} symbol overrides, {} known symbols",
                assetTypes.size(), overrides.size(), assetTypeBySymbol.size());
    }

    /**
     * Resolves the settings for a symbol. Unknown symbols get the fallback values and
     * use the ticker itself as spot key.
     */
    public SymbolSettings resolve(String symbol) {
        String key = normalize(symbol);
        String assetType = assetTypeBySymbol.get(key);
        AssetTypeSettings base = assetType != null ? assetTypes.getOrDefault(assetType, FALLBACK) : FALLBACK;
        SymbolOverride override = overrides.get(key);

        return SymbolSettings.builder()
                .symbol(key)
                .spotKey(override != null && override.getSpotKey() != null ? override.getSpotKey() : key)
                .strikeIncrement(pick(override != null ? override.getStrikeIncrement() : null,
                        base.getStrikeIncrement(), FALLBACK.getStrikeIncrement()))
                .defaultWidth(pick(override != null ? override.getDefaultWidth() : null,
                        base.getDefaultWidth(), FALLBACK.getDefaultWidth()))
                .minWidth(pick(override != null ? override.getMinWidth() : null,
                        base.getMinWidth(), FALLBACK.getMinWidth()))
                .strikeRange(pick(override != null ? override.getStrikeRange() : null,
                        base.getStrikeRange(), FALLBACK.getStrikeRange()))
                .expirationPattern(pick(override != null ? override.getExpirationPattern() : null,
                        base.getExpirationPattern(), FALLBACK.getExpirationPattern()))
                .build();
    }

    /** Spot feed key only, e.g. "I:SPX" for SPXW. */
    public String resolveSpotKey(String symbol) {
        return resolve(symbol).getSpotKey();
    }

    public Map<String, String> getAssetTypeBySymbol() {
        return Collections.unmodifiableMap(assetTypeBySymbol);
    }

    // ========================
    // BUILT-IN REGISTRY
    // ========================

    private static Map<String, AssetTypeSettings> builtInAssetTypes() {
        Map<String, AssetTypeSettings> types = new LinkedHashMap<>();
        types.put(INDEX_OPTION, assetType(5, 20, 5, 500, ExpirationPattern.DAILY));
        types.put(ETF_OPTION, assetType(1, 5, 1, 50, ExpirationPattern.DAILY));
        types.put(STOCK, assetType(1, 5, 1, 100, ExpirationPattern.WEEKLY));
        types.put(FUTURE, assetType(5, 20, 5, 200, ExpirationPattern.MONTHLY));
        return types;
    }

    private static Map<String, SymbolOverride> builtInOverrides() {
        Map<String, SymbolOverride> result = new LinkedHashMap<>();
        result.put("SPX", override("I:SPX", null, null, null, null));
        result.put("SPXW", override("I:SPX", null, null, null, null));
        result.put("NDX", override("I:NDX", 25, null, null, null));
        result.put("NDXP", override("I:NDX", 25, null, null, null));
        result.put("VIX", override("I:VIX", 1, 2, 1, 30));
        result.put("RUT", override("I:RUT", null, null, null, null));
        result.put("XSP", override("I:XSP", 1, 2, 1, 50));
        return result;
    }

    private static Map<String, String> builtInAssetTypeBySymbol() {
        Map<String, String> result = new LinkedHashMap<>();
        for (String index : new String[] {"SPX", "SPXW", "NDX", "NDXP", "RUT", "XSP", "VIX"}) {
            result.put(index, INDEX_OPTION);
        }
        for (String etf : new String[] {"SPY", "QQQ", "IWM", "DIA"}) {
            result.put(etf, ETF_OPTION);
        }
        for (String future : new String[] {"ES", "NQ"}) {
            result.put(future, FUTURE);
        }
        return result;
    }

    // ========================
    // HELPERS
    // ========================

    /** Layers configured entries over built-in ones, field by field. */
    private static <T extends AssetTypeSettings> Map<String, T> merge(
            Map<String, T> builtIn, Map<String, T> configured, UnaryOperator<String> keyNormalizer) {
        Map<String, T> merged = new LinkedHashMap<>(builtIn);
        if (configured == null) {
            return merged;
        }
        configured.forEach((rawKey, value) -> {
            String key = keyNormalizer.apply(rawKey);
            T existing = merged.get(key);
            if (existing != null) {
                overlay(existing, value);
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }

    private static void overlay(AssetTypeSettings target, AssetTypeSettings source) {
        if (source.getStrikeIncrement() != null) {
            target.setStrikeIncrement(source.getStrikeIncrement());
        }
        if (source.getDefaultWidth() != null) {
            target.setDefaultWidth(source.getDefaultWidth());
        }
        if (source.getMinWidth() != null) {
            target.setMinWidth(source.getMinWidth());
        }
        if (source.getStrikeRange() != null) {
            target.setStrikeRange(source.getStrikeRange());
        }
        if (source.getExpirationPattern() != null) {
            target.setExpirationPattern(source.getExpirationPattern());
        }
        if (target instanceof SymbolOverride targetOverride
                && source instanceof SymbolOverride sourceOverride
                && sourceOverride.getSpotKey() != null) {
            targetOverride.setSpotKey(sourceOverride.getSpotKey());
        }
    }

    @SafeVarargs
    private static <T> T pick(T... candidates) {
        for (T candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    private static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static AssetTypeSettings assetType(
            int strikeIncrement, int defaultWidth, int minWidth, int strikeRange, ExpirationPattern pattern) {
        AssetTypeSettings settings = new AssetTypeSettings();
        settings.setStrikeIncrement(BigDecimal.valueOf(strikeIncrement));
        settings.setDefaultWidth(BigDecimal.valueOf(defaultWidth));
        settings.setMinWidth(BigDecimal.valueOf(minWidth));
        settings.setStrikeRange(BigDecimal.valueOf(strikeRange));
        settings.setExpirationPattern(pattern);
        return settings;
    }

    private static SymbolOverride override(
            String spotKey, Integer strikeIncrement, Integer defaultWidth, Integer minWidth, Integer strikeRange) {
        SymbolOverride override = new SymbolOverride();
        override.setSpotKey(spotKey);
        override.setStrikeIncrement(strikeIncrement != null ? BigDecimal.valueOf(strikeIncrement) : null);
        override.setDefaultWidth(defaultWidth != null ? BigDecimal.valueOf(defaultWidth) : null);
        override.setMinWidth(minWidth != null ? BigDecimal.valueOf(minWidth) : null);
        override.setStrikeRange(strikeRange != null ? BigDecimal.valueOf(strikeRange) : null);
        return override;
    }
}
