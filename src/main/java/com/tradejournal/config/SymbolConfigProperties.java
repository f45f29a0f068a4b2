package com.tradejournal.config;

import com.tradejournal.domain.enums.ExpirationPattern;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Per-symbol trading parameters, read from the {@code journal.symbols} prefix.
 *
 * <p>Entries here are layered over the built-in registry in
 * {@link com.tradejournal.symbol.SymbolConfigRegistry}; anything left unset keeps the
 * built-in value. Example:
 * <pre>
 *   journal.symbols.asset-type-by-symbol.TSLA=stock
 *   journal.symbols.overrides.NDX.strike-increment=10
 *   journal.symbols.asset-types.stock.default-width=10
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "journal.symbols")
@Getter
@Setter
public class SymbolConfigProperties {

    /** Defaults per asset type (index_option, etf_option, stock, future). */
    private Map<String, AssetTypeSettings> assetTypes = new LinkedHashMap<>();

    /** Per-symbol overrides of the asset type defaults. */
    private Map<String, SymbolOverride> overrides = new LinkedHashMap<>();

    /** Asset type of each known symbol. */
    private Map<String, String> assetTypeBySymbol = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class AssetTypeSettings {
        private BigDecimal strikeIncrement;
        private BigDecimal defaultWidth;
        private BigDecimal minWidth;
        private BigDecimal strikeRange;
        private ExpirationPattern expirationPattern;
    }

    @Getter
    @Setter
    public static class SymbolOverride extends AssetTypeSettings {
        /** Spot feed key, e.g. "I:SPX". Defaults to the symbol itself. */
        private String spotKey;
    }
}
