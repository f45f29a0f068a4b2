package com.tradejournal.config;

import com.tradejournal.domain.enums.ExpirationPattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the position engine and its preview API.
 *
 * <p>Properties are read from the {@code journal.position} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "journal.position")
@Getter
@Setter
public class PositionProperties {

    /** Zone used to decide "today" when computing days to expiration. */
    private String timeZone = "America/New_York";

    /** Listing cadence assumed for calendar far legs when no symbol is given. */
    private ExpirationPattern defaultExpirationPattern = ExpirationPattern.DAILY;

    /** Symbol preselected by the editor. */
    private String defaultSymbol = "SPX";
}
