package io.github.riemr.roster.config;

import jakarta.validation.constraints.DecimalMin;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "roster.accounting")
@Validated
@Getter
@Setter
public class RosterAccountingProperties {

    /** Hours credited per day of a training absence. */
    @DecimalMin("0.0")
    private double creditedHoursPerDay = 8.0;
}
