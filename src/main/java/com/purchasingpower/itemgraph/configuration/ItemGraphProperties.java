package com.purchasingpower.itemgraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "itemgraph")
public class ItemGraphProperties {

    /**
     * Run one ingestion when the application starts, then exit with the run's status code.
     */
    private boolean runOnStartup = false;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SourceProperties source = new SourceProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private StoreProperties store = new StoreProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private UpsertProperties upsert = new UpsertProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private NormalizerProperties normalizer = new NormalizerProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ReportProperties report = new ReportProperties();
}
