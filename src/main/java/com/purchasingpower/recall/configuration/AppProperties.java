package com.purchasingpower.recall.configuration;

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
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GraphProperties graph = new GraphProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private MaintenanceProperties maintenance = new MaintenanceProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ReflectionProperties reflection = new ReflectionProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private VectorProperties vector = new VectorProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OllamaProperties ollama = new OllamaProperties();
}
