package com.meridian.backend.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "meridian.model")
@Data
@Validated
public class ModelProperties {

    @NotNull
    private Duration inferenceTimeout = Duration.ofSeconds(5);
}
