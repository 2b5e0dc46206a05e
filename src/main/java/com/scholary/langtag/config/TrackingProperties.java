package com.scholary.langtag.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Where the processing tracker keeps its table, and whether it is consulted at all. */
@ConfigurationProperties(prefix = "tracking")
@Validated
public record TrackingProperties(boolean enabled, @NotBlank String directory) {}
