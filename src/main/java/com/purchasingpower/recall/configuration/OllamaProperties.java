package com.purchasingpower.recall.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String chatModel = "qwen2.5:14b";

    @NotBlank
    private String embeddingModel = "nomic-embed-text";

    @Min(512)
    private int numCtx = 8192;

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 3;
}
