package com.lumen.runtime;

import com.lumen.config.LumenProperties;
import com.lumen.model.GenerateOptions;
import com.lumen.model.RuntimeGenerateRequest;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds runtime generate requests from caller options and configured defaults.
 * Caller-supplied sampling options win over the defaults.
 */
@Component
public class RuntimeRequestFactory {

    private final LumenProperties.RuntimeConfig config;

    public RuntimeRequestFactory(LumenProperties properties) {
        this.config = properties.getRuntime();
    }

    public RuntimeGenerateRequest build(String prompt, GenerateOptions options, boolean stream) {
        GenerateOptions effective = options != null ? options : GenerateOptions.defaults();

        Map<String, Object> sampling = new LinkedHashMap<>();
        sampling.put("temperature", config.getTemperature());
        sampling.put("num_predict", config.getMaxTokens());
        if (effective.getOptions() != null) {
            sampling.putAll(effective.getOptions());
        }

        return RuntimeGenerateRequest.builder()
                .model(resolveModel(effective))
                .prompt(prompt)
                .system(effective.getSystem())
                .template(effective.getTemplate())
                .context(effective.getContext())
                .options(sampling)
                .stream(stream)
                .build();
    }

    public String resolveModel(GenerateOptions options) {
        if (options != null && options.getModel() != null && !options.getModel().isBlank()) {
            return options.getModel();
        }
        return config.getDefaultModel();
    }
}
