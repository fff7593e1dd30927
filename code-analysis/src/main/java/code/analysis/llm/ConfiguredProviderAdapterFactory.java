package code.analysis.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ConfiguredProviderAdapterFactory implements ProviderAdapterFactory {
    private final ObjectMapper objectMapper;
    private final String ollamaHost;
    private final String ollamaModel;
    private final long ollamaTimeoutSeconds;
    private final String openAiApiKey;
    private final String openAiBaseUrl;
    private final String openAiModel;
    private final double openAiTemperature;
    private final int openAiMaxTokens;
    private final long openAiTimeoutSeconds;

    public ConfiguredProviderAdapterFactory(
            ObjectMapper objectMapper,
            @Value("${code.analysis.llm.ollama.host:http://localhost:11434}") String ollamaHost,
            @Value("${code.analysis.llm.ollama.model:codellama}") String ollamaModel,
            @Value("${code.analysis.llm.ollama.timeout-seconds:600}") long ollamaTimeoutSeconds,
            @Value("${code.analysis.llm.openai.api-key:}") String openAiApiKey,
            @Value("${code.analysis.llm.openai.base-url:https://api.openai.com/v1}") String openAiBaseUrl,
            @Value("${code.analysis.llm.openai.model:gpt-3.5-turbo}") String openAiModel,
            @Value("${code.analysis.llm.openai.temperature:0.3}") double openAiTemperature,
            @Value("${code.analysis.llm.openai.max-tokens:2000}") int openAiMaxTokens,
            @Value("${code.analysis.llm.openai.timeout-seconds:120}") long openAiTimeoutSeconds
    ) {
        this.objectMapper = objectMapper;
        this.ollamaHost = ollamaHost;
        this.ollamaModel = ollamaModel;
        this.ollamaTimeoutSeconds = ollamaTimeoutSeconds;
        this.openAiApiKey = openAiApiKey;
        this.openAiBaseUrl = openAiBaseUrl;
        this.openAiModel = openAiModel;
        this.openAiTemperature = openAiTemperature;
        this.openAiMaxTokens = openAiMaxTokens;
        this.openAiTimeoutSeconds = openAiTimeoutSeconds;
    }

    @Override
    public ProviderAdapter create(ProviderId id) {
        return switch (id) {
            case OLLAMA -> new OllamaProviderAdapter(objectMapper, ollamaHost, ollamaModel, ollamaTimeoutSeconds);
            case OPENAI -> new OpenAiProviderAdapter(
                    objectMapper,
                    openAiApiKey,
                    openAiBaseUrl,
                    openAiModel,
                    openAiTemperature,
                    openAiMaxTokens,
                    openAiTimeoutSeconds
            );
        };
    }
}
