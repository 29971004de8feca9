package com.scanprep;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the external models and the pipeline from {@link PreprocessProperties}.
 */
@Configuration
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public QualityModel qualityModel(PreprocessProperties properties, RestTemplateBuilder restTemplateBuilder,
                                     ObjectMapper objectMapper) {
        PreprocessProperties.Quality quality = properties.getQuality();
        switch (quality.getMode()) {
            case COMMAND:
                log.info("Quality model: command '{}'", quality.getCommand());
                return new CommandQualityModel(quality.getCommand(), properties.getModelTimeout());
            case HTTP:
                log.info("Quality model: {}", quality.getUrl());
                return new HttpQualityModel(restTemplateBuilder
                        .setConnectTimeout(properties.getModelTimeout())
                        .setReadTimeout(properties.getModelTimeout())
                        .build(), objectMapper, quality.getUrl());
            default:
                log.warn("No quality model configured; images without a cached score follow the score-unavailable policy");
                return QualityModel.none();
        }
    }

    @Bean
    public BinarizationModel binarizationModel(PreprocessProperties properties) {
        String command = properties.getBinarizer().getCommand();
        if (command == null || command.isBlank()) {
            log.warn("No binarization model configured; GOOD images will fail binarization");
            return BinarizationModel.none();
        }
        log.info("Binarization model: command '{}'", command);
        return new CommandBinarizationModel(command, properties.getModelTimeout());
    }

    @Bean(destroyMethod = "close")
    public PreprocessPipeline preprocessPipeline(PreprocessProperties properties, QualityModel qualityModel,
                                                 BinarizationModel binarizationModel) {
        return new PreprocessPipeline(qualityModel, binarizationModel,
                new ModelCallExecutor(properties.getModelTimeout()),
                properties.getWorkerThreads(), properties.getCacheFileName(), properties.getOutputFormat());
    }
}
