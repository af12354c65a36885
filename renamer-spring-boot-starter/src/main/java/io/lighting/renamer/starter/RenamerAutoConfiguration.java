package io.lighting.renamer.starter;

import io.lighting.renamer.observe.TemplateLog;
import io.lighting.renamer.observe.TemplateObserver;
import io.lighting.renamer.template.RenameTemplateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnClass(RenameTemplateEngine.class)
@EnableConfigurationProperties(RenamerProperties.class)
public class RenamerAutoConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(RenamerAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "renamer.log", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TemplateLog renamerTemplateLog(RenamerProperties properties) {
        return properties.getLog().build(LOGGER::info);
    }

    @Bean
    @ConditionalOnMissingBean
    public RenameTemplateEngine renameTemplateEngine(
        RenamerProperties properties,
        ObjectProvider<TemplateObserver> observers
    ) {
        return RenameTemplateEngine.builder()
            .mode(properties.getMode())
            .cacheMaximumSize(properties.getCache().getMaximumSize())
            .observers(observers.orderedStream().toList())
            .build();
    }
}
