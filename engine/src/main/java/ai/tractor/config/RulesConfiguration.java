package ai.tractor.config;

import ai.tractor.PlayValidationService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Import this into an application context to get a {@link PlayValidationService} bound to
 * the {@code rules.*} properties.
 */
@Configuration
@EnableConfigurationProperties
@ComponentScan(basePackageClasses = PlayValidationService.class)
public class RulesConfiguration {
}
