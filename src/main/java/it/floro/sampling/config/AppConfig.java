package it.floro.sampling.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configurazione applicativa: abilita le proprietà "sampling" ed espone il Clock
 * da cui si ricava la data di esecuzione quando la richiesta non ne fornisce una.
 */
@Configuration
@EnableConfigurationProperties(SamplingProperties.class)
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public Clock samplingClock(SamplingProperties properties) {
        logger.info("Analisi campionamento configurata: primo anno {}, unità {}, fuso {}, giorni non lavorativi {}",
                properties.firstYear(),
                properties.defaultUnit(),
                properties.zone(),
                properties.projection().nonBusinessDays());
        return Clock.system(properties.zone());
    }
}
