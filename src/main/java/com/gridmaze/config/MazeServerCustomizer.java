package com.gridmaze.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.boot.web.servlet.server.ConfigurableServletWebServerFactory;
import org.springframework.stereotype.Component;

@Component
public class MazeServerCustomizer implements WebServerFactoryCustomizer<ConfigurableServletWebServerFactory> {

    private static final Logger log = LoggerFactory.getLogger(MazeServerCustomizer.class);

    private final AppProperties properties;

    public MazeServerCustomizer(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public void customize(ConfigurableServletWebServerFactory factory) {
        factory.setAddress(properties.getBindAddress());
        factory.setPort(properties.getBindPort());
        log.info("Maze service bound to {}:{} (default maze {}x{} {}, store {})",
                properties.getBindHost(),
                properties.getBindPort(),
                properties.getMazeWidth(),
                properties.getMazeHeight(),
                properties.getMazeAlgorithm(),
                properties.getStorePath());
    }
}
