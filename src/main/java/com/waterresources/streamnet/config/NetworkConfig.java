package com.waterresources.streamnet.config;

import com.waterresources.streamnet.model.TributaryOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the {@code streamnet.network.*} properties from application.yml.
 */
@Configuration
@Slf4j
public class NetworkConfig {

    @Value("${streamnet.network.tributary-order:ADDED_FIRST}")
    private TributaryOrder tributaryOrder;

    @Value("${streamnet.network.treat-dry-as-natural-flow:false}")
    private boolean treatDryAsNaturalFlow;

    @Value("${streamnet.network.end-node-id:END}")
    private String endNodeId;

    @Value("${streamnet.network.node-spacing:1.0}")
    private double nodeSpacing;

    @Value("${streamnet.network.spacing-fraction:0.06}")
    private double spacingFraction;

    @Value("${streamnet.network.clamp-margin-fraction:0.05}")
    private double clampMarginFraction;

    @Value("${streamnet.network.insert-epsilon:0.001}")
    private double insertEpsilon;

    @Bean
    public NetworkSettings networkSettings() {
        log.info("[Network Config] tributary order: {}, dry as natural flow: {}, end node id: {}",
                tributaryOrder, treatDryAsNaturalFlow, endNodeId);

        return NetworkSettings.builder()
                .tributaryOrder(tributaryOrder)
                .treatDryAsNaturalFlow(treatDryAsNaturalFlow)
                .endNodeId(endNodeId)
                .nodeSpacing(nodeSpacing)
                .spacingFraction(spacingFraction)
                .clampMarginFraction(clampMarginFraction)
                .insertEpsilon(insertEpsilon)
                .build();
    }
}
