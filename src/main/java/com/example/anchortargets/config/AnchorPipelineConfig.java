package com.example.anchortargets.config;

import com.example.anchortargets.model.AnchorGrid;
import com.example.anchortargets.rpn.util.ImageRecordCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnchorPipelineConfig {
    private static final Logger log = LoggerFactory.getLogger(AnchorPipelineConfig.class);

    @Bean
    public AnchorGrid anchorGrid(AnchorTargetProperties properties) {
        AnchorTargetProperties.Grid grid = properties.getGrid();
        int convSize = grid.resolveConvSize(properties.getMaxSize());
        AnchorGrid anchorGrid = AnchorGrid.tile(grid.parseBaseAnchors(), convSize, convSize, grid.getStride());
        log.info("Generated {}", anchorGrid);
        return anchorGrid;
    }

    @Bean
    public AnchorTargetSettings anchorTargetSettings(AnchorTargetProperties properties) {
        return properties.toSettings();
    }

    @Bean
    public ImageRecordCache imageRecordCache() {
        return new ImageRecordCache();
    }
}
