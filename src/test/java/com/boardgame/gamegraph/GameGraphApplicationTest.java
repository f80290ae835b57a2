package com.boardgame.gamegraph;

import com.boardgame.gamegraph.config.BggProperties;
import com.boardgame.gamegraph.config.OutputProperties;
import com.boardgame.gamegraph.config.SimilarityProperties;
import com.boardgame.gamegraph.model.SimilarityWeights;
import com.boardgame.gamegraph.runner.GenerateDataRunner;
import com.boardgame.gamegraph.service.GraphExportService;
import com.boardgame.gamegraph.service.GraphGenerationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "gamegraph.runner.enabled=false",
        "gamegraph.bgg.batch-size=10",
        "gamegraph.similarity.edge-threshold=0.5"
})
class GameGraphApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private BggProperties bggProperties;

    @Autowired
    private SimilarityProperties similarityProperties;

    @Autowired
    private OutputProperties outputProperties;

    @Autowired
    private SimilarityWeights similarityWeights;

    @Test
    void testPropertiesAreBound() {
        assertEquals("https://boardgamegeek.com/xmlapi2", bggProperties.getBaseUrl());
        assertEquals(10, bggProperties.getBatchSize());
        assertEquals(3, bggProperties.getMaxAttempts());
        assertEquals(0.5, similarityProperties.getEdgeThreshold());
        assertEquals("data", outputProperties.getDirectory());
    }

    @Test
    void testWeightsComeFromProperties() {
        assertEquals(SimilarityWeights.DEFAULT, similarityWeights);
    }

    @Test
    void testPipelineIsWired() {
        assertNotNull(context.getBean(GraphGenerationService.class));
        assertNotNull(context.getBean(GraphExportService.class));
        assertNotNull(context.getBean(ObjectMapper.class));
        assertNotNull(context.getBean(OkHttpClient.class));
    }

    @Test
    void testRunnerCanBeSwitchedOff() {
        assertTrue(context.getBeansOfType(GenerateDataRunner.class).isEmpty());
    }
}
