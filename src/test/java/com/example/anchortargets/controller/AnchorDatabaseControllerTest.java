package com.example.anchortargets.controller;

import com.example.anchortargets.rpn.util.ImageRecordCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;
import static org.hamcrest.Matchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("ci")
@AutoConfigureMockMvc
public class AnchorDatabaseControllerTest {

    // 600 x 400 resizes by 1.5 to 900 x 600
    private static final String ONE_IMAGE = """
        {
            "images": [
                {
                    "imageId": "000005",
                    "width": 600,
                    "height": 400,
                    "gtBoxes": [[20, 20, 120, 120]],
                    "gtClasses": [7]
                }
            ]
        }
        """;

    private static final String ONE_IMAGE_FLIPPED = """
        {
            "addFlipped": true,
            "images": [
                {
                    "imageId": "000005",
                    "width": 600,
                    "height": 400,
                    "gtBoxes": [[20, 20, 120, 120]],
                    "gtClasses": [7]
                }
            ]
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ImageRecordCache imageRecordCache;

    @Test
    public void testBuildDatabase() throws Exception {
        mockMvc.perform(post("/api/anchors/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ONE_IMAGE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success", is(true)))
            .andExpect(jsonPath("$.message", is("Anchor database built")))
            .andExpect(jsonPath("$.data.records", is(1)))
            .andExpect(jsonPath("$.data.totalAnchors", is(3600)))
            .andExpect(jsonPath("$.data.images[0].imageId", is("000005")))
            .andExpect(jsonPath("$.data.images[0].resizedWidth", is(900)))
            .andExpect(jsonPath("$.data.images[0].resizedHeight", is(600)))
            .andExpect(jsonPath("$.data.images[0].scale", is(1.5)))
            .andExpect(jsonPath("$.data.images[0].foreground", greaterThan(0)))
            .andExpect(jsonPath("$.data.images[0].background", greaterThan(0)));
    }

    @Test
    public void testBuildDatabaseWithFlippedCopies() throws Exception {
        mockMvc.perform(post("/api/anchors/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ONE_IMAGE_FLIPPED))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.records", is(2)))
            .andExpect(jsonPath("$.data.images[1].flipped", is(true)));

        mockMvc.perform(get("/api/anchors/database/000005/sample").param("flipped", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success", is(true)));
    }

    @Test
    public void testSampleCachedImage() throws Exception {
        mockMvc.perform(post("/api/anchors/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ONE_IMAGE))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/anchors/database/000005/sample").param("seed", "7"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success", is(true)))
            .andExpect(jsonPath("$.data.requested", is(16)))
            .andExpect(jsonPath("$.data.indices", hasSize(16)))
            .andExpect(jsonPath("$.data.labels[0]", is(1)))
            .andExpect(jsonPath("$.data.foregroundCount", greaterThan(0)))
            .andExpect(jsonPath("$.data.short", is(false)));
    }

    @Test
    public void testTrainingTargetsForCachedImage() throws Exception {
        mockMvc.perform(post("/api/anchors/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ONE_IMAGE))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/anchors/database/000005/targets").param("seed", "7"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalAnchors", is(3600)))
            .andExpect(jsonPath("$.data.sampled", is(16)))
            .andExpect(jsonPath("$.data.labelMaskCount", is(16)))
            .andExpect(jsonPath("$.data.bboxMaskCount", greaterThan(0)))
            .andExpect(jsonPath("$.data.scaledGtBoxes[0].xMin", is(30.0)))
            .andExpect(jsonPath("$.data.scaledGtBoxes[0].yMax", is(180.0)))
            .andExpect(jsonPath("$.data.gtClasses[0]", is(7)));
    }

    @Test
    public void testUnknownImageReturnsNotFound() throws Exception {
        mockMvc.perform(post("/api/anchors/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ONE_IMAGE))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/anchors/database/999999/sample"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.success", is(false)))
            .andExpect(jsonPath("$.message", is("Image record not found")))
            .andExpect(jsonPath("$.error", containsString("999999")));

        // no flipped copies were built
        mockMvc.perform(get("/api/anchors/database/000005/sample").param("flipped", "true"))
            .andExpect(status().isNotFound());
    }

    @Test
    public void testEmptyRequestIsRejected() throws Exception {
        mockMvc.perform(post("/api/anchors/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"images\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success", is(false)))
            .andExpect(jsonPath("$.message", is("Invalid request")));
    }

    @Test
    public void testMisalignedAnnotationIsRejected() throws Exception {
        String body = """
            {"images": [{"imageId": "a", "width": 100, "height": 100, "gtBoxes": [[1, 1, 10, 10]], "gtClasses": []}]}
            """;

        mockMvc.perform(post("/api/anchors/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", containsString("gt classes")));
    }

    @Test
    public void testMalformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/anchors/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"images\": [ not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success", is(false)));
    }

    @Test
    public void testEpochPlan() throws Exception {
        mockMvc.perform(post("/api/anchors/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ONE_IMAGE_FLIPPED))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/anchors/epoch").param("seed", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.batches", is(2)))
            .andExpect(jsonPath("$.data.order", hasSize(2)))
            .andExpect(jsonPath("$.data.order", containsInAnyOrder(0, 1)));
    }

    @Test
    public void testLargeDatabaseIsKeptWhole() throws Exception {
        // Given: nine images plus flipped copies
        StringBuilder images = new StringBuilder();
        for (int i = 0; i < 9; i++) {
            if (i > 0) {
                images.append(',');
            }
            images.append("{\"imageId\": \"img").append(i)
                .append("\", \"width\": 600, \"height\": 400, \"gtBoxes\": [[20, 20, 120, 120]], \"gtClasses\": [7]}");
        }
        String body = "{\"addFlipped\": true, \"images\": [" + images + "]}";

        // When
        mockMvc.perform(post("/api/anchors/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.records", is(18)));

        // Then
        mockMvc.perform(get("/api/anchors/epoch").param("seed", "3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.batches", is(18)))
            .andExpect(jsonPath("$.data.order", hasSize(18)))
            .andExpect(jsonPath("$.data.order", everyItem(allOf(greaterThanOrEqualTo(0), lessThan(18)))));

        mockMvc.perform(get("/api/anchors/database/img0/sample").param("seed", "7"))
            .andExpect(status().isOk());
        mockMvc.perform(get("/api/anchors/database/img0/sample").param("flipped", "true"))
            .andExpect(status().isOk());
    }

    @Test
    public void testEpochPlanNeedsDatabase() throws Exception {
        imageRecordCache.clear();

        mockMvc.perform(get("/api/anchors/epoch"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success", is(false)))
            .andExpect(jsonPath("$.message", is("Anchor database is empty")));
    }

    @Test
    public void testEmptyDatabaseMessageFollowsAcceptLanguage() throws Exception {
        imageRecordCache.clear();

        mockMvc.perform(get("/api/anchors/epoch").header("Accept-Language", "zh-CN,zh;q=0.9"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", is("锚框数据库为空")));
    }
}
