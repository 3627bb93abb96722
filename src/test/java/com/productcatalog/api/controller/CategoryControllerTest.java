package com.productcatalog.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.productcatalog.api.testutil.CatalogFixture;
import com.productcatalog.api.util.PaginationTokenCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * CategoryController over the real services and an in-memory table.
 */
@DisplayName("CategoryController Tests")
class CategoryControllerTest {

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        CatalogFixture fixture = new CatalogFixture();
        mockMvc = MockMvcBuilders.standaloneSetup(new CategoryController(fixture.categoryService))
                .setMessageConverters(new MappingJackson2HttpMessageConverter())
                .build();
    }

    private String createCategory(String name) throws Exception {
        MvcResult result = mockMvc.perform(post("/categories")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"" + name + "\",\"description\":\"Everything filed under " + name + "\"}"))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.path("data").path("id").asText();
    }

    @Test
    void categoryLifecycle() throws Exception {
        String id = createCategory("Gadgets");

        mockMvc.perform(get("/categories/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.name").value("Gadgets"));

        mockMvc.perform(put("/categories/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\":\"Small clever devices\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Category updated successfully"))
            .andExpect(jsonPath("$.data.description").value("Small clever devices"));

        mockMvc.perform(delete("/categories/{id}", id))
            .andExpect(status().isOk());

        mockMvc.perform(get("/categories/{id}", id))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Category not found"));
    }

    @Test
    void createCategory_DuplicateName_Returns409() throws Exception {
        createCategory("Gadgets");

        mockMvc.perform(post("/categories")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\" gadgets \",\"description\":\"Another gadgets category\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.message").value("Category name 'gadgets' already exists"));
    }

    @Test
    void updateCategory_UnknownField_Returns400() throws Exception {
        String id = createCategory("Gadgets");

        mockMvc.perform(put("/categories/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Tools\",\"parent_id\":\"x\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid fields: parent_id"));
    }

    @Test
    void updateCategory_ExplicitNullName_Returns400() throws Exception {
        String id = createCategory("Gadgets");

        mockMvc.perform(put("/categories/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":null}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Category name is required"));

        mockMvc.perform(get("/categories/{id}", id))
            .andExpect(jsonPath("$.data.name").value("Gadgets"));
    }

    @Test
    void updateCategory_EmptyBody_Returns400() throws Exception {
        String id = createCategory("Gadgets");

        mockMvc.perform(put("/categories/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("No valid fields to update"));
    }

    @Test
    void listCategories_FollowsNextToken() throws Exception {
        createCategory("Tools");
        createCategory("Appliances");

        MvcResult first = mockMvc.perform(get("/categories").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.items[0].name").value("Appliances"))
            .andReturn();
        String token = objectMapper.readTree(first.getResponse().getContentAsString())
            .path("data").path("next_token").asText();

        mockMvc.perform(get("/categories").param("limit", "1").param("last_key", token))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.items[0].name").value("Tools"));
    }

    @Test
    void listCategories_BadTokenOrLimit_Returns400() throws Exception {
        mockMvc.perform(get("/categories").param("last_key", "garbage!"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid continuation token"));

        String brandListToken = PaginationTokenCodec.encode(Map.of(
            "PK", AttributeValue.builder().s("BRAND#1").build(),
            "SK", AttributeValue.builder().s("BRAND#1").build(),
            "GSI3PK", AttributeValue.builder().s("BRAND_LIST").build(),
            "GSI3SK", AttributeValue.builder().s("ACME").build()));
        mockMvc.perform(get("/categories").param("last_key", brandListToken))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid continuation token"));

        mockMvc.perform(get("/categories").param("limit", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Limit must be at least 1"));
    }
}
