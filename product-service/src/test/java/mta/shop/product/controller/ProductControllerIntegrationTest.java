package mta.shop.product.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import mta.shop.product.exception.StorageUnavailableException;
import mta.shop.product.service.storage.BlobStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@ActiveProfiles("test")
class ProductControllerIntegrationTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private BlobStorageService blobStorageService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        jdbcTemplate.update("DELETE FROM products");
    }

    private long createProduct(String name, String price, int stock) throws Exception {
        String body = """
                {"name": "%s", "description": "test item", "price": %s, "stock_quantity": %d}
                """.formatted(name, price, stock);
        String response = mockMvc.perform(post("/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode json = objectMapper.readTree(response);
        return json.get("product_id").asLong();
    }

    @Test
    void testCreateAndGetProduct() throws Exception {
        long id = createProduct("Headphones", "79.50", 8);

        mockMvc.perform(get("/products/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.product_id").value(id))
                .andExpect(jsonPath("$.name").value("Headphones"))
                .andExpect(jsonPath("$.price").value(79.5))
                .andExpect(jsonPath("$.stock_quantity").value(8))
                .andExpect(jsonPath("$.created_at").exists());
    }

    @Test
    void testCreateProduct_ValidationError() throws Exception {
        mockMvc.perform(post("/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"\", \"price\": -1, \"stock_quantity\": -5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.field_errors.name").exists())
                .andExpect(jsonPath("$.details.field_errors.price").exists())
                .andExpect(jsonPath("$.details.field_errors.stockQuantity").exists());
    }

    @Test
    void testCreateProduct_MalformedJson() throws Exception {
        mockMvc.perform(post("/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    @Test
    void testGetProduct_NotFoundAndInvalidId() throws Exception {
        mockMvc.perform(get("/products/424242"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/products/424242"));

        mockMvc.perform(get("/products/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_PARAMETER"));
    }

    @Test
    void testListProducts_SearchAndPaging() throws Exception {
        createProduct("Red Chair", "30.00", 1);
        createProduct("Blue Chair", "35.00", 1);
        createProduct("Table", "90.00", 1);

        mockMvc.perform(get("/products").param("search", "chair"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/products").param("skip", "2").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].name").value("Table"));

        mockMvc.perform(get("/products").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testUpdateProduct_PartialFields() throws Exception {
        long id = createProduct("Lamp", "20.00", 4);

        mockMvc.perform(put("/products/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": 25.00}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Lamp"))
                .andExpect(jsonPath("$.price").value(25.0))
                .andExpect(jsonPath("$.stock_quantity").value(4));
    }

    @Test
    void testDeleteProduct() throws Exception {
        long id = createProduct("Old Stock", "1.00", 1);

        mockMvc.perform(delete("/products/" + id))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/products/" + id))
                .andExpect(status().isNotFound());
    }

    @Test
    void testDeductAndRestockStock() throws Exception {
        long id = createProduct("Monitor", "150.00", 5);

        mockMvc.perform(patch("/products/" + id + "/deduct-stock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity_to_deduct\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stock_quantity").value(2));

        mockMvc.perform(patch("/products/" + id + "/deduct-stock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity_to_deduct\": 3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INSUFFICIENT_STOCK"))
                .andExpect(jsonPath("$.details.available").value(2))
                .andExpect(jsonPath("$.details.requested").value(3));

        mockMvc.perform(patch("/products/" + id + "/restock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stock_quantity").value(5));

        mockMvc.perform(patch("/products/" + id + "/deduct-stock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity_to_deduct\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void testRestock_PastIntegerRange_ShouldReturn400() throws Exception {
        long id = createProduct("Speaker", "80.00", 5);

        mockMvc.perform(patch("/products/" + id + "/restock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\": 2147483647}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("STOCK_LIMIT_EXCEEDED"))
                .andExpect(jsonPath("$.details.current").value(5))
                .andExpect(jsonPath("$.details.requested").value(2147483647));

        mockMvc.perform(get("/products/" + id))
                .andExpect(jsonPath("$.stock_quantity").value(5));
    }

    @Test
    void testUploadImage_Success() throws Exception {
        long id = createProduct("Camera", "400.00", 2);
        when(blobStorageService.upload(ArgumentMatchers.startsWith("product-" + id + "-"), any(byte[].class), eq("image/jpeg")))
                .thenReturn("https://acct.blob.core.windows.net/images/camera.jpg?sv=1&sig=x");

        MockMultipartFile file = new MockMultipartFile("file", "camera.jpg", "image/jpeg", new byte[]{1, 2, 3});
        mockMvc.perform(multipart("/products/" + id + "/upload-image").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.image_url").value("https://acct.blob.core.windows.net/images/camera.jpg?sv=1&sig=x"));

        mockMvc.perform(get("/products/" + id))
                .andExpect(jsonPath("$.image_url").value(startsWith("https://acct.blob.core.windows.net/")));
    }

    @Test
    void testUploadImage_RejectsNonImageAndMissingStorage() throws Exception {
        long id = createProduct("Camera", "400.00", 2);

        MockMultipartFile text = new MockMultipartFile("file", "notes.txt", "text/plain", new byte[]{1});
        mockMvc.perform(multipart("/products/" + id + "/upload-image").file(text))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_IMAGE"));

        when(blobStorageService.upload(anyString(), any(byte[].class), anyString()))
                .thenThrow(new StorageUnavailableException("Image storage is not configured"));
        MockMultipartFile image = new MockMultipartFile("file", "a.png", "image/png", new byte[]{1});
        mockMvc.perform(multipart("/products/" + id + "/upload-image").file(image))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("STORAGE_NOT_CONFIGURED"));
    }

    @Test
    void testHealthEndpoints() throws Exception {
        mockMvc.perform(get("/health/live"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.type").value("liveness"));

        mockMvc.perform(get("/health/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.checks.database.status").value("UP"));
    }

    @Test
    void testRootMetadata() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("Product Service"))
                .andExpect(jsonPath("$.endpoints.products.deductStock.path").value("/products/{product_id}/deduct-stock"));
    }
}
