package io.github.crudgraph.web;

import io.github.crudgraph.TestEntityGraph;
import io.github.crudgraph.core.config.CrudGraphProperties;
import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.context.ContextRequest;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import io.github.crudgraph.core.exception.CrudGraphExceptionHandler;
import io.github.crudgraph.service.CrudGraphServiceFactory;
import io.github.crudgraph.service.EntityDataProvider;
import io.github.crudgraph.service.EntityServiceConfig;
import io.github.crudgraph.service.ListResult;
import io.github.crudgraph.service.capability.GetCapable;
import io.github.crudgraph.service.capability.ListCapable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CrudGraphControllerTest {

    @RestController
    @RequestMapping("/products")
    static class ProductController extends CrudGraphController {

        private final Object provider;

        ProductController(Object provider) {
            this.provider = provider;
        }

        @Override
        protected EntityServiceConfig serviceConfig() {
            return EntityServiceConfig.builder().entity("product").build();
        }

        @Override
        protected Object createDataProvider() {
            return provider;
        }
    }

    static class ReadOnlyProvider implements ListCapable<Map<String, Object>>, GetCapable<Map<String, Object>> {

        @Override
        public ListResult<Map<String, Object>> getList(AuthContext auth, ContextRequest request) {
            return new ListResult<>(List.of(), 0, 1, 25);
        }

        @Override
        public Map<String, Object> getItem(AuthContext auth, Object id) {
            return Map.of("id", id);
        }
    }

    private EntityDataProvider<Map<String, Object>> provider;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        provider = mock(EntityDataProvider.class);
    }

    private MockMvc mockMvc(Object dataProvider) {
        CrudGraphServiceFactory factory = mock(CrudGraphServiceFactory.class);
        when(factory.getGraph()).thenReturn(TestEntityGraph.create());

        ProductController controller = new ProductController(dataProvider);
        controller.serviceFactory = factory;
        controller.authContextResolver = new RequestAttributeAuthContextResolver();
        controller.properties = new CrudGraphProperties();
        controller.initialize();

        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new CrudGraphExceptionHandler())
                .build();
    }

    @Test
    void getList_returnsItemsWithPagination() throws Exception {
        when(provider.getList(any(), any())).thenReturn(
                new ListResult<>(List.of(Map.of("id", 3, "name", "Charlie")), 5, 2, 1));

        mockMvc(provider).perform(get("/products").param("page", "2").param("page_size", "1")
                        .param("filter", "name eq Charlie"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].name").value("Charlie"))
                .andExpect(jsonPath("$.pagination.page").value(2))
                .andExpect(jsonPath("$.pagination.pageSize").value(1))
                .andExpect(jsonPath("$.pagination.totalCount").value(5));

        ArgumentCaptor<ContextRequest> request = ArgumentCaptor.forClass(ContextRequest.class);
        verify(provider).getList(any(), request.capture());
        assertThat(request.getValue().getPage()).isEqualTo(2);
        assertThat(request.getValue().getFilters()).containsExactly("name eq Charlie");
    }

    @Test
    void getItem_convertsIdAndPassesAuthAttribute() throws Exception {
        when(provider.getItem(any(), eq(42))).thenReturn(Map.of("id", 42));

        mockMvc(provider).perform(get("/products/42")
                        .requestAttr(AuthContext.REQUEST_ATTRIBUTE, Map.of("market_place", List.of(17))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(42));

        ArgumentCaptor<AuthContext> auth = ArgumentCaptor.forClass(AuthContext.class);
        verify(provider).getItem(auth.capture(), eq(42));
        assertThat(auth.getValue().getValues("market_place")).containsExactly(17);
    }

    @Test
    void getItem_notFound_returns404WithCode() throws Exception {
        when(provider.getItem(any(), eq(9))).thenThrow(new ApplicationException(ClientError.ITEM_NOT_FOUND));

        mockMvc(provider).perform(get("/products/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("ITEM_NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("The item does not exist or you do not have access."));
    }

    @Test
    void getItem_nonNumericId_returns400() throws Exception {
        mockMvc(provider).perform(get("/products/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void create_returns201() throws Exception {
        when(provider.createItem(any(), anyMap())).thenReturn(Map.of("id", 1, "name", "Widget"));

        mockMvc(provider).perform(post("/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Widget\",\"market_place\":{\"id\":17}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.statusCode").value(201))
                .andExpect(jsonPath("$.data.name").value("Widget"));
    }

    @Test
    void create_malformedBody_returns400() throws Exception {
        mockMvc(provider).perform(post("/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST_BODY"));
    }

    @Test
    void patch_updatesPartially() throws Exception {
        when(provider.updateItem(any(), eq(5), anyMap(), eq(true))).thenReturn(Map.of("id", 5, "available", false));

        mockMvc(provider).perform(patch("/products/5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"available\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.available").value(false));

        verify(provider).updateItem(any(), eq(5), eq(Map.of("available", false)), eq(true));
    }

    @Test
    void create_readOnlyProvider_returns405() throws Exception {
        mockMvc(new ReadOnlyProvider()).perform(post("/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Widget\"}"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error.code").value("OPERATION_NOT_SUPPORTED"));
    }

    @Test
    void delete_readOnlyProvider_returns405() throws Exception {
        mockMvc(new ReadOnlyProvider()).perform(delete("/products/5"))
                .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void initialize_exposesProviderCapabilities() {
        CrudGraphServiceFactory factory = mock(CrudGraphServiceFactory.class);
        when(factory.getGraph()).thenReturn(TestEntityGraph.create());
        ProductController controller = new ProductController(new ReadOnlyProvider());
        controller.serviceFactory = factory;
        controller.initialize();

        assertThat(controller.getCapabilities().getOperations()).hasSize(2);
    }
}
