package io.github.crudgraph.web;

import io.github.crudgraph.core.config.CrudGraphProperties;
import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.context.ContextRequest;
import io.github.crudgraph.core.model.EntityDescriptor;
import io.github.crudgraph.core.response.ApiResponse;
import io.github.crudgraph.service.CrudGraphServiceFactory;
import io.github.crudgraph.service.EntityServiceConfig;
import io.github.crudgraph.service.ListResult;
import io.github.crudgraph.service.capability.DataProviderCapabilities;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;
import java.util.Map;

/**
 * Base REST controller of one entity - thin HTTP layer over a data provider.
 * Subclasses declare a {@code @RequestMapping} and the entity's {@link EntityServiceConfig};
 * operations the provider does not implement answer 405.
 */
@Slf4j
public abstract class CrudGraphController {

    @Autowired
    protected CrudGraphServiceFactory serviceFactory;

    @Autowired
    protected AuthContextResolver authContextResolver;

    @Autowired
    protected CrudGraphProperties properties;

    private DataProviderCapabilities capabilities;
    private EntityDescriptor entity;

    /**
     * Configuration of the served entity.
     */
    protected abstract EntityServiceConfig serviceConfig();

    /**
     * Provider serving the endpoints. Return an object implementing only some capability interfaces
     * to expose a read-only or otherwise restricted API.
     */
    protected Object createDataProvider() {
        return serviceFactory.create(serviceConfig());
    }

    @PostConstruct
    protected void initialize() {
        EntityServiceConfig config = serviceConfig();
        entity = serviceFactory.getGraph().entity(config.getEntity());
        capabilities = DataProviderCapabilities.of(createDataProvider());

        log.info("════════════════════════════════════════════════");
        log.info("Controller: {} | Entity: {} | Operations: {}",
                getClass().getSimpleName(), entity.getName(), capabilities.getOperations());
        log.info("════════════════════════════════════════════════");
    }

    // ==================== READ ENDPOINTS ====================

    @GetMapping
    public ResponseEntity<ApiResponse<?>> getList(@RequestParam MultiValueMap<String, String> params,
                                                  HttpServletRequest httpRequest) {
        long startTime = System.currentTimeMillis();
        try {
            ContextRequest request = new ContextRequest(params,
                    properties.getPagination().getDefaultPageSize(),
                    properties.getPagination().getMaximumPageSize());
            ListResult<Object> result = capabilities.lister().getList(auth(httpRequest), request);

            long executionTime = System.currentTimeMillis() - startTime;
            log.info("Listed {} of {} {} item(s) | Time: {} ms",
                    result.getItems().size(), result.getTotalCount(), entity.getName(), executionTime);

            return ResponseEntity.ok(ApiResponse.<List<Object>>page(result.getItems(), result.getPage(),
                    result.getPageSize(), result.getTotalCount(), executionTime));
        } catch (RuntimeException e) {
            log.error("Error listing {}: {} | Time: {} ms",
                    entity.getName(), e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<?>> getItem(@PathVariable String id, HttpServletRequest httpRequest) {
        long startTime = System.currentTimeMillis();
        try {
            Object item = capabilities.getter().getItem(auth(httpRequest), convertId(id));

            long executionTime = System.currentTimeMillis() - startTime;
            log.debug("Fetched {} {} | Time: {} ms", entity.getName(), id, executionTime);

            return ResponseEntity.ok(ApiResponse.success(item, "Item retrieved successfully", executionTime));
        } catch (RuntimeException e) {
            log.error("Error fetching {} {}: {} | Time: {} ms",
                    entity.getName(), id, e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    // ==================== WRITE ENDPOINTS ====================

    @PostMapping
    public ResponseEntity<ApiResponse<?>> create(@RequestBody Map<String, Object> requestBody,
                                                 HttpServletRequest httpRequest) {
        long startTime = System.currentTimeMillis();
        try {
            Object created = capabilities.creator().createItem(auth(httpRequest), requestBody);

            long executionTime = System.currentTimeMillis() - startTime;
            log.info("{} created | Time: {} ms", entity.getName(), executionTime);

            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(ApiResponse.success(created, "Item created successfully", HttpStatus.CREATED, executionTime));
        } catch (RuntimeException e) {
            log.error("Error creating {}: {} | Time: {} ms",
                    entity.getName(), e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<?>> update(@PathVariable String id, @RequestBody Map<String, Object> requestBody,
                                                 HttpServletRequest httpRequest) {
        return doUpdate(id, requestBody, false, httpRequest);
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ApiResponse<?>> patch(@PathVariable String id, @RequestBody Map<String, Object> requestBody,
                                                HttpServletRequest httpRequest) {
        return doUpdate(id, requestBody, true, httpRequest);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<?>> delete(@PathVariable String id, HttpServletRequest httpRequest) {
        long startTime = System.currentTimeMillis();
        try {
            Object deleted = capabilities.deleter().deleteItem(auth(httpRequest), convertId(id));

            long executionTime = System.currentTimeMillis() - startTime;
            log.info("{} {} deleted | Time: {} ms", entity.getName(), id, executionTime);

            return ResponseEntity.ok(ApiResponse.success(deleted, "Item deleted successfully", executionTime));
        } catch (RuntimeException e) {
            log.error("Error deleting {} {}: {} | Time: {} ms",
                    entity.getName(), id, e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    private ResponseEntity<ApiResponse<?>> doUpdate(String id, Map<String, Object> requestBody, boolean isPartial,
                                                    HttpServletRequest httpRequest) {
        long startTime = System.currentTimeMillis();
        try {
            Object updated = capabilities.updater()
                    .updateItem(auth(httpRequest), convertId(id), requestBody, isPartial);

            long executionTime = System.currentTimeMillis() - startTime;
            log.info("{} {} {} | Time: {} ms", entity.getName(), id, isPartial ? "patched" : "updated", executionTime);

            return ResponseEntity.ok(ApiResponse.success(updated, "Item updated successfully", executionTime));
        } catch (RuntimeException e) {
            log.error("Error updating {} {}: {} | Time: {} ms",
                    entity.getName(), id, e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    // ==================== HELPERS ====================

    protected AuthContext auth(HttpServletRequest request) {
        return authContextResolver.resolve(request);
    }

    protected Object convertId(String raw) {
        return entity.primaryKeyAttribute().getType().convert(raw);
    }

    public DataProviderCapabilities getCapabilities() {
        return capabilities;
    }
}
