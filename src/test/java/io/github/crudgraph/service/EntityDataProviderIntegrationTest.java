package io.github.crudgraph.service;

import io.github.crudgraph.TestEntityGraph;
import io.github.crudgraph.core.config.CrudGraphProperties;
import io.github.crudgraph.core.context.AuthContext;
import io.github.crudgraph.core.context.ContextRequest;
import io.github.crudgraph.core.enums.Direction;
import io.github.crudgraph.core.enums.EntityStatus;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import io.github.crudgraph.core.exception.ServerError;
import io.github.crudgraph.core.query.ColumnRef;
import io.github.crudgraph.core.query.Condition;
import io.github.crudgraph.core.query.Include;
import io.github.crudgraph.core.query.OrderItem;
import io.github.crudgraph.generator.TimestampHierarchy;
import io.github.crudgraph.service.storage.jdbc.JdbcStorageClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Full stack of the product provider against an in-memory H2 database.
 */
class EntityDataProviderIntegrationTest {

    private static final AuthContext AUTH = AuthContext.of(Map.of(
            "market_place", List.of(17, 20),
            "internal", Map.of("id", 7)));

    private EmbeddedDatabase database;
    private JdbcTemplate jdbc;
    private JdbcStorageClient storage;
    private CrudGraphServiceFactory factory;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("schema.sql")
                .build();
        jdbc = new JdbcTemplate(database);
        jdbc.update("INSERT INTO market_place (id, name) VALUES (17, 'North'), (20, 'South'), (30, 'West')");
        jdbc.update("INSERT INTO supply_network (id, name, status_id) VALUES (1, 'Active', 1), (2, 'Retired', 2)");

        storage = new JdbcStorageClient(
                new NamedParameterJdbcTemplate(database),
                new TransactionTemplate(new DataSourceTransactionManager(database)),
                TestEntityGraph.create(), "TIMESTAMP", true);
        factory = new CrudGraphServiceFactory(TestEntityGraph.create(), storage, new CrudGraphProperties());
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private EntityServiceConfig.EntityServiceConfigBuilder productConfig() {
        return EntityServiceConfig.builder()
                .entity("product")
                .searchFields(List.of("name"))
                .timestampHierarchy(TimestampHierarchy.of("product", TimestampHierarchy.of("demand_source")))
                .fetchCondition(Condition.builder()
                        .include(Include.eager("detail"))
                        .include(Include.eager("contacts"))
                        .include(Include.eager("metadata"))
                        .include(Include.eager("orders"))
                        .include(Include.eager("notes"))
                        .build());
    }

    private EntityDataProvider<Map<String, Object>> products() {
        return factory.create(productConfig().build());
    }

    private Integer insertProduct(String name, int marketPlace) {
        jdbc.update("INSERT INTO product (name, market_place_id) VALUES (?, ?)", name, marketPlace);
        return jdbc.queryForObject("SELECT MAX(id) FROM product", Integer.class);
    }

    private static ContextRequest request(Map<String, List<String>> params) {
        return ContextRequest.of(params);
    }

    private static Map<String, Object> map(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(Map<String, Object> item, String key) {
        return (List<Map<String, Object>>) item.get(key);
    }

    private static ClientError errorOf(Throwable thrown) {
        return (ClientError) ((ApplicationException) thrown).getDescriptor();
    }

    // ==================== READ ====================

    @Test
    void getList_paginatesOverDistinctItems() {
        for (String name : List.of("Echo", "Alpha", "Delta", "Bravo", "Charlie")) {
            Integer id = insertProduct(name, 17);
            jdbc.update("INSERT INTO orders (product_id, quantity) VALUES (?, 1), (?, 2), (?, 3)", id, id, id);
        }
        insertProduct("Hidden", 30);

        ListResult<Map<String, Object>> page = products().getList(AUTH, request(Map.of(
                ContextRequest.SORT_BY, List.of("name"),
                ContextRequest.PAGE, List.of("2"),
                ContextRequest.PAGE_SIZE, List.of("2"))));

        assertThat(page.getTotalCount()).isEqualTo(5);
        assertThat(page.getItems()).extracting(item -> item.get("name")).containsExactly("Charlie", "Delta");
        assertThat(list(page.getItems().get(0), "orders")).hasSize(3);
    }

    @Test
    void getList_lastPartialPage_holdsRemainder() {
        for (String name : List.of("Alpha", "Bravo", "Charlie")) {
            insertProduct(name, 20);
        }

        ListResult<Map<String, Object>> page = products().getList(AUTH, request(Map.of(
                ContextRequest.PAGE, List.of("2"),
                ContextRequest.PAGE_SIZE, List.of("2"))));

        assertThat(page.getItems()).hasSize(1);
        assertThat(page.getTotalCount()).isEqualTo(3);
    }

    @Test
    void getList_pageBeyondEnd_isEmptyWithTotal() {
        insertProduct("Alpha", 17);

        ListResult<Map<String, Object>> page = products().getList(AUTH, request(Map.of(
                ContextRequest.PAGE, List.of("3"))));

        assertThat(page.getItems()).isEmpty();
        assertThat(page.getTotalCount()).isEqualTo(1);
    }

    @Test
    void getList_filterAndSearch_narrowResults() {
        Integer alpha = insertProduct("Alpha", 17);
        insertProduct("Alpine", 17);
        insertProduct("Bravo", 17);
        jdbc.update("INSERT INTO product_note (product_id, body) VALUES (?, 'fragile')", alpha);

        ListResult<Map<String, Object>> searched = products().getList(AUTH, request(Map.of(
                ContextRequest.SEARCH, List.of("Alp"))));
        ListResult<Map<String, Object>> filtered = products().getList(AUTH, request(Map.of(
                ContextRequest.SEARCH, List.of("Alp"),
                ContextRequest.FILTER, List.of("notes.body eq fragile"))));

        assertThat(searched.getItems()).extracting(item -> item.get("name")).containsExactly("Alpha", "Alpine");
        assertThat(filtered.getItems()).extracting(item -> item.get("id")).containsExactly(alpha);
        assertThat(filtered.getTotalCount()).isEqualTo(1);
    }

    @Test
    void getList_sortByUpdatedAt_usesLatestRelatedTimestamp() {
        jdbc.update("INSERT INTO demand_source (numeric_code, name, last_change_date) VALUES (40, 'Retail', ?)",
                LocalDateTime.of(2024, 6, 1, 0, 0));
        jdbc.update("INSERT INTO product (name, market_place_id, updated_at) VALUES ('Old', 17, ?)",
                LocalDateTime.of(2024, 1, 1, 0, 0));
        jdbc.update("INSERT INTO product (name, market_place_id, updated_at, demand_source_id) "
                + "VALUES ('Refreshed', 17, ?, 40)", LocalDateTime.of(2023, 1, 1, 0, 0));
        insertProduct("Untouched", 17);

        ListResult<Map<String, Object>> page = products().getList(AUTH, request(Map.of(
                ContextRequest.SORT_BY, List.of("-updated_at"))));

        assertThat(page.getItems()).extracting(item -> item.get("name"))
                .containsExactly("Refreshed", "Old", "Untouched");
        assertThat(page.getItems().get(0).get("updated_at")).isEqualTo(LocalDateTime.of(2024, 6, 1, 0, 0));
    }

    @Test
    void getList_orderStrategy_replacesSortBy() {
        for (String name : List.of("Alpha", "Charlie", "Bravo")) {
            insertProduct(name, 17);
        }
        EntityDataProvider<Map<String, Object>> provider = factory.create(productConfig()
                .orderStrategy((request, defaults) -> List.of(
                        OrderItem.of(ColumnRef.root("name"), Direction.DESC),
                        defaults.defaultOrder()))
                .build());

        ListResult<Map<String, Object>> page = provider.getList(AUTH, request(Map.of(
                ContextRequest.SORT_BY, List.of("name"))));

        assertThat(page.getItems()).extracting(item -> item.get("name"))
                .containsExactly("Charlie", "Bravo", "Alpha");
    }

    @Test
    void getList_pageFarBeyondEnd_isEmpty() {
        insertProduct("Alpha", 17);
        insertProduct("Bravo", 17);

        ListResult<Map<String, Object>> page = products().getList(AUTH, request(Map.of(
                ContextRequest.PAGE, List.of("1000000"),
                ContextRequest.PAGE_SIZE, List.of("25"))));

        assertThat(page.getItems()).isEmpty();
        assertThat(page.getTotalCount()).isEqualTo(2);
    }

    @Test
    void getList_offsetBeyondStorageWindow_isInvalidPage() {
        insertProduct("Alpha", 17);

        assertThatThrownBy(() -> products().getList(AUTH, request(Map.of(
                ContextRequest.PAGE, List.of("171798692"),
                ContextRequest.PAGE_SIZE, List.of("25")))))
                .isInstanceOf(ApplicationException.class)
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.VALIDATION_INVALID_PAGE));
    }

    @Test
    void getItem_outsideMarketPlaces_isNotFound() {
        Integer hidden = insertProduct("Hidden", 30);

        assertThatThrownBy(() -> products().getItem(AUTH, hidden))
                .isInstanceOf(ApplicationException.class)
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.ITEM_NOT_FOUND));
    }

    // ==================== CREATE ====================

    @Test
    void createItem_nestedHasOne_createsParentAndChild() {
        Map<String, Object> created = products().createItem(AUTH, map(
                "name", "Widget",
                "market_place", map("id", 17),
                "detail", map("description", "Blue and shiny")));

        Object id = created.get("id");
        assertThat(id).isNotNull();
        assertThat(created.get("market_place_id")).isEqualTo(17);
        assertThat(created.get("detail")).isInstanceOf(Map.class);
        assertThat(((Map<?, ?>) created.get("detail")).get("description")).isEqualTo("Blue and shiny");
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM product_detail WHERE product_id = ?", Integer.class, id))
                .isEqualTo(1);

        Map<String, Object> info = jdbc.queryForMap("SELECT * FROM info WHERE id = ?", created.get("info_id"));
        assertThat(info.get("CREATED_BY_ID")).isEqualTo(7);
        assertThat(info.get("CREATED_AT")).isNotNull();
    }

    @Test
    void createItem_belongsToMany_storesJoinAttributes() {
        Map<String, Object> created = products().createItem(AUTH, map(
                "name", "Widget",
                "market_place", map("id", 20),
                "contacts", List.of(map("name", "Ann", "email", "ann@example.com",
                        "through", map("contact_role", "owner")))));

        List<Map<String, Object>> contacts = list(created, "contacts");
        assertThat(contacts).hasSize(1);
        assertThat(contacts.get(0).get("email")).isEqualTo("ann@example.com");
        assertThat(contacts.get(0).get("through")).isEqualTo(Map.of("contact_role", "owner"));
    }

    @Test
    void createItem_foreignMarketPlace_isForbidden() {
        assertThatThrownBy(() -> products().createItem(AUTH, map("name", "Widget", "market_place", map("id", 30))))
                .isInstanceOf(ApplicationException.class)
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.NO_ACCESS));
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM product", Integer.class)).isZero();
    }

    @Test
    void createItem_referenceOutsideDefaultScope_isInvalidRelation() {
        assertThatThrownBy(() -> products().createItem(AUTH, map(
                "name", "Widget",
                "market_place", map("id", 17),
                "supplyNetwork", map("id", 2))))
                .isInstanceOf(ApplicationException.class)
                .hasMessageContaining("supplyNetwork")
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.VALIDATION_INVALID_RELATION));
    }

    @Test
    void createItem_storageFailure_isWrapped() {
        Map<String, Object> input = map("name", "Widget", "market_place", map("id", 17),
                "detail", map("description", "x".repeat(600)));

        assertThatThrownBy(() -> products().createItem(AUTH, input))
                .isInstanceOf(ApplicationException.class)
                .hasCauseInstanceOf(RuntimeException.class)
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.UNABLE_TO_CREATE));
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM product", Integer.class)).isZero();
    }

    // ==================== UPDATE ====================

    @Test
    void updateItem_replacesHasManyCollectionsPerRemovalPolicy() {
        Map<String, Object> created = products().createItem(AUTH, map(
                "name", "Widget",
                "market_place", map("id", 17),
                "metadata", List.of(map("meta_name", "colour"), map("meta_name", "size")),
                "orders", List.of(map("quantity", 1), map("quantity", 2)),
                "notes", List.of(map("body", "first"), map("body", "second"))));
        Object id = created.get("id");
        Object keptMetadata = list(created, "metadata").get(1).get("id");
        Object droppedMetadata = list(created, "metadata").get(0).get("id");
        Object keptOrder = list(created, "orders").get(1).get("id");
        Object droppedOrder = list(created, "orders").get(0).get("id");
        Object keptNote = list(created, "notes").get(1).get("id");

        products().updateItem(AUTH, id, map(
                "name", "Widget",
                "metadata", List.of(map("id", keptMetadata)),
                "orders", List.of(map("id", keptOrder)),
                "notes", List.of(map("id", keptNote))), false);

        // nullable key: unlinked
        assertThat(jdbc.queryForObject("SELECT product_id FROM product_metadata WHERE id = ?", Integer.class,
                droppedMetadata)).isNull();
        assertThat(jdbc.queryForObject("SELECT product_id FROM product_metadata WHERE id = ?", Integer.class,
                keptMetadata)).isEqualTo(id);
        // status column: marked deleted
        assertThat(jdbc.queryForObject("SELECT status_id FROM orders WHERE id = ?", Integer.class, droppedOrder))
                .isEqualTo(EntityStatus.DELETED.getId());
        assertThat(jdbc.queryForObject("SELECT status_id FROM orders WHERE id = ?", Integer.class, keptOrder))
                .isEqualTo(EntityStatus.REGULAR.getId());
        // neither: destroyed
        assertThat(jdbc.queryForList("SELECT id FROM product_note WHERE product_id = ?", Integer.class, id))
                .containsExactly((Integer) keptNote);

        Map<String, Object> info = jdbc.queryForMap("SELECT * FROM info WHERE id = ?", created.get("info_id"));
        assertThat(info.get("MODIFIED_BY_ID")).isEqualTo(7);
        assertThat(info.get("MODIFIED_AT")).isNotNull();
    }

    @Test
    void updateItem_belongsToMany_relinksExistingTarget() {
        Map<String, Object> created = products().createItem(AUTH, map(
                "name", "Widget",
                "market_place", map("id", 17),
                "contacts", List.of(map("name", "Ann", "through", map("contact_role", "owner")))));
        Object contactId = list(created, "contacts").get(0).get("id");

        Map<String, Object> updated = products().updateItem(AUTH, created.get("id"), map(
                "contacts", List.of(map("id", contactId, "through", map("contact_role", "buyer")))), true);

        assertThat(list(updated, "contacts")).singleElement()
                .satisfies(contact -> assertThat(contact.get("through")).isEqualTo(Map.of("contact_role", "buyer")));
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM product_contact", Integer.class)).isEqualTo(1);
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM contact", Integer.class)).isEqualTo(1);
    }

    @Test
    void updateItem_partial_keepsUntouchedAttributes() {
        Map<String, Object> created = products().createItem(AUTH, map(
                "name", "Widget", "available", true, "market_place", map("id", 17)));

        Map<String, Object> updated = products().updateItem(AUTH, created.get("id"), map("available", false), true);

        assertThat(updated.get("name")).isEqualTo("Widget");
        assertThat(updated.get("available")).isEqualTo(false);
        assertThat(updated.get("market_place_id")).isEqualTo(17);
    }

    @Test
    void updateItem_immutableField_isRejected() {
        EntityDataProvider<Map<String, Object>> provider = factory.create(productConfig().immutablePath("name").build());
        Map<String, Object> created = provider.createItem(AUTH, map("name", "Widget", "market_place", map("id", 17)));

        assertThatThrownBy(() -> provider.updateItem(AUTH, created.get("id"), map("name", "Gadget"), true))
                .isInstanceOf(ApplicationException.class)
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.VALIDATION_IMMUTABLE_FIELD));

        Map<String, Object> same = provider.updateItem(AUTH, created.get("id"), map("name", "Widget"), true);
        assertThat(same.get("name")).isEqualTo("Widget");
    }

    @Test
    void updateItem_outsideMarketPlaces_isForbidden() {
        Integer hidden = insertProduct("Hidden", 30);

        assertThatThrownBy(() -> products().updateItem(AUTH, hidden, map("name", "Mine"), true))
                .isInstanceOf(ApplicationException.class)
                .satisfies(thrown -> assertThat(errorOf(thrown)).isEqualTo(ClientError.NO_PERMISSIONS));
    }

    @Test
    void createItem_nestingBeyondMaxDepth_failsAndRollsBack() {
        CrudGraphProperties shallow = new CrudGraphProperties();
        shallow.getUpsert().setMaxDepth(1);
        EntityDataProvider<Map<String, Object>> provider =
                new CrudGraphServiceFactory(TestEntityGraph.create(), storage, shallow).create(productConfig().build());

        assertThatThrownBy(() -> provider.createItem(AUTH, map(
                "name", "Widget",
                "market_place", map("id", 17),
                "contacts", List.of(map("name", "Ann", "address", map("city", "Oslo"))))))
                .isInstanceOf(ApplicationException.class)
                .hasMessage("Nested input for 'address' exceeds the maximum upsert depth of 1.")
                .satisfies(thrown -> assertThat(((ApplicationException) thrown).getDescriptor())
                        .isEqualTo(ServerError.UPSERT_DEPTH_EXCEEDED));

        for (String table : List.of("product", "contact", "address", "product_contact", "info")) {
            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class)).as(table).isZero();
        }
    }

    @Test
    void updateItem_nestedEntryWithUnknownId_failsAndRollsBack() {
        Map<String, Object> created = products().createItem(AUTH, map(
                "name", "Widget",
                "market_place", map("id", 17),
                "orders", List.of(map("quantity", 1))));
        Object orderId = list(created, "orders").get(0).get("id");

        assertThatThrownBy(() -> products().updateItem(AUTH, created.get("id"), map(
                "name", "Gadget",
                "orders", List.of(map("quantity", 2), map("id", 999, "quantity", 3))), true))
                .isInstanceOf(ApplicationException.class)
                .hasMessage("Unable to find entity to update: 999")
                .satisfies(thrown -> assertThat(((ApplicationException) thrown).getDescriptor())
                        .isEqualTo(ServerError.ENTITY_TO_UPDATE_NOT_FOUND));

        assertThat(jdbc.queryForList("SELECT id FROM orders", Integer.class)).containsExactly((Integer) orderId);
        assertThat(jdbc.queryForObject("SELECT status_id FROM orders WHERE id = ?", Integer.class, orderId))
                .isEqualTo(EntityStatus.REGULAR.getId());
        assertThat(jdbc.queryForObject("SELECT name FROM product WHERE id = ?", String.class, created.get("id")))
                .isEqualTo("Widget");
        assertThat(jdbc.queryForMap("SELECT * FROM info WHERE id = ?", created.get("info_id")).get("MODIFIED_AT"))
                .isNull();
    }

    // ==================== DELETE ====================

    @Test
    void deleteItem_defaultConfiguration_archivesWithoutAudit() {
        Map<String, Object> created = products().createItem(AUTH, map("name", "Widget", "market_place", map("id", 17)));

        Map<String, Object> deleted = products().deleteItem(AUTH, created.get("id"));

        assertThat(deleted.get("status_id")).isEqualTo(EntityStatus.REGULAR.getId());
        assertThat(jdbc.queryForObject("SELECT status_id FROM product WHERE id = ?", Integer.class, created.get("id")))
                .isEqualTo(EntityStatus.ARCHIVED.getId());
        assertThat(jdbc.queryForMap("SELECT * FROM info WHERE id = ?", created.get("info_id")).get("DELETED_AT"))
                .isNull();
    }

    @Test
    void deleteItem_deletedStatus_stampsAudit() {
        EntityDataProvider<Map<String, Object>> provider =
                factory.create(productConfig().softDeleteStatus(EntityStatus.DELETED).build());
        Map<String, Object> created = provider.createItem(AUTH, map("name", "Widget", "market_place", map("id", 17)));

        provider.deleteItem(AUTH, created.get("id"));

        assertThat(jdbc.queryForObject("SELECT status_id FROM product WHERE id = ?", Integer.class, created.get("id")))
                .isEqualTo(EntityStatus.DELETED.getId());
        Map<String, Object> info = jdbc.queryForMap("SELECT * FROM info WHERE id = ?", created.get("info_id"));
        assertThat(info.get("DELETED_BY_ID")).isEqualTo(7);
        assertThat(info.get("DELETED_AT")).isNotNull();
    }

    @Test
    void deleteItem_withoutStatus_destroysRow() {
        EntityDataProvider<Map<String, Object>> notes = factory.create(EntityServiceConfig.builder()
                .entity("product_note")
                .permissionDefinitions(List.of())
                .build());
        Integer product = insertProduct("Widget", 17);
        jdbc.update("INSERT INTO product_note (product_id, body) VALUES (?, 'temporary')", product);
        Integer note = jdbc.queryForObject("SELECT MAX(id) FROM product_note", Integer.class);

        notes.deleteItem(AUTH, note);

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM product_note", Integer.class)).isZero();
    }
}
