/*
 * Copyright 2025 Sachin Nimbal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.crudgraph.core.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "crudgraph")
public class CrudGraphProperties {

    // ==================== PAGINATION PROPERTIES ====================

    private Pagination pagination = new Pagination();

    @Data
    public static class Pagination {
        /**
         * Page size used when the request has no page_size parameter
         * Default: 25
         */
        @Min(1)
        private int defaultPageSize = 25;

        /**
         * Largest page size a request may ask for
         * Default: 100
         */
        @Min(1)
        private int maximumPageSize = 100;
    }

    // ==================== AUDIT PROPERTIES ====================

    private Audit audit = new Audit();

    @Data
    public static class Audit {
        /**
         * Entity holding created/modified/deleted actor and timestamp columns
         * Default: info
         */
        @NotBlank
        private String entity = "info";

        /**
         * Attribute referencing the audit entity on audited entities
         * Default: info_id
         */
        @NotBlank
        private String foreignKey = "info_id";

        /**
         * Dotted auth metadata path of the acting user id
         * Default: internal.id
         */
        private String actorKey = "internal.id";
    }

    // ==================== STATUS PROPERTIES ====================

    private Status status = new Status();

    @Data
    public static class Status {
        /**
         * Attribute carrying the entity status (regular/archived/deleted)
         * Default: status_id
         */
        @NotBlank
        private String attribute = "status_id";
    }

    // ==================== SQL PROPERTIES ====================

    private Sql sql = new Sql();

    @Data
    public static class Sql {
        /**
         * Cast target of the latest-timestamp expression (DATETIME on MySQL)
         * Default: TIMESTAMP
         */
        @NotBlank
        private String datetimeType = "TIMESTAMP";

        /**
         * Log rendered SQL statements at DEBUG level
         * Default: false
         */
        private boolean logStatements = false;
    }

    // ==================== UPSERT PROPERTIES ====================

    private Upsert upsert = new Upsert();

    @Data
    public static class Upsert {
        /**
         * Maximum nesting of entities in one create/update payload
         * Default: 16
         */
        @Min(1)
        private int maxDepth = 16;
    }

    // ==================== SEARCH PROPERTIES ====================

    private Search search = new Search();

    @Data
    public static class Search {
        /**
         * Fields matched by the q parameter when an entity configures none
         * Default: id, name
         */
        private List<String> defaultFields = new ArrayList<>(List.of("id", "name"));
    }
}
