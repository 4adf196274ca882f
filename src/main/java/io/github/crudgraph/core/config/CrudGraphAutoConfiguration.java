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

import io.github.crudgraph.core.exception.CrudGraphExceptionHandler;
import io.github.crudgraph.core.model.EntityGraph;
import io.github.crudgraph.service.CrudGraphServiceFactory;
import io.github.crudgraph.service.storage.StorageClient;
import io.github.crudgraph.service.storage.StorageConnection;
import io.github.crudgraph.service.storage.jdbc.JdbcStorageClient;
import io.github.crudgraph.web.AuthContextResolver;
import io.github.crudgraph.web.RequestAttributeAuthContextResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Wires the JDBC storage connection and the service factory once the application declares its
 * {@link EntityGraph} and a {@link DataSource} is available.
 */
@Slf4j
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnBean({EntityGraph.class, DataSource.class, PlatformTransactionManager.class})
@EnableConfigurationProperties(CrudGraphProperties.class)
@Import(CrudGraphExceptionHandler.class)
public class CrudGraphAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public StorageConnection crudGraphStorageConnection(EntityGraph graph, DataSource dataSource,
                                                        PlatformTransactionManager transactionManager,
                                                        CrudGraphProperties properties) {
        StorageConnection connection = new StorageConnection();
        connection.initialize(new JdbcStorageClient(
                new NamedParameterJdbcTemplate(dataSource),
                new TransactionTemplate(transactionManager),
                graph,
                properties.getSql().getDatetimeType(),
                properties.getSql().isLogStatements()));

        log.info("✓ CrudGraph storage initialized for {} entities", graph.entities().size());
        return connection;
    }

    @Bean
    @ConditionalOnMissingBean
    public StorageClient crudGraphStorageClient(StorageConnection connection) {
        return connection.client();
    }

    @Bean
    @ConditionalOnMissingBean
    public CrudGraphServiceFactory crudGraphServiceFactory(EntityGraph graph, StorageClient storage,
                                                           CrudGraphProperties properties) {
        return new CrudGraphServiceFactory(graph, storage, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthContextResolver crudGraphAuthContextResolver() {
        return new RequestAttributeAuthContextResolver();
    }
}
