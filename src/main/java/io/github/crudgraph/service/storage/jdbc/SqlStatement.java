package io.github.crudgraph.service.storage.jdbc;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

@Getter
@RequiredArgsConstructor
public class SqlStatement {

    private final String sql;
    private final MapSqlParameterSource parameters;
    private final SelectPlan plan;

    public SqlStatement(String sql, MapSqlParameterSource parameters) {
        this(sql, parameters, null);
    }

    @Override
    public String toString() {
        return sql + " " + parameters.getValues();
    }
}
