package com.phillippitts.callintel.repository;

import com.phillippitts.callintel.domain.PromptOverrides;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;

@Repository
public class JdbcUserPromptRepository implements UserPromptRepository {

    private static final String SELECT_OVERRIDES = """
            SELECT openai_individual_prompt_id, openai_complete_prompt_id
            FROM users
            WHERE id = :userId
            """;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcUserPromptRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
    }

    @Override
    public PromptOverrides findPromptOverrides(String userId) {
        if (userId == null) {
            return PromptOverrides.none();
        }
        List<PromptOverrides> rows = jdbc.query(SELECT_OVERRIDES,
                new MapSqlParameterSource("userId", userId),
                (rs, rowNum) -> new PromptOverrides(
                        rs.getString("openai_individual_prompt_id"),
                        rs.getString("openai_complete_prompt_id")));
        return rows.isEmpty() ? PromptOverrides.none() : rows.get(0);
    }
}
