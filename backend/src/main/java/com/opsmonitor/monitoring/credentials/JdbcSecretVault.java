package com.opsmonitor.monitoring.credentials;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Table-backed vault. Deployments with an external secret manager replace this bean.
 */
@Repository
public class JdbcSecretVault implements SecretVault {
    private final NamedParameterJdbcTemplate jdbc;

    public JdbcSecretVault(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public String getSecret(UUID orgId, SecretProvider provider, String secretType) {
        List<String> values = jdbc.query(
            """
                SELECT secret_value
                FROM integration_secrets
                WHERE org_id = :orgId
                  AND provider = :provider
                  AND secret_type = :secretType
                """,
            params(orgId, provider, secretType),
            (rs, rowNum) -> rs.getString("secret_value")
        );
        return values.isEmpty() ? null : values.get(0);
    }

    @Override
    @Transactional
    public void storeSecret(UUID orgId, SecretProvider provider, String secretType, String value) {
        MapSqlParameterSource params = params(orgId, provider, secretType)
            .addValue("secretValue", value)
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                DELETE FROM integration_secrets
                WHERE org_id = :orgId
                  AND provider = :provider
                  AND secret_type = :secretType
                """,
            params
        );
        jdbc.update(
            """
                INSERT INTO integration_secrets (org_id, provider, secret_type, secret_value, updated_at)
                VALUES (:orgId, :provider, :secretType, :secretValue, :now)
                """,
            params
        );
    }

    @Override
    public boolean deleteSecret(UUID orgId, SecretProvider provider, String secretType) {
        int deleted = jdbc.update(
            """
                DELETE FROM integration_secrets
                WHERE org_id = :orgId
                  AND provider = :provider
                  AND secret_type = :secretType
                """,
            params(orgId, provider, secretType)
        );
        return deleted > 0;
    }

    @Override
    public int deleteProvider(UUID orgId, SecretProvider provider) {
        return jdbc.update(
            """
                DELETE FROM integration_secrets
                WHERE org_id = :orgId
                  AND provider = :provider
                """,
            new MapSqlParameterSource()
                .addValue("orgId", orgId)
                .addValue("provider", provider.key())
        );
    }

    private MapSqlParameterSource params(UUID orgId, SecretProvider provider, String secretType) {
        return new MapSqlParameterSource()
            .addValue("orgId", orgId)
            .addValue("provider", provider.key())
            .addValue("secretType", secretType);
    }
}
