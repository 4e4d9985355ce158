package com.planner.database.config;

import com.planner.database.connection.ConnectionPool;
import com.planner.database.connection.ConnectionPoolMetrics;
import com.planner.database.connection.SessionContextBinder;
import com.planner.database.scope.RequestScopeManager;
import com.planner.database.session.DatabaseSessionFactory;
import com.planner.database.session.jdbc.JdbcDatabaseSessionFactory;
import com.planner.security.IdentityResolver;
import com.planner.security.SecurityProperties;
import java.time.Clock;
import javax.sql.DataSource;
import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;

/**
 * Wires credential resolution, the connection pool, the context binder and the request scope
 * manager from {@link SecurityProperties} and {@link TenantDataProperties}.
 * <p>
 * Every bean backs off when the application defines its own, which is how tests swap the JDBC
 * session factory for an in-memory one.
 */
@AutoConfiguration
@EnableConfigurationProperties({TenantDataProperties.class, SecurityProperties.class})
public class TenantDataAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TenantDataAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentityResolver identityResolver(SecurityProperties securityProperties, Clock clock) {
        return securityProperties.identityResolver(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DatabaseSessionFactory databaseSessionFactory(TenantDataProperties properties) {
        if (properties.url() == null || properties.url().isBlank()) {
            throw new IllegalStateException("planner.datasource.url must be set");
        }
        DataSource dataSource = DataSourceBuilder.create()
                .type(PGSimpleDataSource.class)
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
        log.info("Database sessions will be opened against {}", properties.url());
        return new JdbcDatabaseSessionFactory(dataSource, properties.pool().statementTimeout());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ConnectionPool connectionPool(DatabaseSessionFactory sessionFactory, TenantDataProperties properties) {
        TenantDataProperties.Pool pool = properties.pool();
        log.info("Connection pool capacity {}, acquire timeout {}", pool.size(), pool.acquireTimeout());
        return new ConnectionPool(sessionFactory, pool.size(), pool.validateOnAcquire(), pool.validationTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionContextBinder sessionContextBinder(TenantDataProperties properties, Clock clock) {
        return new SessionContextBinder(properties.rls().toSettings(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestScopeManager requestScopeManager(IdentityResolver identityResolver, ConnectionPool pool,
                                                   SessionContextBinder binder, TenantDataProperties properties) {
        return new RequestScopeManager(identityResolver, pool, binder, properties.pool().acquireTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionPoolMetrics connectionPoolMetrics(ConnectionPool pool, SessionContextBinder binder,
                                                       @Value("${spring.application.name:planner}") String serviceName) {
        return new ConnectionPoolMetrics(pool, binder, serviceName);
    }
}
