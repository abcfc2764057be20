package com.example.callbackscheduler.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Cluster-wide locks for the two periodic jobs of the scheduler.
 * <p>
 * Each callback is claimed by its own pending to running update, so two
 * instances that both hold no lock still never fire the same occurrence twice.
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "5m")
public class ShedLockConfig {

    /** Held by the instance that dispatches the current minute. */
    public static final String TICK_LOCK = "callbackTick";

    /** Held while overdue pending rows are swept after downtime. */
    public static final String CATCHUP_LOCK = "callbackCatchup";

    static final String LOCK_TABLE = "shedlock";

    /**
     * Lock rows for {@value #TICK_LOCK} and {@value #CATCHUP_LOCK} live next to the
     * task table. Expiry is judged by the database clock, since the minute
     * boundaries of different instances may drift apart.
     */
    @Bean
    public LockProvider lockProvider(DataSource dataSource) {
        return new JdbcTemplateLockProvider(
                JdbcTemplateLockProvider.Configuration.builder()
                        .withJdbcTemplate(new JdbcTemplate(dataSource))
                        .withTableName(LOCK_TABLE)
                        .usingDbTime()
                        .build()
        );
    }
}
