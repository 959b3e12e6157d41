package com.concierge.app.config;

import com.concierge.core.queue.TaskQueue;
import com.concierge.core.repository.EventRepository;
import com.concierge.core.repository.ScheduledJobRepository;
import com.concierge.core.repository.TaskRepository;
import com.concierge.engine.persistence.InMemoryEventRepository;
import com.concierge.engine.persistence.InMemoryScheduledJobRepository;
import com.concierge.engine.persistence.InMemoryTaskQueue;
import com.concierge.engine.persistence.InMemoryTaskRepository;
import com.concierge.engine.persistence.jdbc.JdbcEventRepository;
import com.concierge.engine.persistence.jdbc.JdbcScheduledJobRepository;
import com.concierge.engine.persistence.jdbc.JdbcTaskQueue;
import com.concierge.engine.persistence.jdbc.JdbcTaskRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Store and queue beans for the two persistence modes.
 *
 * {@code concierge.persistence=memory} (default) keeps everything in process;
 * {@code concierge.persistence=jdbc} uses PostgreSQL for tasks, events, scheduled
 * jobs and the task queue.
 */
@Configuration
public class PersistenceConfiguration {

    static final String PREFIX = "concierge";
    static final String PROPERTY = "persistence";

    @Configuration
    @ConditionalOnProperty(prefix = PREFIX, name = PROPERTY, havingValue = "memory", matchIfMissing = true)
    static class InMemory {

        @Bean
        public TaskRepository taskRepository() {
            return new InMemoryTaskRepository();
        }

        @Bean
        public EventRepository eventRepository() {
            return new InMemoryEventRepository();
        }

        @Bean
        public ScheduledJobRepository scheduledJobRepository() {
            return new InMemoryScheduledJobRepository();
        }

        @Bean
        public TaskQueue taskQueue() {
            return new InMemoryTaskQueue();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = PREFIX, name = PROPERTY, havingValue = "jdbc")
    static class Jdbc {

        @Bean
        public DataSource dataSource(ConciergeProperties properties) {
            ConciergeProperties.Jdbc jdbc = properties.getJdbc();
            HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(jdbc.getUrl())
                .username(jdbc.getUsername())
                .password(jdbc.getPassword())
                .build();
            dataSource.setMaximumPoolSize(jdbc.getMaximumPoolSize());
            dataSource.setPoolName("concierge-db");
            return dataSource;
        }

        @Bean
        public TaskRepository taskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcTaskRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public EventRepository eventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcEventRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public ScheduledJobRepository scheduledJobRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcScheduledJobRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public TaskQueue taskQueue(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcTaskQueue(jdbcTemplate, objectMapper);
        }
    }
}
