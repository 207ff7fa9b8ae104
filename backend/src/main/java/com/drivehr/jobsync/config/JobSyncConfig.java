package com.drivehr.jobsync.config;

import com.drivehr.jobsync.sync.ratelimit.InMemoryRateWindowStore;
import com.drivehr.jobsync.sync.ratelimit.JdbcRateWindowStore;
import com.drivehr.jobsync.sync.ratelimit.RateWindowStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.Clock;
import java.util.Locale;

@Configuration
public class JobSyncConfig {
    private static final Logger log = LoggerFactory.getLogger(JobSyncConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateWindowStore rateWindowStore(
        JobSyncProperties properties,
        NamedParameterJdbcTemplate jdbc,
        Clock clock
    ) {
        String store = properties.getRateLimit().getStore();
        String normalized = store == null ? "memory" : store.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "jdbc":
                return new JdbcRateWindowStore(jdbc, clock);
            case "memory":
                return new InMemoryRateWindowStore(clock);
            default:
                log.warn("Unknown rate limit store '{}'; falling back to in-memory windows", store);
                return new InMemoryRateWindowStore(clock);
        }
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
