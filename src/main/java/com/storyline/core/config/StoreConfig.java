package com.storyline.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyline.core.escalation.EscalationManager;
import com.storyline.core.model.AgentStatusTable;
import com.storyline.core.model.EscalationLog;
import com.storyline.core.model.TaskQueueState;
import com.storyline.core.monitor.AgentStatusMonitor;
import com.storyline.core.monitor.PipelineRouting;
import com.storyline.core.persistence.JsonFileStore;
import com.storyline.core.persistence.StoreMapper;
import com.storyline.core.queue.TaskQueue;
import com.storyline.worker.DeliverableStore;
import com.storyline.worker.OutboxTaskDispatcher;
import com.storyline.worker.TaskDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring {@link Configuration} wiring the file-backed stores under
 * {@code storyline.storage.directory}.
 * <p>
 * Each store loads its file once on creation and rewrites it on every mutation.
 * A missing file starts the store empty.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Snake-case, ISO-8601 mapper shared by the stores, the outbox and the CLI's backlog reader.
     */
    @Bean
    public ObjectMapper storeObjectMapper() {
        return StoreMapper.create();
    }

    @Bean
    public TaskQueue taskQueue(StorylineProperties properties, PipelineRouting routing,
                               ObjectMapper storeObjectMapper, Clock clock) {
        log.info("Task queue at {} (phases {})", properties.getTaskQueuePath(), properties.getPhases());
        var store = new JsonFileStore<>(properties.getTaskQueuePath(), TaskQueueState.class,
                storeObjectMapper, TaskQueueState::empty);
        return new TaskQueue(store, routing, properties.getPhases(), clock);
    }

    @Bean
    public AgentStatusMonitor agentStatusMonitor(StorylineProperties properties, PipelineRouting routing,
                                                 ObjectMapper storeObjectMapper, Clock clock) {
        var store = new JsonFileStore<>(properties.getAgentStatusPath(), AgentStatusTable.class,
                storeObjectMapper, AgentStatusTable::empty);
        return new AgentStatusMonitor(store, routing, clock);
    }

    @Bean
    public EscalationManager escalationManager(StorylineProperties properties,
                                               ObjectMapper storeObjectMapper, Clock clock) {
        var store = new JsonFileStore<>(properties.getEscalationsPath(), EscalationLog.class,
                storeObjectMapper, EscalationLog::empty);
        return new EscalationManager(store, clock);
    }

    @Bean
    public DeliverableStore deliverableStore(StorylineProperties properties, ObjectMapper storeObjectMapper) {
        return new DeliverableStore(properties.getDeliverablesPath(), storeObjectMapper);
    }

    /**
     * Outbox dispatcher, used unless another {@link TaskDispatcher} is defined.
     */
    @Bean
    @ConditionalOnMissingBean(TaskDispatcher.class)
    public TaskDispatcher outboxTaskDispatcher(StorylineProperties properties, ObjectMapper storeObjectMapper) {
        log.info("Dispatching tasks to outbox {}", properties.getOutboxPath());
        return new OutboxTaskDispatcher(properties.getOutboxPath(), storeObjectMapper);
    }
}
