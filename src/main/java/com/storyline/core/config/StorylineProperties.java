package com.storyline.core.config;

import com.storyline.core.model.Phase;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "storyline")
public class StorylineProperties {

    private Storage storage = new Storage();
    private Pipeline pipeline = new Pipeline();
    private Orchestrator orchestrator = new Orchestrator();

    // -- Storage accessors (delegate to nested) --
    public Path getStorageDirectory() { return Path.of(storage.directory); }
    public Path getTaskQueuePath() { return getStorageDirectory().resolve(storage.taskQueueFile); }
    public Path getAgentStatusPath() { return getStorageDirectory().resolve(storage.agentStatusFile); }
    public Path getEscalationsPath() { return getStorageDirectory().resolve(storage.escalationsFile); }
    public Path getDeliverablesPath() { return getStorageDirectory().resolve(storage.deliverablesDirectory); }
    public Path getOutboxPath() { return getStorageDirectory().resolve(storage.outboxDirectory); }

    public List<Phase> getPhases() { return pipeline.phases; }
    public int getMaxDispatchPerCycle() { return orchestrator.maxDispatchPerCycle; }

    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }

    public static class Storage {
        private String directory = ".storyline";
        private String taskQueueFile = "task_queue.json";
        private String agentStatusFile = "agent_status.json";
        private String escalationsFile = "escalations.json";
        private String deliverablesDirectory = "deliverables";
        private String outboxDirectory = "outbox";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public String getTaskQueueFile() { return taskQueueFile; }
        public void setTaskQueueFile(String taskQueueFile) { this.taskQueueFile = taskQueueFile; }
        public String getAgentStatusFile() { return agentStatusFile; }
        public void setAgentStatusFile(String agentStatusFile) { this.agentStatusFile = agentStatusFile; }
        public String getEscalationsFile() { return escalationsFile; }
        public void setEscalationsFile(String escalationsFile) { this.escalationsFile = escalationsFile; }
        public String getDeliverablesDirectory() { return deliverablesDirectory; }
        public void setDeliverablesDirectory(String deliverablesDirectory) { this.deliverablesDirectory = deliverablesDirectory; }
        public String getOutboxDirectory() { return outboxDirectory; }
        public void setOutboxDirectory(String outboxDirectory) { this.outboxDirectory = outboxDirectory; }
    }

    public static class Pipeline {
        /** Phases a story is decomposed into, in pipeline order. */
        private List<Phase> phases = new ArrayList<>(List.of(Phase.values()));

        public List<Phase> getPhases() { return phases; }
        public void setPhases(List<Phase> phases) { this.phases = phases; }
    }

    public static class Orchestrator {
        private int maxDispatchPerCycle = 1;

        public int getMaxDispatchPerCycle() { return maxDispatchPerCycle; }
        public void setMaxDispatchPerCycle(int maxDispatchPerCycle) { this.maxDispatchPerCycle = maxDispatchPerCycle; }
    }
}
