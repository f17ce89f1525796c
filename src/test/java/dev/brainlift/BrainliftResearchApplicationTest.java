package dev.brainlift;

import dev.brainlift.graph.GraphResearchEngine;
import dev.brainlift.research.ResearchEngine;
import dev.brainlift.session.ResearchSessionService;
import dev.brainlift.worker.WorkerPoolManager;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

class BrainliftResearchApplicationTest {

    @Nested
    @SpringBootTest
    @ActiveProfiles("test")
    class DefaultEngine {

        @Autowired
        ResearchEngine engine;

        @Autowired
        ResearchSessionService sessionService;

        @Test
        void contextLoadsWithTheWorkerPool() {
            assertThat(engine).isInstanceOf(WorkerPoolManager.class);
            assertThat(sessionService.getWorkerStatuses()).hasSize(3);
        }
    }

    @Nested
    @SpringBootTest(properties = "brainlift.research.engine=graph")
    @ActiveProfiles("test")
    class GraphEngine {

        @Autowired
        ResearchEngine engine;

        @Test
        void contextLoadsWithTheWorkflowGraph() {
            assertThat(engine).isInstanceOf(GraphResearchEngine.class);
            assertThat(engine.getWorkerStatuses()).hasSize(3);
        }
    }
}
