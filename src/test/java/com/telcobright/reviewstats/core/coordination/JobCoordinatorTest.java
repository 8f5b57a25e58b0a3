package com.telcobright.reviewstats.core.coordination;

import com.telcobright.reviewstats.core.aggregation.AggregationQuery;
import com.telcobright.reviewstats.core.aggregation.PartialResult;
import com.telcobright.reviewstats.core.logging.Logger;
import com.telcobright.reviewstats.core.partition.RowRange;
import com.telcobright.reviewstats.core.partition.RowRangePartitioner;
import com.telcobright.reviewstats.core.source.SchemaException;
import com.telcobright.reviewstats.testsupport.CapturingLogger;
import com.telcobright.reviewstats.testsupport.InMemoryRowSource;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JobCoordinatorTest {

    private final CapturingLogger logger = new CapturingLogger();

    private static AggregationQuery bookQuery() {
        return AggregationQuery.builder()
            .groupBy("BId")
            .score("RScore")
            .label("BTitle")
            .build();
    }

    private JobCoordinator coordinatorOver(InMemoryRowSource source) {
        return new JobCoordinator(location -> source, bookQuery(), logger);
    }

    @Test
    void gathersOneResultPerWorkerInWorkerOrder() throws Exception {
        InMemoryRowSource source = InMemoryRowSource.withColumns("BId", "BTitle", "RScore");
        for (int i = 0; i < 10; i++) {
            source.row("b" + i, "Title " + i, "3");
        }
        List<RowRange> ranges = RowRangePartitioner.partition(10, 3);

        GatherOutcome outcome = coordinatorOver(source).execute("books", 10, ranges);

        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.getResults()).hasSize(3);
        assertThat(outcome.getResults().get(0).getAggregates()).containsOnlyKeys("b0", "b1", "b2");
        assertThat(outcome.getResults().get(2).getAggregates()).containsOnlyKeys("b6", "b7", "b8", "b9");
    }

    @Test
    void schemaErrorsComeBackTaggedPerWorker() throws Exception {
        InMemoryRowSource source = InMemoryRowSource.withColumns("BId", "RScore").row("b1", "5").row("b2", "4");

        GatherOutcome outcome = coordinatorOver(source).execute("books", 2, RowRangePartitioner.partition(2, 2));

        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.getResults()).isEmpty();
        assertThat(outcome.getErrors()).containsExactly(
            "[worker 1] SchemaException: Column 'BTitle' not found in dataset.",
            "[worker 2] SchemaException: Column 'BTitle' not found in dataset.");
    }

    @Test
    void gatherFilesMessagesBySenderWhateverTheArrivalOrder() throws Exception {
        MessageBus bus = new MessageBus(3);
        PartialResult first = new PartialResult(Collections.emptyMap(), 1);
        PartialResult third = new PartialResult(Collections.emptyMap(), 3);

        bus.send(3, MessageBus.COORDINATOR, Channel.RESULT, third);
        bus.send(2, MessageBus.COORDINATOR, Channel.ERROR, "IOException: disk gone");
        bus.send(1, MessageBus.COORDINATOR, Channel.RESULT, first);

        GatherOutcome outcome = coordinatorOver(InMemoryRowSource.withColumns("BId")).gather(bus);

        assertThat(outcome.getErrors()).containsExactly("[worker 2] IOException: disk gone");
        assertThat(outcome.getResults()).containsExactly(first, third);
        assertThat(logger.getLogsByLevel(Logger.Level.WARN))
            .anyMatch(log -> log.message.contains("Worker 2"));
    }

    @Test
    void errorsAreOrderedByWorkerId() throws Exception {
        MessageBus bus = new MessageBus(3);
        bus.send(3, MessageBus.COORDINATOR, Channel.ERROR, "late");
        bus.send(1, MessageBus.COORDINATOR, Channel.ERROR, "early");
        bus.send(2, MessageBus.COORDINATOR, Channel.RESULT, new PartialResult(Collections.emptyMap(), 0));

        GatherOutcome outcome = coordinatorOver(InMemoryRowSource.withColumns("BId")).gather(bus);

        assertThat(outcome.getErrors()).containsExactly("[worker 1] early", "[worker 3] late");
        assertThat(outcome.getResults()).hasSize(1);
    }

    @Test
    void duplicateReportIsAProtocolViolation() {
        MessageBus bus = new MessageBus(2);
        bus.send(1, MessageBus.COORDINATOR, Channel.RESULT, new PartialResult(Collections.emptyMap(), 0));
        bus.send(1, MessageBus.COORDINATOR, Channel.RESULT, new PartialResult(Collections.emptyMap(), 0));

        assertThatThrownBy(() -> coordinatorOver(InMemoryRowSource.withColumns("BId")).gather(bus))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("more than once");
    }

    @Test
    void rangeMessageToCoordinatorIsRejected() {
        MessageBus bus = new MessageBus(1);
        bus.send(1, MessageBus.COORDINATOR, Channel.RANGE, "bogus");

        assertThatThrownBy(() -> coordinatorOver(InMemoryRowSource.withColumns("BId")).gather(bus))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void busRejectsUnknownEndpoints() {
        MessageBus bus = new MessageBus(2);

        assertThatThrownBy(() -> bus.send(3, MessageBus.COORDINATOR, Channel.RESULT, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MessageBus(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(new SchemaException("X").getMessage()).isEqualTo("Column 'X' not found in dataset.");
    }
}
