package com.example.airbytemonitor;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;

import static com.example.airbytemonitor.Fixtures.connection;
import static com.example.airbytemonitor.Fixtures.fullConnection;
import static com.example.airbytemonitor.Fixtures.list;
import static org.junit.Assert.*;

public class ConnectionAggregatorTest {

    private ConnectionAggregator aggregator;
    private ConnectionIndex index;

    @Before
    public void setUp() {
        aggregator = new ConnectionAggregator();
        index = new ConnectionIndex();
    }

    @Test
    public void testCountsActiveConnections() {
        ConnectionSummary summary = aggregator.aggregate(list(
                connection("c1", "Foo", "active"),
                connection("c2", "Bar", "inactive"),
                connection("c3", "Baz", "deprecated"),
                connection("c4", "Qux", "active")), index);

        assertEquals(2, summary.activeConnections());
        assertEquals(4, summary.connections().size());
        assertEquals(1, summary.connections().get(0).statusValue());
        assertEquals(0, summary.connections().get(1).statusValue());
    }

    @Test
    public void testReadsAllConnectionFields() {
        ConnectionSummary summary = aggregator.aggregate(list(fullConnection("c1", "Foo", "active", 3)), index);

        Connection connection = summary.connections().get(0);
        assertEquals("c1", connection.connectionId());
        assertEquals("Foo", connection.name());
        assertEquals("src-c1", connection.sourceId());
        assertEquals("dst-c1", connection.destinationId());
        assertEquals("cron", connection.scheduleType());
        assertEquals("us", connection.dataResidency());
        assertEquals("propagate_columns", connection.nonBreakingSchemaUpdatesBehavior());
        assertEquals("destination", connection.namespaceDefinition());
        assertEquals("raw_", connection.prefix());
        assertEquals(1700000000L, connection.createdAt());
        assertEquals(3, connection.streamsCount());
    }

    @Test
    public void testMissingFieldsDefaultToUnknown() {
        ObjectNode bare = Fixtures.MAPPER.createObjectNode();
        bare.put("connectionId", "c9");

        Connection connection = aggregator.aggregate(list(bare), index).connections().get(0);

        assertEquals("unknown", connection.name());
        assertEquals("unknown", connection.sourceId());
        assertEquals("unknown", connection.destinationId());
        assertEquals("unknown", connection.scheduleType());
        assertEquals("unknown", connection.dataResidency());
        assertEquals("unknown", connection.nonBreakingSchemaUpdatesBehavior());
        assertEquals("unknown", connection.namespaceDefinition());
        assertEquals("unknown", connection.prefix());
        assertEquals(0L, connection.createdAt());
        assertEquals(0, connection.streamsCount());
        assertEquals(0, connection.statusValue());
    }

    @Test
    public void testPopulatesConnectionIndex() {
        aggregator.aggregate(list(connection("c1", "Foo", "active"), connection("c2", "Bar", "inactive")), index);

        assertEquals(2, index.size());
        assertEquals("Foo", index.nameOf("c1"));
        assertEquals("Bar", index.nameOf("c2"));
        assertEquals("unknown", index.nameOf("c3"));
    }

    @Test
    public void testIndexIsRebuiltEveryCycle() {
        aggregator.aggregate(list(connection("c1", "Foo", "active"), connection("c2", "Bar", "active")), index);
        aggregator.aggregate(list(connection("c2", "Bar renamed", "active")), index);

        assertEquals(1, index.size());
        assertEquals("unknown", index.nameOf("c1"));
        assertEquals("Bar renamed", index.nameOf("c2"));
    }

    @Test
    public void testEmptyConnectionListClearsIndex() {
        aggregator.aggregate(list(connection("c1", "Foo", "active")), index);

        ConnectionSummary summary = aggregator.aggregate(Collections.emptyList(), index);

        assertEquals(0, summary.activeConnections());
        assertEquals(0, index.size());
    }
}
