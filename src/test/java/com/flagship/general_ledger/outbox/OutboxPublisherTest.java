package com.flagship.general_ledger.outbox;

import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryStore;
import com.flagship.general_ledger.journal.Reversal;
import com.flagship.general_ledger.support.LedgerFixtures;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;

import static com.flagship.general_ledger.support.LedgerFixtures.ACTOR;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox to Kafka: events are published keyed by aggregate, in commit order,
 * and marked published only after the broker acknowledged them.
 */
@SpringBootTest
@Import(LedgerFixtures.class)
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("general_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        // Publisher bean is needed, but publishing is triggered by the tests
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private JournalEntryStore store;

    @Autowired
    private LedgerFixtures fixtures;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    private UUID voucherTypeId;
    private UUID periodId;
    private UUID cash;
    private UUID sales;
    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        fixtures.reset();
        voucherTypeId = fixtures.voucherType("CI");
        periodId = fixtures.january2024();
        cash = fixtures.debitAccount("1105", "Cash");
        sales = fixtures.creditAccount("4135", "Sales");

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(ledgerEventsTopic));

        System.out.println("\n--- Test Setup ---");
        System.out.println("Kafka bootstrap servers: " + kafka.getBootstrapServers());
        System.out.println("Topic: " + ledgerEventsTopic);
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private JournalEntry postEntry(String amount) {
        JournalEntry draft = store.create(
            fixtures.entry(voucherTypeId, periodId, LocalDate.of(2024, 1, 5), cash, sales, amount), ACTOR);
        return store.post(draft.getId(), ACTOR);
    }

    @Test
    @DisplayName("Posted entry event reaches Kafka keyed by entry id and is marked published")
    void publishesPostedEntry() {
        printTestHeader("Publisher Sends Events to Kafka");

        // Given: a posted entry, whose event waits in the outbox
        JournalEntry posted = postEntry("100.00");
        assertEquals(1, outboxService.countUnpublished());

        // When
        outboxPublisher.triggerPublish();

        // Then
        assertEquals(0, outboxService.countUnpublished(), "All events should be published");
        assertNotNull(outboxService.getEventsForAggregate(posted.getId()).get(0).getPublishedAt());

        List<ConsumerRecord<String, String>> records = consumeRecords(Set.of(posted.getId().toString()), 1, 10000);
        assertEquals(1, records.size());
        ConsumerRecord<String, String> record = records.get(0);
        System.out.println("Record key: " + record.key());
        System.out.println("Record value: " + record.value());

        assertEquals(posted.getId().toString(), record.key(), "Message key should be the entry id");
        assertEquals("JournalEntryPosted", header(record, OutboxPublisher.EVENT_TYPE_HEADER));
        assertEquals(OutboxService.JOURNAL_ENTRY, header(record, OutboxPublisher.AGGREGATE_TYPE_HEADER));
        assertTrue(record.value().contains(posted.getEntryNumber()));

        printSuccess("Event published to Kafka and marked as published");
    }

    @Test
    @DisplayName("Events of one entry arrive in the order they were committed")
    void preservesOrderPerEntry() {
        printTestHeader("Per-Entry Ordering");

        JournalEntry posted = postEntry("50.00");
        Reversal reversal = store.reverse(posted.getId(), null, "Duplicate", ACTOR);

        outboxPublisher.triggerPublish();

        List<ConsumerRecord<String, String>> records = consumeRecords(
            Set.of(posted.getId().toString(), reversal.getReversal().getId().toString()), 3, 10000);
        assertEquals(3, records.size());

        List<String> originalEvents = new ArrayList<>();
        for (ConsumerRecord<String, String> record : records) {
            System.out.println("Key: " + record.key() + ", Partition: " + record.partition()
                + ", Type: " + header(record, OutboxPublisher.EVENT_TYPE_HEADER));
            if (record.key().equals(posted.getId().toString())) {
                originalEvents.add(header(record, OutboxPublisher.EVENT_TYPE_HEADER));
            } else {
                assertEquals(reversal.getReversal().getId().toString(), record.key());
            }
        }
        assertEquals(List.of("JournalEntryPosted", "JournalEntryReversed"), originalEvents);

        printSuccess("Posted before Reversed on the entry's partition");
    }

    @Test
    @DisplayName("Drafts emit nothing; only posting does")
    void draftsEmitNothing() {
        printTestHeader("Unpublished Count");

        store.create(fixtures.entry(voucherTypeId, periodId, LocalDate.of(2024, 1, 5), cash, sales, "1.00"), ACTOR);
        assertEquals(0, outboxService.countUnpublished());

        for (int i = 0; i < 3; i++) {
            postEntry("10.00");
        }
        assertEquals(3, outboxService.countUnpublished());

        outboxPublisher.triggerPublish();

        assertEquals(0, outboxService.countUnpublished());
        printSuccess("Unpublished count tracking works correctly");
    }

    private static String header(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }

    /**
     * Earlier tests leave their records on the topic; only records keyed by one of the given aggregates count.
     */
    private List<ConsumerRecord<String, String>> consumeRecords(Set<String> keys, int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> allRecords = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && allRecords.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                if (keys.contains(record.key())) {
                    allRecords.add(record);
                }
            }
        }

        return allRecords;
    }
}
