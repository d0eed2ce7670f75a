package com.flagship.mpesa_bridge.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.mpesa_bridge.transaction.Transaction;
import com.flagship.mpesa_bridge.transaction.event.TransactionCompletedEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditMirrorConsumerTest {

    @Mock
    private IdempotentEventProcessor eventProcessor;

    @Mock
    private AuditMirror auditMirror;

    @Mock
    private Acknowledgment ack;

    private ObjectMapper objectMapper;
    private AuditMirrorConsumer consumer;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        consumer = new AuditMirrorConsumer(eventProcessor, auditMirror, objectMapper);
    }

    private static ConsumerRecord<String, String> record(String key, String value) {
        return new ConsumerRecord<>("transactions", 0, 0L, key, value);
    }

    @Test
    @DisplayName("Completed transaction is mirrored through the idempotent processor")
    @SuppressWarnings("unchecked")
    void mirrorsCompletedTransaction() throws Exception {
        Transaction done = Transaction.pending(UUID.randomUUID(), "254712345678", new BigDecimal("50.00"), "ws_CO_1")
                .succeed("R123");
        TransactionCompletedEvent event = TransactionCompletedEvent.from(done);
        String payload = objectMapper.writeValueAsString(event);

        when(eventProcessor.processEvent(eq(event.getEventId()), eq(TransactionCompletedEvent.EVENT_TYPE),
                eq(done.getId()), eq(AuditMirrorConsumer.CONSUMER_GROUP), any()))
                .thenAnswer(invocation -> {
                    ((Supplier<Object>) invocation.getArgument(4)).get();
                    return true;
                });
        when(auditMirror.mirror(any())).thenReturn(AuditMirror.MirrorResult.MIRRORED);

        consumer.consume(record(done.getId().toString(), payload), ack);

        ArgumentCaptor<TransactionCompletedEvent> mirrored = ArgumentCaptor.forClass(TransactionCompletedEvent.class);
        verify(auditMirror).mirror(mirrored.capture());
        assertEquals(done.getId(), mirrored.getValue().getTransactionId());
        assertEquals("R123", mirrored.getValue().getSettlementCode());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unknown event types are marked skipped")
    void skipsUnknownType() {
        UUID eventId = UUID.randomUUID();
        UUID transactionId = UUID.randomUUID();
        String payload = "{\"eventId\":\"" + eventId + "\",\"transactionId\":\"" + transactionId
                + "\",\"eventType\":\"SomethingElse\"}";

        consumer.consume(record(transactionId.toString(), payload), ack);

        verify(eventProcessor).skipEvent(eq(eventId), eq("SomethingElse"), eq(transactionId),
                eq(AuditMirrorConsumer.CONSUMER_GROUP), anyString());
        verifyNoInteractions(auditMirror);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unparsable messages are acknowledged and dropped")
    void dropsGarbage() {
        consumer.consume(record("k", "not json"), ack);
        consumer.consume(record("k", "{\"eventId\":\"nope\"}"), ack);

        verifyNoInteractions(eventProcessor, auditMirror);
        verify(ack, times(2)).acknowledge();
    }
}
