package com.ivamare.ordersession.event;

import com.ivamare.ordersession.SessionFixtures;
import com.ivamare.ordersession.model.DiscountKind;
import com.ivamare.ordersession.model.DiscountScope;
import com.ivamare.ordersession.model.LineModifier;
import com.ivamare.ordersession.model.SessionType;
import com.ivamare.ordersession.model.Totals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SessionEventCodec")
class SessionEventCodecTest {

    private final SessionEventCodec codec = new SessionEventCodec();

    @Nested
    @DisplayName("encode/decode")
    class RoundTripTests {

        @Test
        @DisplayName("should restore an item with its captured price and rules")
        void shouldRestoreItemAdded() {
            ItemAdded event = new ItemAdded(UUID.randomUUID(), 42L, 7L, "Burger", 2, new BigDecimal("12.5"),
                List.of(new LineModifier("extra cheese", new BigDecimal("1.5"))), List.of("happy-hour"), "medium",
                SessionFixtures.NOW);

            SessionEvent decoded = codec.decode(ItemAdded.TYPE, codec.encode(event));

            assertEquals(event, decoded);
            assertEquals(new BigDecimal("12.50"), ((ItemAdded) decoded).unitPrice());
        }

        @Test
        @DisplayName("should write session types and timestamps as text")
        void shouldWriteReadableJson() {
            SessionInitiated event = new SessionInitiated(UUID.randomUUID(), 3L, 7L, SessionType.DINE_IN, 5, 4,
                Map.of("source", "pos"), SessionFixtures.NOW);

            String json = codec.encode(event);

            assertTrue(json.contains("\"sessionType\":\"dine_in\""), json);
            assertTrue(json.contains("\"initiatedAt\":\"2024-03-01T18:30:00Z\""), json);
            assertEquals(event, codec.decode(SessionInitiated.TYPE, json));
        }

        @Test
        @DisplayName("should decode metadata values that are null")
        void shouldDecodeNullMetadataValue() {
            String json = "{\"sessionId\":\"" + UUID.randomUUID() + "\",\"locationId\":7,"
                + "\"sessionType\":\"takeout\",\"customerCount\":1,"
                + "\"metadata\":{\"customerName\":null},\"initiatedAt\":\"2024-03-01T18:30:00Z\"}";

            SessionInitiated decoded = (SessionInitiated) codec.decode(SessionInitiated.TYPE, json);

            assertTrue(decoded.metadata().containsKey("customerName"));
            assertNull(decoded.metadata().get("customerName"));
            assertEquals(decoded, codec.decode(SessionInitiated.TYPE, codec.encode(decoded)));
        }

        @Test
        @DisplayName("should keep cleared customer fields as nulls")
        void shouldRestoreCustomerInfoEntered() {
            Map<String, String> fields = new HashMap<>();
            fields.put("name", "Ana");
            fields.put("phone", null);
            CustomerInfoEntered event = new CustomerInfoEntered(fields, true, SessionFixtures.NOW);

            String json = codec.encode(event);
            CustomerInfoEntered decoded = (CustomerInfoEntered) codec.decode(CustomerInfoEntered.TYPE, json);

            assertEquals(event, decoded);
            assertTrue(decoded.fields().containsKey("phone"));
            assertTrue(decoded.complete());
        }

        @Test
        @DisplayName("should restore frozen totals on close")
        void shouldRestoreSessionClosed() {
            Totals totals = new Totals(new BigDecimal("20"), new BigDecimal("2"), BigDecimal.ZERO, new BigDecimal("18"));
            SessionClosed event = new SessionClosed(totals, BigDecimal.ZERO, "manager", SessionFixtures.NOW);

            SessionClosed decoded = (SessionClosed) codec.decode(SessionClosed.TYPE, codec.encode(event));

            assertEquals(new BigDecimal("18.00"), decoded.totals().grandTotal());
            assertEquals("manager", decoded.closedBy());
        }
    }

    @Nested
    @DisplayName("tolerance")
    class ToleranceTests {

        @Test
        @DisplayName("should decode unregistered types as unknown events")
        void shouldDecodeUnknownType() {
            SessionEvent decoded = codec.decode("TableMoved", "{\"from\":5,\"to\":9}");

            UnknownSessionEvent unknown = assertInstanceOf(UnknownSessionEvent.class, decoded);
            assertEquals("TableMoved", unknown.type());
            assertEquals(9, unknown.payload().get("to"));
        }

        @Test
        @DisplayName("should keep an unknown payload when encoding it again")
        void shouldReEncodeUnknownPayload() {
            UnknownSessionEvent unknown = new UnknownSessionEvent("TableMoved", Map.of("to", 9));

            assertEquals("{\"to\":9}", codec.encode(unknown));
        }

        @Test
        @DisplayName("should ignore properties it does not know")
        void shouldIgnoreUnknownProperties() {
            String json = "{\"reason\":\"walked out\",\"voidedBy\":\"staff-3\",\"voidedAt\":\"2024-03-01T18:30:00Z\","
                + "\"approvedBy\":\"manager\"}";

            SessionVoided decoded = (SessionVoided) codec.decode(SessionVoided.TYPE, json);

            assertEquals("walked out", decoded.reason());
            assertEquals(SessionFixtures.NOW, decoded.voidedAt());
        }

        @Test
        @DisplayName("should default a missing discount scope to the whole session")
        void shouldDefaultMissingScope() {
            String json = "{\"discountId\":\"" + UUID.randomUUID() + "\",\"kind\":\"PERCENTAGE\",\"value\":10}";

            DiscountApplied decoded = (DiscountApplied) codec.decode(DiscountApplied.TYPE, json);

            assertEquals(DiscountKind.PERCENTAGE, decoded.kind());
            assertEquals(DiscountScope.SESSION, decoded.scope());
            assertEquals(new BigDecimal("10.00"), decoded.value());
            assertNull(decoded.lineId());
        }

        @Test
        @DisplayName("should fail on malformed JSON")
        void shouldFailOnMalformedJson() {
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> codec.decode(ItemAdded.TYPE, "{not json"));
            assertTrue(ex.getMessage().contains(ItemAdded.TYPE));
        }
    }

    @Test
    @DisplayName("should register every concrete event type")
    void shouldRegisterKnownTypes() {
        assertEquals(9, SessionEventCodec.knownTypes().size());
        assertTrue(SessionEventCodec.knownTypes().contains(CustomerInfoEntered.TYPE));
        assertTrue(SessionEventCodec.knownTypes().contains(PaymentRecorded.TYPE));
        assertFalse(SessionEventCodec.knownTypes().contains("TableMoved"));
    }
}
