package com.myscrollr.delivery.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myscrollr.delivery.model.dto.ChangeAction;
import com.myscrollr.delivery.model.dto.ChangeRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CdcEnvelopeParser Tests")
class CdcEnvelopeParserTest {

    private final CdcEnvelopeParser parser = new CdcEnvelopeParser(new ObjectMapper());

    @Nested
    @DisplayName("Accepted shapes")
    class AcceptedShapes {

        @Test
        @DisplayName("Should read a records envelope")
        void shouldReadRecordsEnvelope() {
            List<ChangeRecord> records = parser.parse("""
                    {"records":[{"action":"insert","table_name":"trades","record":{"symbol":"AAPL"}},
                                {"action":"delete","table_name":"games","record":{"id":7}}]}
                    """);

            assertThat(records).hasSize(2);
            assertThat(records.get(0).getAction()).isEqualTo(ChangeAction.INSERT);
            assertThat(records.get(0).stringField("symbol")).isEqualTo("AAPL");
            assertThat(records.get(1).resolveTableName()).isEqualTo("games");
        }

        @Test
        @DisplayName("Should read the emitter's data envelope with metadata table names")
        void shouldReadDataEnvelope() {
            List<ChangeRecord> records = parser.parse("""
                    {"data":[{"action":"update","record":{"id":1},"changes":{"score":3},
                              "metadata":{"table_schema":"public","table_name":"games"},"extra":"ignored"}]}
                    """);

            assertThat(records).singleElement()
                    .satisfies(record -> {
                        assertThat(record.resolveTableName()).isEqualTo("games");
                        assertThat(record.getChanges()).containsEntry("score", 3);
                    });
        }

        @Test
        @DisplayName("Should read a single bare record")
        void shouldReadBareRecord() {
            List<ChangeRecord> records = parser.parse(
                    "{\"action\":\"insert\",\"table_name\":\"user_channels\",\"record\":{\"logto_sub\":\"u\"}}");

            assertThat(records).singleElement()
                    .extracting(ChangeRecord::resolveTableName).isEqualTo("user_channels");
        }
    }

    @Nested
    @DisplayName("Rejected bodies")
    class RejectedBodies {

        @Test
        @DisplayName("Should reject empty bodies and empty arrays")
        void shouldRejectEmpty() {
            assertThatThrownBy(() -> parser.parse("")).isInstanceOf(MalformedEnvelopeException.class);
            assertThatThrownBy(() -> parser.parse("{\"records\":[]}"))
                    .isInstanceOf(MalformedEnvelopeException.class)
                    .hasMessage("No records in request");
            assertThatThrownBy(() -> parser.parse("{}")).isInstanceOf(MalformedEnvelopeException.class);
        }

        @Test
        @DisplayName("Should reject invalid JSON and wrong element types")
        void shouldRejectMalformed() {
            assertThatThrownBy(() -> parser.parse("{\"records\":")).isInstanceOf(MalformedEnvelopeException.class);
            assertThatThrownBy(() -> parser.parse("[1,2]")).isInstanceOf(MalformedEnvelopeException.class);
            assertThatThrownBy(() -> parser.parse("{\"data\":{\"table_name\":\"x\"}}"))
                    .isInstanceOf(MalformedEnvelopeException.class);
        }

        @Test
        @DisplayName("Should reject a batch in which no record is readable")
        void shouldRejectWhenNothingReadable() {
            assertThatThrownBy(() -> parser.parse("{\"records\":[\"text\",{\"table_name\":\"trades\",\"record\":\"oops\"}]}"))
                    .isInstanceOf(MalformedEnvelopeException.class)
                    .hasMessage("No records in request");
        }
    }

    @Nested
    @DisplayName("Partially malformed batches")
    class PartiallyMalformed {

        @Test
        @DisplayName("Should keep well-formed records when a sibling record body is not an object")
        void shouldKeepSiblingsOfUnreadableRecord() {
            List<ChangeRecord> records = parser.parse("""
                    {"records":[{"action":"insert","table_name":"trades","record":{"symbol":"AAPL"}},
                                {"action":"insert","table_name":"trades","record":"oops"}]}
                    """);

            assertThat(records).singleElement()
                    .extracting(record -> record.stringField("symbol")).isEqualTo("AAPL");
        }

        @Test
        @DisplayName("Should skip array elements that are not objects")
        void shouldSkipNonObjectElements() {
            List<ChangeRecord> records = parser.parse("""
                    {"data":["text", 42, {"action":"delete","table_name":"games","record":{"id":7}}]}
                    """);

            assertThat(records).singleElement()
                    .extracting(ChangeRecord::resolveTableName).isEqualTo("games");
        }
    }
}
