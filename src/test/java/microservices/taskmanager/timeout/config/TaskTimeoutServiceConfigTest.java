package microservices.taskmanager.timeout.config;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

class TaskTimeoutServiceConfigTest {

    private final TaskTimeoutServiceConfig config = new TaskTimeoutServiceConfig();

    @Test
    void clock_ShouldUseConfiguredZone() {
        // Act
        Clock clock = config.clock(ZoneId.of("Europe/Paris"));

        // Assert
        assertEquals(ZoneId.of("Europe/Paris"), clock.getZone());
    }

    @Test
    void objectMapper_ShouldWriteInstantsAsIsoText() throws Exception {
        // Act
        String json = config.objectMapper().writeValueAsString(Instant.parse("2026-03-11T09:30:00Z"));

        // Assert
        assertEquals("\"2026-03-11T09:30:00Z\"", json);
    }

    @Test
    void mappingMongoConverter_ShouldNotWriteTypeHints() {
        // Arrange
        MongoDatabaseFactory databaseFactory = mock(MongoDatabaseFactory.class);

        // Act
        MappingMongoConverter converter = config.mappingMongoConverter(databaseFactory, new MongoMappingContext(),
                new MongoCustomConversions(List.of()));

        // Assert
        assertFalse(converter.getTypeMapper().isTypeKey("_class"));
    }

}
