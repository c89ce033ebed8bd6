package io.deskrelay.model;

import io.deskrelay.error.UnknownTypeException;
import io.deskrelay.error.ValidationException;
import io.deskrelay.handler.EchoHandler;
import io.deskrelay.handler.HandlerRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

final class TaskFactoryTest {
    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(42_000L), ZoneOffset.UTC);
    private final TaskFactory factory = new TaskFactory(
            HandlerRegistry.builder(Duration.ofSeconds(5))
                    .register(EchoHandler.TYPE, EchoHandler.SHAPE, new EchoHandler())
                    .build(),
            clock
    );

    @Test
    void createsUnownedPendingTask() {
        Task task = factory.create("echo", Map.of("msg", "hello"), "alpha");
        Assertions.assertTrue(task.id().startsWith("tsk_"));
        Assertions.assertEquals(TaskStatus.PENDING, task.status());
        Assertions.assertNull(task.owner());
        Assertions.assertEquals("alpha", task.origin());
        Assertions.assertEquals(42_000L, task.createdAtMs());
        Assertions.assertEquals(42_000L, task.updatedAtMs());
        Assertions.assertNull(task.result());
    }

    @Test
    void idsAreUnique() {
        Task a = factory.create("echo", Map.of("msg", "a"), "alpha");
        Task b = factory.create("echo", Map.of("msg", "a"), "alpha");
        Assertions.assertNotEquals(a.id(), b.id());
    }

    @Test
    void rejectsBlankAndUnknownTypes() {
        ValidationException blank = Assertions.assertThrows(ValidationException.class,
                () -> factory.create(" ", Map.of(), "alpha"));
        Assertions.assertEquals("type", blank.field());

        UnknownTypeException unknown = Assertions.assertThrows(UnknownTypeException.class,
                () -> factory.create("launch_rocket", Map.of(), "alpha"));
        Assertions.assertEquals("type", unknown.field());
        Assertions.assertEquals("launch_rocket", unknown.type());
    }

    @Test
    void rejectsPayloadThatDoesNotFitTheHandler() {
        ValidationException missing = Assertions.assertThrows(ValidationException.class,
                () -> factory.create("echo", Map.of(), "alpha"));
        Assertions.assertEquals("payload.msg", missing.field());

        ValidationException wrongKind = Assertions.assertThrows(ValidationException.class,
                () -> factory.create("echo", Map.of("msg", 5), "alpha"));
        Assertions.assertEquals("payload.msg", wrongKind.field());
    }
}
