package io.deskrelay.handler;

import io.deskrelay.error.DuplicateTypeException;
import io.deskrelay.error.UnknownTypeException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

final class HandlerRegistryTest {

    @Test
    void resolvesRegisteredTypesWithDefaultTimeout() {
        HandlerRegistry registry = HandlerRegistry.builder(Duration.ofSeconds(30))
                .register(EchoHandler.TYPE, EchoHandler.SHAPE, new EchoHandler())
                .register(FailHandler.TYPE, FailHandler.SHAPE, new FailHandler(), Duration.ofMillis(250))
                .build();

        Assertions.assertEquals(List.of("echo", "fail"), List.copyOf(registry.types()));
        Assertions.assertTrue(registry.contains("echo"));
        Assertions.assertFalse(registry.contains(null));
        Assertions.assertEquals(Duration.ofSeconds(30), registry.resolve("echo").timeout());
        Assertions.assertEquals(Duration.ofMillis(250), registry.resolve("fail").timeout());
        Assertions.assertSame(EchoHandler.SHAPE, registry.resolve("echo").shape());
    }

    @Test
    void unknownTypeIsAValidationFailure() {
        HandlerRegistry registry = HandlerRegistry.builder(Duration.ofSeconds(1)).build();
        UnknownTypeException e = Assertions.assertThrows(UnknownTypeException.class, () -> registry.resolve("nope"));
        Assertions.assertEquals("nope", e.type());
    }

    @Test
    void rejectsDuplicateTypes() {
        HandlerRegistry.Builder builder = HandlerRegistry.builder(Duration.ofSeconds(1))
                .register(EchoHandler.TYPE, EchoHandler.SHAPE, new EchoHandler());
        Assertions.assertThrows(DuplicateTypeException.class,
                () -> builder.register(EchoHandler.TYPE, PayloadShape.empty(), new FailHandler()));
    }

    @Test
    void builtInHandlersBehave() throws Exception {
        HandlerContext echo = new HandlerContext("tsk_1", "echo", 1, "alpha", Map.of("msg", "hello"));
        Assertions.assertEquals(HandlerResult.ok("hello"), new EchoHandler().execute(echo));

        HandlerContext fail = new HandlerContext("tsk_2", "fail", 1, "alpha", Map.of("reason", "disk full"));
        HandlerResult failed = new FailHandler().execute(fail);
        Assertions.assertFalse(failed.success());
        Assertions.assertEquals("disk full", failed.error());
    }
}
